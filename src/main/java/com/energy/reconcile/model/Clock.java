package com.energy.reconcile.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * 采样时钟：参考时刻加采样周期，定义一组等间隔网格点 reference + k * period。
 */
public final class Clock {

    private final Instant reference;
    private final int periodSeconds;

    public Clock(Instant reference, int periodSeconds) {
        if (periodSeconds <= 0) {
            throw new IllegalArgumentException("Clock period must be positive, got " + periodSeconds);
        }
        this.reference = Objects.requireNonNull(reference, "reference");
        this.periodSeconds = periodSeconds;
    }

    public Instant getReference() { return reference; }
    public int getPeriodSeconds() { return periodSeconds; }

    public Duration getPeriod() {
        return Duration.ofSeconds(periodSeconds);
    }

    /**
     * 距离 ts 最近的网格点。恰在两点正中时取较早的一点：
     * 与前一网格点的偏移不超过半个周期即归到前一点。
     */
    public Instant nearestGridPoint(Instant ts) {
        long periodMillis = periodSeconds * 1000L;
        long delta = ts.toEpochMilli() - reference.toEpochMilli();
        long k = Math.floorDiv(delta + periodMillis / 2 - 1, periodMillis);
        return reference.plusMillis(k * periodMillis);
    }

    /** ts 到最近网格点的距离 */
    public Duration distanceToGrid(Instant ts) {
        return Duration.between(nearestGridPoint(ts), ts).abs();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Clock)) return false;
        Clock other = (Clock) o;
        return periodSeconds == other.periodSeconds && reference.equals(other.reference);
    }

    @Override
    public int hashCode() {
        return Objects.hash(reference, periodSeconds);
    }

    @Override
    public String toString() {
        return "Clock{reference=" + reference + ", period=" + periodSeconds + "s}";
    }
}
