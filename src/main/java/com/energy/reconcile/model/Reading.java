package com.energy.reconcile.model;

import java.time.Instant;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * 一条读数：时间戳加可能未知的数值。未知与 0 是两回事。
 */
public final class Reading {

    private final Instant timestamp;
    private final OptionalDouble value;

    public Reading(Instant timestamp, OptionalDouble value) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.value = (value != null) ? value : OptionalDouble.empty();
    }

    public Instant getTimestamp() { return timestamp; }
    public OptionalDouble getValue() { return value; }

    public boolean isKnown() {
        return value.isPresent();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Reading)) return false;
        Reading other = (Reading) o;
        return timestamp.equals(other.timestamp) && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value);
    }

    @Override
    public String toString() {
        return timestamp + "=" + (value.isPresent() ? String.valueOf(value.getAsDouble()) : "NA");
    }
}
