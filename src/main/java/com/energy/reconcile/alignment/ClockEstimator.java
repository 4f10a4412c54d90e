package com.energy.reconcile.alignment;

import com.energy.reconcile.model.Clock;
import com.energy.reconcile.model.ClockEstimate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 采样时钟估计器。
 *
 * 对候选偏移 o ∈ [0, p)，总抖动为 Σ min((t+o) mod p, p - (t+o) mod p)，
 * 取总抖动最小的偏移，并列时取最小偏移。时间戳按整秒计算。
 * 先按 t mod p 做直方图，候选偏移的计算量只与周期有关。
 */
public class ClockEstimator {

    private static final Logger log = LoggerFactory.getLogger(ClockEstimator.class);

    /**
     * 求使总抖动最小的偏移。
     *
     * @throws IllegalArgumentException 时间戳为空或周期非正
     */
    public int optimalOffset(List<Instant> timestamps, int periodSeconds) {
        long[] histogram = residueHistogram(timestamps, periodSeconds);
        int best = 0;
        long bestJitter = Long.MAX_VALUE;
        for (int offset = 0; offset < periodSeconds; offset++) {
            long jitter = jitter(histogram, periodSeconds, offset);
            if (jitter < bestJitter) {
                bestJitter = jitter;
                best = offset;
            }
        }
        return best;
    }

    /** 指定偏移下的总抖动（秒） */
    public long totalJitter(List<Instant> timestamps, int periodSeconds, int offset) {
        return jitter(residueHistogram(timestamps, periodSeconds), periodSeconds,
                Math.floorMod(offset, periodSeconds));
    }

    /**
     * 估计时钟相位：reference = min(t) - ((min(t) + o) mod p)。
     */
    public Instant estimatePhase(List<Instant> timestamps, int periodSeconds) {
        int offset = optimalOffset(timestamps, periodSeconds);
        long minSeconds = Long.MAX_VALUE;
        for (Instant ts : timestamps) {
            minSeconds = Math.min(minSeconds, ts.getEpochSecond());
        }
        return Instant.ofEpochSecond(minSeconds - Math.floorMod(minSeconds + offset, (long) periodSeconds));
    }

    public Clock estimateClock(List<Instant> timestamps, int periodSeconds) {
        return new Clock(estimatePhase(timestamps, periodSeconds), periodSeconds);
    }

    /**
     * 为每个设备各估计一个时钟，并基于全部设备的时间戳估计统一时钟。
     */
    public ClockEstimate estimateClocks(Map<String, List<Instant>> timestampsByDevice, int periodSeconds) {
        if (timestampsByDevice.isEmpty()) {
            throw new IllegalArgumentException("At least one device is required to estimate clocks");
        }
        Map<String, Clock> deviceClocks = new LinkedHashMap<>();
        List<Instant> all = new ArrayList<>();
        timestampsByDevice.forEach((device, timestamps) -> {
            Clock clock = estimateClock(timestamps, periodSeconds);
            deviceClocks.put(device, clock);
            all.addAll(timestamps);
            log.info("Device '{}' clock reference {}", device, clock.getReference());
        });
        Clock fleet = estimateClock(all, periodSeconds);
        log.info("Fleet clock reference {} over {} timestamps", fleet.getReference(), all.size());
        return new ClockEstimate(deviceClocks, fleet);
    }

    private static long[] residueHistogram(List<Instant> timestamps, int periodSeconds) {
        if (periodSeconds <= 0) {
            throw new IllegalArgumentException("Period must be positive, got " + periodSeconds);
        }
        if (timestamps == null || timestamps.isEmpty()) {
            throw new IllegalArgumentException("At least one timestamp is required to estimate a clock");
        }
        long[] histogram = new long[periodSeconds];
        for (Instant ts : timestamps) {
            histogram[(int) Math.floorMod(ts.getEpochSecond(), (long) periodSeconds)]++;
        }
        return histogram;
    }

    private static long jitter(long[] histogram, int period, int offset) {
        long total = 0;
        for (int residue = 0; residue < period; residue++) {
            if (histogram[residue] == 0) continue;
            int shifted = (residue + offset) % period;
            total += histogram[residue] * Math.min(shifted, period - shifted);
        }
        return total;
    }
}
