package com.energy.reconcile.alignment;

import com.energy.reconcile.model.AlignmentMethod;
import com.energy.reconcile.model.ClockEstimate;
import com.energy.reconcile.model.HouseholdTable;
import com.energy.reconcile.model.ToleranceReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 多设备对齐服务：估计各设备时钟，逐个对齐到各自的时钟网格，再合并成一张表。
 */
public class DeviceAlignmentService {

    private static final Logger log = LoggerFactory.getLogger(DeviceAlignmentService.class);

    private final ClockEstimator clockEstimator;
    private final TimestampAligner aligner;
    private final MultiSeriesMerger merger;
    private final ToleranceImpactReporter reporter;

    private final int periodSeconds;
    private final Duration tolerance;
    private final AlignmentMethod method;
    private final Set<String> cumulativeColumns;

    public DeviceAlignmentService(int periodSeconds, Duration tolerance, AlignmentMethod method,
                                  Set<String> cumulativeColumns) {
        this(new ClockEstimator(), new TimestampAligner(), null, new ToleranceImpactReporter(),
                periodSeconds, tolerance, method, cumulativeColumns);
    }

    public DeviceAlignmentService(ClockEstimator clockEstimator,
                                  TimestampAligner aligner,
                                  MultiSeriesMerger merger,
                                  ToleranceImpactReporter reporter,
                                  int periodSeconds,
                                  Duration tolerance,
                                  AlignmentMethod method,
                                  Set<String> cumulativeColumns) {
        this.clockEstimator = clockEstimator;
        this.aligner = aligner;
        this.merger = (merger != null) ? merger : new MultiSeriesMerger(clockEstimator);
        this.reporter = reporter;
        this.periodSeconds = periodSeconds;
        this.tolerance = tolerance;
        this.method = method;
        this.cumulativeColumns = Set.copyOf(cumulativeColumns);
    }

    /** 估计每个设备的时钟和统一时钟 */
    public ClockEstimate estimateClocks(Map<String, HouseholdTable> deviceTables) {
        Map<String, List<Instant>> timestamps = new LinkedHashMap<>();
        deviceTables.forEach((device, table) -> timestamps.put(device, table.getTimestamps()));
        return clockEstimator.estimateClocks(timestamps, periodSeconds);
    }

    /** 各容差下可对齐的读数统计 */
    public ToleranceReport toleranceImpact(Map<String, HouseholdTable> deviceTables) {
        return reporter.report(deviceTables, estimateClocks(deviceTables));
    }

    /**
     * 对齐并合并一个家庭的多个设备表。
     *
     * @param useFirstAsReference true 时以第一个设备的起点为合并参考时刻
     */
    public HouseholdTable alignAndMerge(String householdId, Map<String, HouseholdTable> deviceTables,
                                        boolean useFirstAsReference) {
        if (deviceTables.isEmpty()) {
            throw new IllegalArgumentException("No device tables given for household " + householdId);
        }
        ClockEstimate clocks = estimateClocks(deviceTables);

        List<HouseholdTable> aligned = new ArrayList<>();
        for (Map.Entry<String, HouseholdTable> entry : deviceTables.entrySet()) {
            String context = householdId + "/" + entry.getKey();
            aligned.add(aligner.align(context, entry.getValue(), clocks.getDeviceClock(entry.getKey()),
                    tolerance, method, cumulativeColumns));
        }

        HouseholdTable merged = merger.merge(householdId, aligned, periodSeconds, useFirstAsReference);
        log.info("{}: Aligned {} devices into {} rows.", householdId, deviceTables.size(), merged.rowCount());
        return merged;
    }
}
