package com.energy.reconcile.alignment;

import com.energy.reconcile.model.Clock;
import com.energy.reconcile.model.ClockEstimate;
import com.energy.reconcile.model.Column;
import com.energy.reconcile.model.HouseholdTable;
import com.energy.reconcile.model.ToleranceReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 对齐容差影响报告。
 * 统计每个设备每列的已知读数中，有多少条与设备时钟或统一时钟网格的距离不超过给定容差，
 * 用于在对齐前选择合适的容差。
 */
public class ToleranceImpactReporter {

    private static final Logger log = LoggerFactory.getLogger(ToleranceImpactReporter.class);

    public static final List<Integer> DEFAULT_TOLERANCES = List.of(10, 30, 150);

    public ToleranceReport report(Map<String, HouseholdTable> deviceTables, ClockEstimate clocks) {
        return report(deviceTables, clocks, DEFAULT_TOLERANCES);
    }

    public ToleranceReport report(Map<String, HouseholdTable> deviceTables, ClockEstimate clocks,
                                  List<Integer> tolerances) {
        List<ToleranceReport.Entry> entries = new ArrayList<>();
        Clock fleet = clocks.getFleetClock();

        for (Map.Entry<String, HouseholdTable> device : deviceTables.entrySet()) {
            Clock deviceClock = clocks.getDeviceClock(device.getKey());
            if (deviceClock == null) {
                throw new IllegalArgumentException("No clock estimated for device '" + device.getKey() + "'");
            }
            HouseholdTable table = device.getValue();
            List<Instant> timestamps = table.getTimestamps();
            long[] deviceDistance = new long[timestamps.size()];
            long[] fleetDistance = new long[timestamps.size()];
            for (int i = 0; i < timestamps.size(); i++) {
                deviceDistance[i] = deviceClock.distanceToGrid(timestamps.get(i)).toMillis();
                fleetDistance[i] = fleet.distanceToGrid(timestamps.get(i)).toMillis();
            }

            for (Column column : table.getColumns()) {
                for (int tolerance : tolerances) {
                    long limit = tolerance * 1000L;
                    int known = 0;
                    int withinDevice = 0;
                    int withinFleet = 0;
                    for (int i = 0; i < timestamps.size(); i++) {
                        if (!column.isKnown(i)) continue;
                        known++;
                        if (deviceDistance[i] <= limit) withinDevice++;
                        if (fleetDistance[i] <= limit) withinFleet++;
                    }
                    ToleranceReport.Entry entry = new ToleranceReport.Entry(device.getKey(), column.getName(),
                            tolerance, known, withinDevice, withinFleet);
                    log.debug("Tolerance impact {}", entry);
                    entries.add(entry);
                }
            }
        }
        return new ToleranceReport(entries);
    }
}
