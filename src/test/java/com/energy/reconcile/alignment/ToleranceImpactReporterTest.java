package com.energy.reconcile.alignment;

import com.energy.reconcile.model.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("容差影响统计")
class ToleranceImpactReporterTest {

    private final ToleranceImpactReporter reporter = new ToleranceImpactReporter();

    private static HouseholdTable deviceTable() {
        HouseholdTable table = new HouseholdTable(List.of(
                Instant.ofEpochSecond(0), Instant.ofEpochSecond(305), Instant.ofEpochSecond(620)));
        table.putColumn(ValueColumn.of("x", 1.0, 2.0, 3.0));
        table.putColumn(ValueColumn.of("y", 1.0, null, 3.0));
        return table;
    }

    @Test
    @DisplayName("按设备时钟与统一时钟分别统计容差内的已知读数")
    void report_countsReadingsWithinTolerance() {
        ClockEstimate clocks = new ClockEstimate(
                Map.of("meter", new Clock(Instant.EPOCH, 300)),
                new Clock(Instant.ofEpochSecond(20), 300));

        ToleranceReport report = reporter.report(Map.of("meter", deviceTable()), clocks, List.of(10, 30));

        ToleranceReport.Entry x10 = report.find("meter", "x", 10);
        assertThat(x10.getKnownReadings()).isEqualTo(3);
        assertThat(x10.getWithinDeviceClock()).isEqualTo(2);
        assertThat(x10.getWithinFleetClock()).isEqualTo(1);

        ToleranceReport.Entry x30 = report.find("meter", "x", 30);
        assertThat(x30.getWithinDeviceClock()).isEqualTo(3);
        assertThat(x30.getWithinFleetClock()).isEqualTo(3);

        ToleranceReport.Entry y10 = report.find("meter", "y", 10);
        assertThat(y10.getKnownReadings()).isEqualTo(2);
        assertThat(y10.getWithinDeviceClock()).isEqualTo(1);

        assertThat(report.getEntries()).hasSize(4);
    }

    @Test
    @DisplayName("缺少设备时钟时被拒绝")
    void report_missingDeviceClock_throws() {
        ClockEstimate clocks = new ClockEstimate(Map.of(), new Clock(Instant.EPOCH, 300));

        assertThatThrownBy(() -> reporter.report(Map.of("meter", deviceTable()), clocks))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
