package com.energy.reconcile.core.impl;

import com.energy.reconcile.model.AnomalyReport;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 单个家庭一次管道执行中各算子共享的诊断信息。
 */
class PipelineDiagnostics {

    private final List<String> warnings = new ArrayList<>();
    private final Map<String, AnomalyReport> anomalyReports = new LinkedHashMap<>();
    private String dropReason;

    void addWarning(String warning) {
        warnings.add(warning);
    }

    void addAnomalyReport(AnomalyReport report) {
        anomalyReports.put(report.getColumn(), report);
    }

    void markDropped(String reason) {
        this.dropReason = (reason != null) ? reason : "dropped";
    }

    boolean isDropped() {
        return dropReason != null;
    }

    String getDropReason() { return dropReason; }
    List<String> getWarnings() { return warnings; }
    Map<String, AnomalyReport> getAnomalyReports() { return anomalyReports; }
}
