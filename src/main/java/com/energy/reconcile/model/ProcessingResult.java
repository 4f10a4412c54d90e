package com.energy.reconcile.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 单个家庭经过处理管道后的结果。
 * 状态为 COMPLETED 时 table 为处理后的数据表，其余状态下为 null。
 */
public class ProcessingResult {

    private final String householdId;
    private final ProcessingStatus status;
    private final HouseholdTable table;
    private final Map<String, AnomalyReport> anomalyReports;
    private final List<String> warnings;
    private final String errorMessage;
    private final long elapsedMs;

    public ProcessingResult(String householdId,
                            ProcessingStatus status,
                            HouseholdTable table,
                            Map<String, AnomalyReport> anomalyReports,
                            List<String> warnings,
                            String errorMessage,
                            long elapsedMs) {
        this.householdId = householdId;
        this.status = status;
        this.table = table;
        this.anomalyReports = Collections.unmodifiableMap(
                anomalyReports != null ? new LinkedHashMap<>(anomalyReports) : Map.of());
        this.warnings = Collections.unmodifiableList(
                warnings != null ? new ArrayList<>(warnings) : List.of());
        this.errorMessage = errorMessage;
        this.elapsedMs = elapsedMs;
    }

    public static ProcessingResult rejected(String householdId, String errorMessage) {
        return new ProcessingResult(householdId, ProcessingStatus.REJECTED, null, null, null, errorMessage, 0);
    }

    public String getHouseholdId() { return householdId; }
    public ProcessingStatus getStatus() { return status; }
    public HouseholdTable getTable() { return table; }
    public Map<String, AnomalyReport> getAnomalyReports() { return anomalyReports; }
    public List<String> getWarnings() { return warnings; }
    public String getErrorMessage() { return errorMessage; }
    public long getElapsedMs() { return elapsedMs; }

    public boolean isCompleted() {
        return status == ProcessingStatus.COMPLETED;
    }

    @Override
    public String toString() {
        return "ProcessingResult{" + householdId + ", " + status
                + (errorMessage != null ? ", error='" + errorMessage + "'" : "")
                + ", warnings=" + warnings.size() + ", " + elapsedMs + "ms}";
    }
}
