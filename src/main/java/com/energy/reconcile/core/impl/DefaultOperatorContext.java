package com.energy.reconcile.core.impl;

import com.energy.reconcile.core.OperatorContext;
import com.energy.reconcile.model.AnomalyReport;
import com.energy.reconcile.model.HouseholdTable;
import com.energy.reconcile.model.ThresholdCatalog;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 算子上下文默认实现。
 * 封装单个算子在管道中执行时所需的全部环境信息。
 * 支持管道串联，后一个算子的输入来自前一个算子的输出。
 */
public class DefaultOperatorContext implements OperatorContext {

    private final String householdId;
    private final Map<String, Object> parameters;
    private final ThresholdCatalog catalog;
    private final PipelineDiagnostics diagnostics;

    /** 管道第一个算子的输入表；非第一个算子时为null */
    private final HouseholdTable sourceTable;

    /** 前一个算子的上下文（用于管道串联），为null表示管道第一个算子 */
    private final DefaultOperatorContext previousContext;

    /** 当前算子的输出，为null表示算子未输出，等同于输入 */
    private HouseholdTable outputTable;

    DefaultOperatorContext(String householdId,
                           Map<String, Object> parameters,
                           ThresholdCatalog catalog,
                           PipelineDiagnostics diagnostics,
                           HouseholdTable sourceTable,
                           DefaultOperatorContext previousContext) {
        this.householdId = householdId;
        this.parameters = parameters != null ? parameters : Map.of();
        this.catalog = catalog;
        this.diagnostics = diagnostics;
        this.sourceTable = sourceTable;
        this.previousContext = previousContext;
    }

    /** 独立使用单个算子时的上下文，例如测试 */
    public static DefaultOperatorContext standalone(String householdId, HouseholdTable input,
                                                    Map<String, Object> parameters, ThresholdCatalog catalog) {
        return new DefaultOperatorContext(householdId, parameters, catalog, new PipelineDiagnostics(),
                input, null);
    }

    @Override
    public String getHouseholdId() {
        return householdId;
    }

    @Override
    public HouseholdTable getInputTable() {
        // 管道串联：如果有前置算子，从前置算子的输出读取
        if (previousContext != null) {
            return previousContext.getOutputTable();
        }
        return sourceTable;
    }

    @Override
    public void setOutputTable(HouseholdTable table) {
        this.outputTable = table;
    }

    /** 当前算子的输出（供下一个算子读取），未输出时等同于输入 */
    public HouseholdTable getOutputTable() {
        return (outputTable != null) ? outputTable : getInputTable();
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T getParameter(String paramName, T defaultValue) {
        Object value = parameters.get(paramName);
        if (value == null) {
            return defaultValue;
        }

        if (defaultValue == null) {
            return (T) value;
        }
        Class<?> targetType = defaultValue.getClass();
        // 数值类型转换
        if (targetType == Double.class && value instanceof Number) {
            return (T) Double.valueOf(((Number) value).doubleValue());
        }
        if (targetType == Integer.class && value instanceof Number) {
            return (T) Integer.valueOf(((Number) value).intValue());
        }
        if (targetType == Long.class && value instanceof Number) {
            return (T) Long.valueOf(((Number) value).longValue());
        }
        if (targetType == Boolean.class && value instanceof String) {
            return (T) Boolean.valueOf(((String) value).trim());
        }
        if (defaultValue instanceof List) {
            if (value instanceof String) {
                // 逗号分隔的字符串视为列表
                List<String> items = new ArrayList<>();
                for (String item : ((String) value).split(",")) {
                    if (!item.isBlank()) items.add(item.trim());
                }
                return (T) items;
            }
            return (value instanceof List) ? (T) value : defaultValue;
        }
        return targetType.isInstance(value) ? (T) value : defaultValue;
    }

    @Override
    public ThresholdCatalog getCatalog() {
        return catalog;
    }

    @Override
    public void addWarning(String warning) {
        diagnostics.addWarning(warning);
    }

    @Override
    public void addAnomalyReport(AnomalyReport report) {
        diagnostics.addAnomalyReport(report);
    }

    @Override
    public void markDropped(String reason) {
        diagnostics.markDropped(reason);
    }

    @Override
    public boolean isDropped() {
        return diagnostics.isDropped();
    }

    /** 本次执行累计的警告 */
    public List<String> getWarnings() {
        return diagnostics.getWarnings();
    }

    public Map<String, AnomalyReport> getAnomalyReports() {
        return diagnostics.getAnomalyReports();
    }
}
