package com.energy.reconcile.operators;

import com.energy.reconcile.core.OperatorContext;
import com.energy.reconcile.core.TableOperator;
import com.energy.reconcile.exception.DataIntegrityException;
import com.energy.reconcile.exception.StructuralDataException;
import com.energy.reconcile.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 累计计数器修复算子。
 * 对每个累计量列先分类，再消除负差值，最后生成 &lt;列名&gt;Diff 差值列。
 *
 * 参数：
 * - maxGapMinutes: 相邻已知读数允许的最大间隔 (NUMBER, 默认60)
 * - minCoverage: 最低覆盖率 (NUMBER, 0~1, 默认0.9)
 * - dropOnFailure: 任一列诊断未通过时丢弃整个家庭 (BOOLEAN, 默认false)
 * - columns: 需要处理的累计量列 (STRING_LIST, 默认取阈值目录中的全部累计量)
 */
public class CounterReconciler implements TableOperator {

    private static final Logger log = LoggerFactory.getLogger(CounterReconciler.class);

    public static final String OPERATOR_ID = "counter_reconciliation";

    private double maxGapMinutes;
    private double minCoverage;
    private boolean dropOnFailure;
    private List<String> columns;

    @Override
    public void initialize(OperatorContext context) {
        this.maxGapMinutes = context.getParameter("maxGapMinutes", 60.0);
        this.minCoverage = context.getParameter("minCoverage", CounterAnomalyClassifier.DEFAULT_MIN_COVERAGE);
        this.dropOnFailure = context.getParameter("dropOnFailure", Boolean.FALSE);
        this.columns = context.getParameter("columns", context.getCatalog().getCumulativeColumns());
    }

    @Override
    public void execute(OperatorContext context) {
        String hid = context.getHouseholdId();
        HouseholdTable input = context.getInputTable();

        if (input.hasDuplicateTimestamps()) {
            throw new StructuralDataException("Household " + hid
                    + " has duplicate timestamps before reconciliation");
        }
        HouseholdTable table = input.isSortedUnique() ? input.copy() : input.sortByTimestamp();

        CounterAnomalyClassifier classifier = new CounterAnomalyClassifier(
                Duration.ofSeconds(Math.round(maxGapMinutes * 60)), minCoverage);

        Map<String, AnomalyReport> reports = new LinkedHashMap<>();
        for (String column : columns) {
            AnomalyReport report = classifier.classify(hid, table, column);
            reports.put(column, report);
            context.addAnomalyReport(report);
        }

        List<String> invalid = new ArrayList<>();
        reports.forEach((column, report) -> {
            if (!report.isValid()) invalid.add(column + report.failedChecks());
        });
        if (!invalid.isEmpty()) {
            if (dropOnFailure) {
                log.error("{}: Some cumulative columns did not pass validation ({}). Dropping household.",
                        hid, invalid);
                context.markDropped("Cumulative columns failed validation: " + invalid);
                return;
            }
            log.warn("{}: Some cumulative columns did not pass validation ({}). Keeping household.",
                    hid, invalid);
            context.addWarning("Cumulative columns failed validation: " + invalid);
        }

        int totalNulled = 0;
        for (Map.Entry<String, AnomalyReport> entry : reports.entrySet()) {
            if (!entry.getValue().hasColumn()) {
                log.warn("{}: Skipping reconciliation of missing column '{}'.", hid, entry.getKey());
                continue;
            }
            ReconciliationResult result = reconcile(hid, table.series(entry.getKey()), entry.getValue(), false);
            table.putColumn(result.getCorrected());
            table.putColumn(result.getDelta());
            totalNulled += result.getNulledCount();
        }

        if (totalNulled > 0) {
            context.addWarning("Nulled " + totalNulled + " cumulative values while removing negative diffs");
        }
        context.setOutputTable(table);
    }

    /**
     * 修复单个累计量序列。
     *
     * 对每个跳过缺失值后差值为负的时刻 t，寻找其后第一个差值非零的已知读数 next：
     * <ul>
     *   <li>不存在 next：t 及之后全部置为未知</li>
     *   <li>next 的差值足以弥补回落：[t, next) 置为未知（瞬时故障）</li>
     *   <li>next 的差值仍为负：[t, next) 置为未知（连续两次回落）</li>
     *   <li>其他情况按计数器复位处理，仅当 t 与前一行直接相邻且差值为负时置 t 为未知</li>
     * </ul>
     * 修复后重算差值列，仍存在负差值时抛出 {@link DataIntegrityException}。
     *
     * @param context       日志前缀
     * @param series        待修复序列，不会被修改
     * @param report        该序列的分类结果
     * @param dropOnFailure 诊断未通过时是否丢弃
     */
    public ReconciliationResult reconcile(String context, CumulativeSeries series,
                                          AnomalyReport report, boolean dropOnFailure) {
        String column = series.getName();
        String diffName = CounterDeltas.diffColumnName(column);

        if (dropOnFailure && !report.isValid()) {
            log.error("{}: Column '{}' did not pass validation ({}), dropping.",
                    context, column, report.failedChecks());
            return new ReconciliationResult(series.getValues().copy(),
                    CounterDeltas.computeDelta(series.getValues(), diffName), 0, true);
        }

        log.info("{}: Calculating diff for {}", context, column);
        ValueColumn original = series.getValues();
        if (report.isNoNegativeDiff()) {
            return new ReconciliationResult(original.copy(),
                    CounterDeltas.computeDelta(original, diffName), 0, false);
        }

        List<Instant> timestamps = series.getTimestamps();
        ValueColumn corrected = original.copy();
        ValueColumn rowDelta = CounterDeltas.computeDelta(original, diffName);
        ValueColumn gapFree = CounterDeltas.gapFreeDeltas(original);
        int n = original.size();
        boolean[] nulled = new boolean[n];

        for (int t = 0; t < n; t++) {
            if (!gapFree.isKnown(t) || !CounterDeltas.isNegative(gapFree.getDouble(t))) {
                continue;
            }
            double drop = gapFree.getDouble(t);

            int next = -1;
            for (int j = t + 1; j < n; j++) {
                if (gapFree.isKnown(j) && gapFree.getDouble(j) != 0.0) {
                    next = j;
                    break;
                }
            }

            if (next < 0) {
                log.error("{}: Removing all values in '{}' from {} as there are no subsequent "
                        + "increases after the negative diff.", context, column, timestamps.get(t));
                markRange(nulled, t, n);
                continue;
            }

            double nextDelta = gapFree.getDouble(next);
            if (nextDelta >= -drop) {
                log.info("{}: Removing unexpected values from '{}' between {} and {}",
                        context, column, timestamps.get(t), timestamps.get(next));
                markRange(nulled, t, next);
            } else if (nextDelta < 0) {
                log.error("{}: Two negative diffs one after the other between {} and {}. "
                        + "Removing these values for {}.", context, timestamps.get(t), timestamps.get(next), column);
                markRange(nulled, t, next);
            } else if (rowDelta.isKnown(t) && CounterDeltas.isNegative(rowDelta.getDouble(t))) {
                log.info("{}: Negative jump at {} in '{}'. Removing single cumulative value.",
                        context, timestamps.get(t), column);
                nulled[t] = true;
            } else {
                log.info("{}: Negative jump at {} in '{}' spans missing values, not removing any values.",
                        context, timestamps.get(t), column);
            }
        }

        int nulledCount = 0;
        for (int i = 0; i < n; i++) {
            if (nulled[i] && corrected.isKnown(i)) {
                corrected.setUnknown(i);
                nulledCount++;
            }
        }

        log.info("{}: Re-calculating diff for {} after corrections.", context, column);
        ValueColumn delta = CounterDeltas.computeDelta(corrected, diffName);
        if (CounterDeltas.hasNegative(delta)) {
            log.error("{}: Removed values but diff of '{}' still has negative values.", context, column);
            throw new DataIntegrityException("Column '" + column
                    + "' still has negative diffs after reconciliation");
        }
        return new ReconciliationResult(corrected, delta, nulledCount, false);
    }

    private static void markRange(boolean[] nulled, int fromInclusive, int toExclusive) {
        Arrays.fill(nulled, fromInclusive, toExclusive, true);
    }

    @Override
    public void cleanup() {
        // 无需清理
    }

    @Override
    public OperatorMetadata getMetadata() {
        return new OperatorMetadata(OPERATOR_ID, "累计计数器修复算子", "1.0.0",
                "检测累计量列的间隔、负差值、异常零值与覆盖率问题，消除负差值并生成逐行差值列。",
                List.of(VariableKind.CUMULATIVE),
                List.of(ParameterDefinition.number("maxGapMinutes", 60.0, 0.0, null,
                                "相邻已知读数允许的最大间隔（分钟）"),
                        ParameterDefinition.number("minCoverage", CounterAnomalyClassifier.DEFAULT_MIN_COVERAGE,
                                0.0, 1.0, "最低覆盖率"),
                        ParameterDefinition.flag("dropOnFailure", false, "任一累计量列诊断未通过时丢弃整个家庭"),
                        ParameterDefinition.stringList("columns", null,
                                "需要处理的累计量列，缺省时取阈值目录中的全部累计量")));
    }
}
