package com.energy.reconcile.operators;

import com.energy.reconcile.core.OperatorContext;
import com.energy.reconcile.core.TableOperator;
import com.energy.reconcile.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 逐行校验算子，为每项检查追加一个三值诊断列：
 * <ul>
 *   <li>validate_&lt;变量&gt;：阈值目录中每个出现在表中的变量</li>
 *   <li>validate_thresholds_combined：任一已知值越界为 FALSE，全部已知值在界内为 TRUE，无已知值为 UNKNOWN</li>
 *   <li>validate_reading_date_unique：重复时间戳（第二次及以后出现）为 FALSE</li>
 *   <li>validate_interval：与上一行间隔等于采样周期为 TRUE，首行 UNKNOWN</li>
 *   <li>validate_&lt;累计量&gt;Diff_outliers：差值列的四分位距离群点检测</li>
 * </ul>
 *
 * 参数：
 * - periodSeconds: 采样周期 (NUMBER, 秒, 默认300)
 * - outlierChecks: 是否做离群点检测 (BOOLEAN, 默认true)
 */
public class RecordValidationOperator implements TableOperator {

    private static final Logger log = LoggerFactory.getLogger(RecordValidationOperator.class);

    public static final String OPERATOR_ID = "record_validation";

    public static final String COMBINED_FLAG = "validate_thresholds_combined";
    public static final String UNIQUE_DATE_FLAG = "validate_reading_date_unique";
    public static final String INTERVAL_FLAG = "validate_interval";
    public static final String OUTLIER_SUFFIX = "_outliers";

    private final DeltaOutlierDetector outlierDetector = new DeltaOutlierDetector();

    private int periodSeconds;
    private boolean outlierChecks;

    @Override
    public void initialize(OperatorContext context) {
        this.periodSeconds = context.getParameter("periodSeconds", 300);
        this.outlierChecks = context.getParameter("outlierChecks", Boolean.TRUE);
    }

    @Override
    public void execute(OperatorContext context) {
        HouseholdTable result = validate(context.getHouseholdId(), context.getInputTable(),
                context.getCatalog(), Duration.ofSeconds(periodSeconds), outlierChecks);
        context.setOutputTable(result);
    }

    /**
     * 计算全部诊断列并追加到表的副本上。
     */
    public HouseholdTable validate(String context, HouseholdTable table, ThresholdCatalog catalog,
                                   Duration period, boolean withOutliers) {
        HouseholdTable result = table.copy();
        int n = table.rowCount();

        List<ColumnThresholdCheck> checks = new ArrayList<>();
        for (VariableThreshold threshold : catalog.getAll()) {
            if (table.getValueColumn(threshold.getName()) != null) {
                checks.add(new ColumnThresholdCheck(threshold));
            }
        }

        List<FlagColumn> thresholdFlags = new ArrayList<>(checks.size());
        for (ColumnThresholdCheck check : checks) {
            FlagColumn flags = check.evaluate(table.getValueColumn(check.getColumn()));
            thresholdFlags.add(flags);
            result.putColumn(flags);
            if (flags.anyFalse()) {
                log.warn("{}: Column '{}' has values outside {}.", context, check.getColumn(), check.getThreshold());
            }
        }
        result.putColumn(combine(thresholdFlags, n));
        result.putColumn(uniqueReadingDate(table.getTimestamps()));
        result.putColumn(interval(table.getTimestamps(), period));

        if (withOutliers) {
            for (String cumulative : catalog.getCumulativeColumns()) {
                String diffName = CounterDeltas.diffColumnName(cumulative);
                ValueColumn delta = table.getValueColumn(diffName);
                if (delta != null) {
                    result.putColumn(outlierDetector.detect(delta,
                            ColumnThresholdCheck.PREFIX + diffName + OUTLIER_SUFFIX));
                }
            }
        }

        log.info("{}: Added {} threshold checks to {} rows.", context, checks.size(), n);
        return result;
    }

    static FlagColumn combine(List<FlagColumn> flags, int rows) {
        FlagColumn combined = new FlagColumn(COMBINED_FLAG, rows);
        for (int i = 0; i < rows; i++) {
            TriState state = TriState.UNKNOWN;
            for (FlagColumn flag : flags) {
                TriState value = flag.get(i);
                if (value == TriState.FALSE) {
                    state = TriState.FALSE;
                    break;
                }
                if (value == TriState.TRUE) {
                    state = TriState.TRUE;
                }
            }
            combined.set(i, state);
        }
        return combined;
    }

    static FlagColumn uniqueReadingDate(List<Instant> timestamps) {
        FlagColumn flags = new FlagColumn(UNIQUE_DATE_FLAG, timestamps.size());
        Set<Instant> seen = new HashSet<>();
        for (int i = 0; i < timestamps.size(); i++) {
            flags.set(i, TriState.of(seen.add(timestamps.get(i))));
        }
        return flags;
    }

    static FlagColumn interval(List<Instant> timestamps, Duration period) {
        FlagColumn flags = new FlagColumn(INTERVAL_FLAG, timestamps.size());
        for (int i = 1; i < timestamps.size(); i++) {
            Duration step = Duration.between(timestamps.get(i - 1), timestamps.get(i)).abs();
            flags.set(i, TriState.of(step.equals(period)));
        }
        return flags;
    }

    @Override
    public void cleanup() {
        // 无需清理
    }

    @Override
    public OperatorMetadata getMetadata() {
        return new OperatorMetadata(OPERATOR_ID, "逐行校验算子", "1.0.0",
                "按阈值目录逐行校验各变量，检查时间戳唯一性与采样间隔，并对差值列做离群点检测。",
                Arrays.asList(VariableKind.values()),
                List.of(ParameterDefinition.number("periodSeconds", 300, 1.0, null, "采样周期（秒）"),
                        ParameterDefinition.flag("outlierChecks", true, "是否对差值列做离群点检测")));
    }
}
