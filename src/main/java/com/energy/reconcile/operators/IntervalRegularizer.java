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
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 采样间隔规整算子。
 * 以首尾时间戳和采样周期确定期望的等间隔网格，使每个网格点恰好对应一行。
 *
 * 参数：
 * - periodSeconds: 采样周期 (NUMBER, 秒, 默认300)
 */
public class IntervalRegularizer implements TableOperator {

    private static final Logger log = LoggerFactory.getLogger(IntervalRegularizer.class);

    public static final String OPERATOR_ID = "interval_regularization";

    private int periodSeconds;

    @Override
    public void initialize(OperatorContext context) {
        this.periodSeconds = context.getParameter("periodSeconds", 300);
    }

    @Override
    public void execute(OperatorContext context) {
        RegularizationResult result = regularize(context.getHouseholdId(), context.getInputTable(),
                Duration.ofSeconds(periodSeconds));
        if (result.getOutcome() != RegularizationResult.Outcome.UNCHANGED) {
            context.addWarning("Interval regularization " + result.getOutcome()
                    + ": inserted " + result.getInsertedRows() + ", dropped " + result.getDroppedRows());
        }
        context.setOutputTable(result.getTable());
    }

    /**
     * 期望行数 = floor((最大时间戳 - 最小时间戳) / 周期) + 1。
     * 行数相等时原样返回；行数不足时外连接补齐网格；外连接结果仍多于期望，
     * 或原本行数就多于期望时，左连接到网格，每个网格点取第一条匹配的原始行，
     * 不在网格上的行被丢弃。
     */
    public RegularizationResult regularize(String context, HouseholdTable table, Duration period) {
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("Period must be positive, got " + period);
        }
        int actual = table.rowCount();
        if (actual == 0) {
            return new RegularizationResult(table.copy(), RegularizationResult.Outcome.UNCHANGED, 0, 0, 0);
        }

        Instant min = table.minTimestamp();
        Instant max = table.maxTimestamp();
        long periodMillis = period.toMillis();
        long expected = (max.toEpochMilli() - min.toEpochMilli()) / periodMillis + 1;

        if (expected == actual) {
            log.info("{}: Number of rows ({}) matches the expected number of intervals.", context, actual);
            return new RegularizationResult(table.copy(), RegularizationResult.Outcome.UNCHANGED, expected, 0, 0);
        }

        List<Instant> grid = new ArrayList<>((int) expected);
        for (long k = 0; k < expected; k++) {
            grid.add(min.plusMillis(k * periodMillis));
        }

        RegularizationResult.Outcome outcome;
        if (expected > actual) {
            Set<Instant> gridSet = new HashSet<>(grid);
            Set<Instant> sourceSet = new HashSet<>(table.getTimestamps());
            long missingGridPoints = grid.size() - grid.stream().filter(sourceSet::contains).count();
            long outerRows = actual + missingGridPoints;
            if (outerRows > expected) {
                long offGrid = table.getTimestamps().stream().filter(ts -> !gridSet.contains(ts)).count();
                log.error("{}: Filling gaps would give {} rows instead of the expected {} "
                        + "({} off-grid timestamps, possible duplicates). Using a left join on the grid instead.",
                        context, outerRows, expected, offGrid);
                outcome = RegularizationResult.Outcome.DUPLICATES_LEFT_JOINED;
            } else {
                log.info("{}: Filling {} missing intervals ({} rows, {} expected).",
                        context, expected - actual, actual, expected);
                outcome = RegularizationResult.Outcome.GAPS_FILLED;
            }
        } else {
            log.error("{}: More rows ({}) than expected intervals ({}). Using a left join on the grid.",
                    context, actual, expected);
            outcome = RegularizationResult.Outcome.EXCESS_LEFT_JOINED;
        }

        int[] mapping = leftJoinMapping(table.getTimestamps(), grid);
        int matched = (int) Arrays.stream(mapping).filter(r -> r >= 0).count();
        HouseholdTable result = table.selectRows(mapping, grid);
        return new RegularizationResult(result, outcome, expected, grid.size() - matched, actual - matched);
    }

    /** 每个网格点取第一条时间戳相同的原始行，无匹配为 -1 */
    private static int[] leftJoinMapping(List<Instant> source, List<Instant> grid) {
        Map<Instant, Integer> firstRow = new HashMap<>();
        for (int i = 0; i < source.size(); i++) {
            firstRow.putIfAbsent(source.get(i), i);
        }
        int[] mapping = new int[grid.size()];
        for (int i = 0; i < grid.size(); i++) {
            mapping[i] = firstRow.getOrDefault(grid.get(i), -1);
        }
        return mapping;
    }

    @Override
    public void cleanup() {
        // 无需清理
    }

    @Override
    public OperatorMetadata getMetadata() {
        return new OperatorMetadata(OPERATOR_ID, "采样间隔规整算子", "1.0.0",
                "按采样周期补齐缺失的网格点，去除重复或不在网格上的行，使每个周期恰好一行。",
                Arrays.asList(VariableKind.values()),
                List.of(ParameterDefinition.number("periodSeconds", 300, 1.0, 86400.0, "采样周期（秒）")));
    }
}
