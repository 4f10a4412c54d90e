package com.energy.reconcile.operators;

import com.energy.reconcile.model.AnomalyReport;
import com.energy.reconcile.model.CumulativeSeries;
import com.energy.reconcile.model.HouseholdTable;
import com.energy.reconcile.model.ValueColumn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 累计计数器异常分类器。
 *
 * 对单个累计量列做五项检查并生成 {@link AnomalyReport}：
 * 列是否存在、相邻已知读数的时间间隔是否超限、是否出现负差值、
 * 负差值之后是否出现零值、前向填充后的覆盖率是否足够。
 *
 * 分类器只读不写，也不会抛出异常；发现的问题以 WARN 记录，缺列以 ERROR 记录。
 */
public class CounterAnomalyClassifier {

    private static final Logger log = LoggerFactory.getLogger(CounterAnomalyClassifier.class);

    public static final Duration DEFAULT_MAX_GAP = Duration.ofHours(1);
    public static final double DEFAULT_MIN_COVERAGE = 0.9;

    private final Duration maxGap;
    private final double minCoverage;

    public CounterAnomalyClassifier() {
        this(DEFAULT_MAX_GAP, DEFAULT_MIN_COVERAGE);
    }

    public CounterAnomalyClassifier(Duration maxGap, double minCoverage) {
        if (maxGap == null || maxGap.isNegative()) {
            throw new IllegalArgumentException("Max gap must be non-negative, got " + maxGap);
        }
        if (minCoverage < 0.0 || minCoverage > 1.0) {
            throw new IllegalArgumentException("Min coverage must be within [0, 1], got " + minCoverage);
        }
        this.maxGap = maxGap;
        this.minCoverage = minCoverage;
    }

    /**
     * 对表中的一列做分类；列不存在或不是数值列时返回 has_column=false 的报告。
     */
    public AnomalyReport classify(String context, HouseholdTable table, String column) {
        ValueColumn values = table.getValueColumn(column);
        if (values == null) {
            log.error("{}: Column '{}' not found in table.", context, column);
            return AnomalyReport.missingColumn(column);
        }
        return classify(context, new CumulativeSeries(column, table.getTimestamps(), values));
    }

    public AnomalyReport classify(String context, CumulativeSeries series) {
        String column = series.getName();
        ValueColumn values = series.getValues();
        List<Instant> timestamps = series.getTimestamps();
        AnomalyReport.Builder report = AnomalyReport.builder(column);

        // 相邻已知读数的时间间隔与差值
        Duration worstGap = null;
        Instant worstGapStart = null;
        Instant firstNegative = null;

        int prev = values.firstKnownRow();
        int row = (prev >= 0) ? values.nextKnownRow(prev + 1) : -1;
        while (row >= 0) {
            Duration gap = Duration.between(timestamps.get(prev), timestamps.get(row));
            if (worstGap == null || gap.compareTo(worstGap) > 0) {
                worstGap = gap;
                worstGapStart = timestamps.get(prev);
            }

            double delta = CounterDeltas.round(values.getDouble(row) - values.getDouble(prev));
            if (CounterDeltas.isNegative(delta)) {
                report.addNegativeDiffTimestamp(timestamps.get(row));
                if (firstNegative == null) {
                    firstNegative = timestamps.get(row);
                }
            }
            prev = row;
            row = values.nextKnownRow(row + 1);
        }

        if (worstGap != null && worstGap.compareTo(maxGap) > 0) {
            log.warn("{}: Column '{}' has a gap of {} > allowed ({}) starting at {}.",
                    context, column, worstGap, maxGap, worstGapStart);
            report.gapWithinBound(false).worstGap(worstGapStart, worstGap);
        }

        if (firstNegative != null) {
            report.noNegativeDiff(false);
            AnomalyReport negatives = report.build();
            log.warn("{}: Column '{}' has a decrease in subsequent cumulative values at {}.",
                    context, column, negatives.getNegativeDiffTimestamps());

            // 负差值之后的零值视为计数器复位
            Instant lastZero = null;
            for (int i = 0; i < values.size(); i++) {
                if (values.isKnown(i) && values.getDouble(i) == 0.0
                        && !timestamps.get(i).isBefore(firstNegative)) {
                    lastZero = timestamps.get(i);
                }
            }
            if (lastZero != null) {
                log.warn("{}: Column '{}' has unexpected zero values from {} to {}.",
                        context, column, firstNegative, lastZero);
                report.noUnexpectedZero(false).zeroRange(firstNegative, lastZero);
            }
        }

        // 覆盖率：前向填充后非空的行数，即去掉开头连续未知行之后的行数
        double coverage = 1.0;
        if (values.size() > 0) {
            int first = values.firstKnownRow();
            int covered = (first < 0) ? 0 : values.size() - first;
            coverage = (double) covered / values.size();
        }
        report.coverage(coverage);
        if (coverage < minCoverage) {
            log.warn("{}: Column '{}' has less than {}% non-NA values ({}).",
                    context, column, minCoverage * 100, String.format("%.4f", coverage));
            report.enoughCoverage(false);
        }

        return report.build();
    }

    public Duration getMaxGap() { return maxGap; }
    public double getMinCoverage() { return minCoverage; }
}
