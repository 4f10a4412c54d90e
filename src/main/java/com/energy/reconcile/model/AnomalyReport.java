package com.energy.reconcile.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 单个累计量列的异常诊断结果，构建后不可变。
 *
 * 五项检查均为"通过则为 true"。除布尔结论外，还记录了定位问题所需的时间戳：
 * 最长间隔的起点与长度、所有负差值的时间戳、可疑零值的时间范围以及实测覆盖率。
 */
public final class AnomalyReport {

    public static final String HAS_COLUMN = "has_column";
    public static final String GAP_WITHIN_BOUND = "gap_within_bound";
    public static final String NO_NEGATIVE_DIFF = "no_negative_diff";
    public static final String NO_UNEXPECTED_ZERO = "no_unexpected_zero";
    public static final String ENOUGH_COVERAGE = "enough_coverage";

    private final String column;
    private final boolean hasColumn;
    private final boolean gapWithinBound;
    private final boolean noNegativeDiff;
    private final boolean noUnexpectedZero;
    private final boolean enoughCoverage;

    private final Instant worstGapStart;
    private final Duration worstGap;
    private final List<Instant> negativeDiffTimestamps;
    private final Instant zeroRangeStart;
    private final Instant zeroRangeEnd;
    private final double coverage;

    private AnomalyReport(Builder b) {
        this.column = b.column;
        this.hasColumn = b.hasColumn;
        this.gapWithinBound = b.gapWithinBound;
        this.noNegativeDiff = b.noNegativeDiff;
        this.noUnexpectedZero = b.noUnexpectedZero;
        this.enoughCoverage = b.enoughCoverage;
        this.worstGapStart = b.worstGapStart;
        this.worstGap = b.worstGap;
        this.negativeDiffTimestamps = Collections.unmodifiableList(new ArrayList<>(b.negativeDiffTimestamps));
        this.zeroRangeStart = b.zeroRangeStart;
        this.zeroRangeEnd = b.zeroRangeEnd;
        this.coverage = b.coverage;
    }

    public static Builder builder(String column) {
        return new Builder(column);
    }

    /** 列不存在时的报告：has_column 为 false，其余检查视为通过 */
    public static AnomalyReport missingColumn(String column) {
        return builder(column).hasColumn(false).coverage(0.0).build();
    }

    public String getColumn() { return column; }
    public boolean hasColumn() { return hasColumn; }
    public boolean isGapWithinBound() { return gapWithinBound; }
    public boolean isNoNegativeDiff() { return noNegativeDiff; }
    public boolean isNoUnexpectedZero() { return noUnexpectedZero; }
    public boolean isEnoughCoverage() { return enoughCoverage; }

    public Optional<Instant> getWorstGapStart() { return Optional.ofNullable(worstGapStart); }
    public Optional<Duration> getWorstGap() { return Optional.ofNullable(worstGap); }
    public List<Instant> getNegativeDiffTimestamps() { return negativeDiffTimestamps; }
    public Optional<Instant> getZeroRangeStart() { return Optional.ofNullable(zeroRangeStart); }
    public Optional<Instant> getZeroRangeEnd() { return Optional.ofNullable(zeroRangeEnd); }
    public double getCoverage() { return coverage; }

    /** 所有检查是否都通过 */
    public boolean isValid() {
        return hasColumn && gapWithinBound && noNegativeDiff && noUnexpectedZero && enoughCoverage;
    }

    /** 按固定顺序返回各检查项结论 */
    public Map<String, Boolean> checks() {
        Map<String, Boolean> checks = new LinkedHashMap<>();
        checks.put(HAS_COLUMN, hasColumn);
        checks.put(GAP_WITHIN_BOUND, gapWithinBound);
        checks.put(NO_NEGATIVE_DIFF, noNegativeDiff);
        checks.put(NO_UNEXPECTED_ZERO, noUnexpectedZero);
        checks.put(ENOUGH_COVERAGE, enoughCoverage);
        return checks;
    }

    public List<String> failedChecks() {
        List<String> failed = new ArrayList<>();
        checks().forEach((name, passed) -> {
            if (!passed) failed.add(name);
        });
        return failed;
    }

    @Override
    public String toString() {
        return "AnomalyReport{" + column + ", failed=" + failedChecks()
                + ", coverage=" + String.format("%.4f", coverage) + "}";
    }

    public static final class Builder {
        private final String column;
        private boolean hasColumn = true;
        private boolean gapWithinBound = true;
        private boolean noNegativeDiff = true;
        private boolean noUnexpectedZero = true;
        private boolean enoughCoverage = true;
        private Instant worstGapStart;
        private Duration worstGap;
        private final List<Instant> negativeDiffTimestamps = new ArrayList<>();
        private Instant zeroRangeStart;
        private Instant zeroRangeEnd;
        private double coverage = 1.0;

        private Builder(String column) {
            if (column == null || column.isBlank()) {
                throw new IllegalArgumentException("Report column must not be null or blank");
            }
            this.column = column;
        }

        public Builder hasColumn(boolean value) { this.hasColumn = value; return this; }
        public Builder gapWithinBound(boolean value) { this.gapWithinBound = value; return this; }
        public Builder noNegativeDiff(boolean value) { this.noNegativeDiff = value; return this; }
        public Builder noUnexpectedZero(boolean value) { this.noUnexpectedZero = value; return this; }
        public Builder enoughCoverage(boolean value) { this.enoughCoverage = value; return this; }

        public Builder worstGap(Instant start, Duration length) {
            this.worstGapStart = start;
            this.worstGap = length;
            return this;
        }

        public Builder addNegativeDiffTimestamp(Instant ts) {
            this.negativeDiffTimestamps.add(ts);
            return this;
        }

        public Builder zeroRange(Instant start, Instant end) {
            this.zeroRangeStart = start;
            this.zeroRangeEnd = end;
            return this;
        }

        public Builder coverage(double value) { this.coverage = value; return this; }

        public AnomalyReport build() {
            return new AnomalyReport(this);
        }
    }
}
