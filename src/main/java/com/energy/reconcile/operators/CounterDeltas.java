package com.energy.reconcile.operators;

import com.energy.reconcile.model.ValueColumn;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 累计量差值计算工具。
 *
 * 差值保留 10 位小数，小于 -1e-10 才算负差值，以吸收浮点误差。
 */
public final class CounterDeltas {

    /** 负差值判定阈值 */
    public static final double EPSILON = 1e-10;

    /** 差值保留的小数位数 */
    public static final int SCALE = 10;

    /** 差值列名后缀 */
    public static final String DIFF_SUFFIX = "Diff";

    private CounterDeltas() {}

    public static String diffColumnName(String column) {
        return column + DIFF_SUFFIX;
    }

    public static double round(double value) {
        return BigDecimal.valueOf(value).setScale(SCALE, RoundingMode.HALF_EVEN).doubleValue();
    }

    public static boolean isNegative(double delta) {
        return delta < -EPSILON;
    }

    /**
     * 逐行差值：delta[i] = value[i] - value[i-1]，任一侧未知则为未知；delta[0] 恒为 0。
     */
    public static ValueColumn computeDelta(ValueColumn values, String diffName) {
        int n = values.size();
        ValueColumn delta = new ValueColumn(diffName, n);
        if (n == 0) return delta;

        delta.set(0, 0.0);
        for (int i = 1; i < n; i++) {
            if (values.isKnown(i) && values.isKnown(i - 1)) {
                delta.set(i, round(values.getDouble(i) - values.getDouble(i - 1)));
            }
        }
        return delta;
    }

    /**
     * 跳过未知值的差值：每个已知值与上一个已知值之差。
     * 第一个已知值及所有未知行的结果为未知。
     */
    public static ValueColumn gapFreeDeltas(ValueColumn values) {
        ValueColumn delta = new ValueColumn(values.getName() + "GapFree", values.size());
        int prev = values.firstKnownRow();
        if (prev < 0) return delta;

        int row = values.nextKnownRow(prev + 1);
        while (row >= 0) {
            delta.set(row, round(values.getDouble(row) - values.getDouble(prev)));
            prev = row;
            row = values.nextKnownRow(row + 1);
        }
        return delta;
    }

    /** 列中是否存在负差值 */
    public static boolean hasNegative(ValueColumn delta) {
        for (int i = 0; i < delta.size(); i++) {
            if (delta.isKnown(i) && isNegative(delta.getDouble(i))) {
                return true;
            }
        }
        return false;
    }
}
