package com.energy.reconcile.operators;

import com.energy.reconcile.model.FlagColumn;
import com.energy.reconcile.model.TriState;
import com.energy.reconcile.model.ValueColumn;

import java.util.Arrays;

/**
 * 差值列离群点检测（四分位距法）。
 *
 * 只考察严格为正的差值：落在 [Q1 - 1.5·IQR, Q3 + 1.5·IQR] 内为 TRUE，之外为 FALSE；
 * 零、负数和未知差值为 UNKNOWN。分位数采用线性插值。
 */
public class DeltaOutlierDetector {

    private static final double FENCE_FACTOR = 1.5;

    public FlagColumn detect(ValueColumn delta, String flagName) {
        int n = delta.size();
        FlagColumn flags = new FlagColumn(flagName, n);

        double[] positive = new double[n];
        int count = 0;
        for (int i = 0; i < n; i++) {
            if (delta.isKnown(i) && delta.getDouble(i) > 0) {
                positive[count++] = delta.getDouble(i);
            }
        }
        if (count == 0) {
            return flags;
        }

        double[] sorted = Arrays.copyOf(positive, count);
        Arrays.sort(sorted);
        double q1 = quantile(sorted, 0.25);
        double q3 = quantile(sorted, 0.75);
        double iqr = q3 - q1;
        double lower = q1 - FENCE_FACTOR * iqr;
        double upper = q3 + FENCE_FACTOR * iqr;

        for (int i = 0; i < n; i++) {
            if (delta.isKnown(i) && delta.getDouble(i) > 0) {
                double v = delta.getDouble(i);
                flags.set(i, TriState.of(v >= lower && v <= upper));
            }
        }
        return flags;
    }

    /** 线性插值分位数，sorted 必须已升序且非空 */
    static double quantile(double[] sorted, double q) {
        double h = (sorted.length - 1) * q;
        int lo = (int) Math.floor(h);
        int hi = Math.min(lo + 1, sorted.length - 1);
        return sorted[lo] + (h - lo) * (sorted[hi] - sorted[lo]);
    }
}
