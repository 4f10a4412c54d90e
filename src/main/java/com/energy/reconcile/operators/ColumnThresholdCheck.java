package com.energy.reconcile.operators;

import com.energy.reconcile.model.FlagColumn;
import com.energy.reconcile.model.TriState;
import com.energy.reconcile.model.ValueColumn;
import com.energy.reconcile.model.VariableThreshold;

/**
 * 单列阈值校验记录，输出列名为 validate_&lt;列名&gt;。
 * 已知值落在 [min, max] 内为 TRUE，越界为 FALSE，未知值为 UNKNOWN。
 */
public final class ColumnThresholdCheck {

    public static final String PREFIX = "validate_";

    private final VariableThreshold threshold;

    public ColumnThresholdCheck(VariableThreshold threshold) {
        this.threshold = threshold;
    }

    public String getColumn() {
        return threshold.getName();
    }

    public String getFlagName() {
        return PREFIX + threshold.getName();
    }

    public VariableThreshold getThreshold() {
        return threshold;
    }

    public FlagColumn evaluate(ValueColumn values) {
        FlagColumn flags = new FlagColumn(getFlagName(), values.size());
        for (int i = 0; i < values.size(); i++) {
            if (values.isKnown(i)) {
                flags.set(i, TriState.of(threshold.isWithinBounds(values.getDouble(i))));
            }
        }
        return flags;
    }
}
