package com.energy.reconcile.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 三值诊断列，每一行为 TRUE / FALSE / UNKNOWN。
 */
public class FlagColumn extends Column {

    private final TriState[] values;

    public FlagColumn(String name, int size) {
        super(name);
        this.values = new TriState[size];
        Arrays.fill(this.values, TriState.UNKNOWN);
    }

    public static FlagColumn of(String name, TriState... values) {
        FlagColumn column = new FlagColumn(name, values.length);
        for (int i = 0; i < values.length; i++) {
            column.set(i, values[i]);
        }
        return column;
    }

    @Override
    public int size() {
        return values.length;
    }

    @Override
    public boolean isKnown(int row) {
        checkRow(row);
        return values[row].isKnown();
    }

    public TriState get(int row) {
        checkRow(row);
        return values[row];
    }

    public void set(int row, TriState value) {
        checkRow(row);
        values[row] = (value != null) ? value : TriState.UNKNOWN;
    }

    /** 是否存在至少一个 FALSE */
    public boolean anyFalse() {
        for (TriState v : values) {
            if (v == TriState.FALSE) return true;
        }
        return false;
    }

    public List<TriState> toList() {
        return Collections.unmodifiableList(Arrays.asList(values.clone()));
    }

    @Override
    public FlagColumn select(int[] rows) {
        FlagColumn result = new FlagColumn(getName(), rows.length);
        for (int i = 0; i < rows.length; i++) {
            if (rows[i] >= 0) {
                result.values[i] = values[rows[i]];
            }
        }
        return result;
    }

    @Override
    public FlagColumn copy() {
        return rename(getName());
    }

    @Override
    public FlagColumn rename(String newName) {
        FlagColumn result = new FlagColumn(newName, values.length);
        System.arraycopy(values, 0, result.values, 0, values.length);
        return result;
    }
}
