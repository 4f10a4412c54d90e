package com.energy.reconcile.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 非数值附加列（如数据来源、设备标识），处理流程中原样携带，不参与任何计算。
 */
public class TextColumn extends Column {

    private final String[] values;

    public TextColumn(String name, int size) {
        super(name);
        this.values = new String[size];
    }

    public static TextColumn of(String name, String... values) {
        TextColumn column = new TextColumn(name, values.length);
        System.arraycopy(values, 0, column.values, 0, values.length);
        return column;
    }

    @Override
    public int size() {
        return values.length;
    }

    @Override
    public boolean isKnown(int row) {
        checkRow(row);
        return values[row] != null;
    }

    public String get(int row) {
        checkRow(row);
        return values[row];
    }

    public void set(int row, String value) {
        checkRow(row);
        values[row] = value;
    }

    public List<String> toList() {
        return Collections.unmodifiableList(Arrays.asList(values.clone()));
    }

    @Override
    public TextColumn select(int[] rows) {
        TextColumn result = new TextColumn(getName(), rows.length);
        for (int i = 0; i < rows.length; i++) {
            if (rows[i] >= 0) {
                result.values[i] = values[rows[i]];
            }
        }
        return result;
    }

    @Override
    public TextColumn copy() {
        return rename(getName());
    }

    @Override
    public TextColumn rename(String newName) {
        TextColumn result = new TextColumn(newName, values.length);
        System.arraycopy(values, 0, result.values, 0, values.length);
        return result;
    }
}
