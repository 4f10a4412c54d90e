package com.energy.reconcile.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.OptionalDouble;

/**
 * 可空数值列。
 * 数值与"是否已知"分开存储，未知值永远不会被读成 0 或 NaN。
 */
public class ValueColumn extends Column {

    private final double[] values;
    private final BitSet known;

    /** 创建指定行数、全部为未知值的列 */
    public ValueColumn(String name, int size) {
        super(name);
        this.values = new double[size];
        this.known = new BitSet(size);
    }

    private ValueColumn(String name, double[] values, BitSet known) {
        super(name);
        this.values = values;
        this.known = known;
    }

    /**
     * 由装箱数组构造，null 表示未知值。
     */
    public static ValueColumn of(String name, Double... values) {
        return of(name, Arrays.asList(values));
    }

    public static ValueColumn of(String name, List<Double> values) {
        ValueColumn column = new ValueColumn(name, values.size());
        for (int i = 0; i < values.size(); i++) {
            Double v = values.get(i);
            if (v != null) {
                column.set(i, v);
            }
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
        return known.get(row);
    }

    public OptionalDouble get(int row) {
        return isKnown(row) ? OptionalDouble.of(values[row]) : OptionalDouble.empty();
    }

    /**
     * 读取已知值。
     *
     * @throws IllegalStateException 该行为未知值
     */
    public double getDouble(int row) {
        if (!isKnown(row)) {
            throw new IllegalStateException("Row " + row + " of column '" + getName() + "' is unknown");
        }
        return values[row];
    }

    public void set(int row, double value) {
        checkRow(row);
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Column '" + getName() + "' row " + row
                    + " must be a finite number, got " + value);
        }
        values[row] = value;
        known.set(row);
    }

    public void setUnknown(int row) {
        checkRow(row);
        values[row] = 0.0;
        known.clear(row);
    }

    /** 第一个已知值的行号；全部未知时返回 -1 */
    public int firstKnownRow() {
        int row = known.nextSetBit(0);
        return (row >= 0 && row < values.length) ? row : -1;
    }

    /** 下一个已知值的行号（包含 fromRow 本身）；不存在时返回 -1 */
    public int nextKnownRow(int fromRow) {
        if (fromRow >= values.length) return -1;
        int row = known.nextSetBit(fromRow);
        return (row >= 0 && row < values.length) ? row : -1;
    }

    /** 转成装箱列表，未知值为 null，主要用于日志与测试断言 */
    public List<Double> toList() {
        List<Double> result = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            result.add(known.get(i) ? values[i] : null);
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public ValueColumn select(int[] rows) {
        ValueColumn result = new ValueColumn(getName(), rows.length);
        for (int i = 0; i < rows.length; i++) {
            int src = rows[i];
            if (src >= 0 && known.get(src)) {
                result.values[i] = values[src];
                result.known.set(i);
            }
        }
        return result;
    }

    @Override
    public ValueColumn copy() {
        return new ValueColumn(getName(), values.clone(), (BitSet) known.clone());
    }

    @Override
    public ValueColumn rename(String newName) {
        return new ValueColumn(newName, values.clone(), (BitSet) known.clone());
    }

    @Override
    public String toString() {
        return "ValueColumn{" + getName() + ", size=" + size() + ", known=" + known.cardinality() + "}";
    }
}
