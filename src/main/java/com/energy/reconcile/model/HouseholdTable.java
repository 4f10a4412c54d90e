package com.energy.reconcile.model;

import com.energy.reconcile.exception.StructuralDataException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * 单个家庭的时序数据表。
 *
 * 由一个时间戳列和若干命名列组成，列的顺序即插入顺序。
 * 表本身是可变的，但各处理组件一律先 copy 再修改，调用方传入的表不会被改动。
 */
public class HouseholdTable {

    /** 原始数据的时间戳列名 */
    public static final String READING_DATE = "ReadingDate";

    private final String timestampColumn;
    private final List<Instant> timestamps;
    private final LinkedHashMap<String, Column> columns = new LinkedHashMap<>();

    public HouseholdTable(List<Instant> timestamps) {
        this(READING_DATE, timestamps);
    }

    public HouseholdTable(String timestampColumn, List<Instant> timestamps) {
        if (timestampColumn == null || timestampColumn.isBlank()) {
            throw new IllegalArgumentException("Timestamp column name must not be null or blank");
        }
        if (timestamps == null) {
            throw new IllegalArgumentException("Timestamps must not be null");
        }
        for (int i = 0; i < timestamps.size(); i++) {
            if (timestamps.get(i) == null) {
                throw new StructuralDataException("Timestamp at row " + i + " is missing in column '"
                        + timestampColumn + "'");
            }
        }
        this.timestampColumn = timestampColumn;
        this.timestamps = new ArrayList<>(timestamps);
    }

    // ==================== 列管理 ====================

    /**
     * 添加或替换一列。列长度必须与表行数一致。
     */
    public HouseholdTable putColumn(Column column) {
        if (column.size() != timestamps.size()) {
            throw new StructuralDataException("Column '" + column.getName() + "' has " + column.size()
                    + " rows, table has " + timestamps.size());
        }
        if (column.getName().equals(timestampColumn)) {
            throw new StructuralDataException("Column name '" + column.getName()
                    + "' collides with the timestamp column");
        }
        columns.put(column.getName(), column);
        return this;
    }

    public Column getColumn(String name) {
        return columns.get(name);
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    /** 获取数值列；列不存在或不是数值列时返回 null */
    public ValueColumn getValueColumn(String name) {
        Column column = columns.get(name);
        return (column instanceof ValueColumn) ? (ValueColumn) column : null;
    }

    /**
     * 获取必需的数值列。
     *
     * @throws StructuralDataException 列不存在或不是数值列
     */
    public ValueColumn requireValueColumn(String name) {
        Column column = columns.get(name);
        if (column == null) {
            throw new StructuralDataException("Required column '" + name + "' is missing");
        }
        if (!(column instanceof ValueColumn)) {
            throw new StructuralDataException("Column '" + name + "' is not numeric ("
                    + column.getClass().getSimpleName() + ")");
        }
        return (ValueColumn) column;
    }

    public FlagColumn getFlagColumn(String name) {
        Column column = columns.get(name);
        return (column instanceof FlagColumn) ? (FlagColumn) column : null;
    }

    public Column removeColumn(String name) {
        return columns.remove(name);
    }

    public List<String> getColumnNames() {
        return Collections.unmodifiableList(new ArrayList<>(columns.keySet()));
    }

    public Collection<Column> getColumns() {
        return Collections.unmodifiableCollection(columns.values());
    }

    // ==================== 行与时间戳 ====================

    public String getTimestampColumn() {
        return timestampColumn;
    }

    public int rowCount() {
        return timestamps.size();
    }

    public boolean isEmpty() {
        return timestamps.isEmpty();
    }

    public Instant getTimestamp(int row) {
        return timestamps.get(row);
    }

    public List<Instant> getTimestamps() {
        return Collections.unmodifiableList(timestamps);
    }

    /** 最早时间戳；空表返回 null */
    public Instant minTimestamp() {
        return timestamps.stream().min(Comparator.naturalOrder()).orElse(null);
    }

    /** 最晚时间戳；空表返回 null */
    public Instant maxTimestamp() {
        return timestamps.stream().max(Comparator.naturalOrder()).orElse(null);
    }

    /** 时间戳是否严格递增（即有序且无重复） */
    public boolean isSortedUnique() {
        for (int i = 1; i < timestamps.size(); i++) {
            if (!timestamps.get(i).isAfter(timestamps.get(i - 1))) {
                return false;
            }
        }
        return true;
    }

    public boolean hasDuplicateTimestamps() {
        Set<Instant> seen = new HashSet<>();
        for (Instant ts : timestamps) {
            if (!seen.add(ts)) return true;
        }
        return false;
    }

    /**
     * 返回按时间戳稳定排序后的新表。
     */
    public HouseholdTable sortByTimestamp() {
        int[] order = IntStream.range(0, timestamps.size())
                .boxed()
                .sorted(Comparator.comparing(timestamps::get))
                .mapToInt(Integer::intValue)
                .toArray();
        List<Instant> sorted = new ArrayList<>(order.length);
        for (int row : order) {
            sorted.add(timestamps.get(row));
        }
        return selectRows(order, sorted);
    }

    /**
     * 按行号映射生成新表。
     *
     * @param rows          新表第 i 行取本表的 rows[i] 行，小于 0 表示该行所有列均为未知值
     * @param newTimestamps 新表的时间戳，长度必须与 rows 一致
     */
    public HouseholdTable selectRows(int[] rows, List<Instant> newTimestamps) {
        if (rows.length != newTimestamps.size()) {
            throw new IllegalArgumentException("Row mapping has " + rows.length
                    + " entries but " + newTimestamps.size() + " timestamps were given");
        }
        HouseholdTable result = new HouseholdTable(timestampColumn, newTimestamps);
        for (Column column : columns.values()) {
            result.putColumn(column.select(rows));
        }
        return result;
    }

    /** 深拷贝 */
    public HouseholdTable copy() {
        HouseholdTable result = new HouseholdTable(timestampColumn, timestamps);
        for (Column column : columns.values()) {
            result.putColumn(column.copy());
        }
        return result;
    }

    /**
     * 返回时间戳列替换后的新表，其余列深拷贝。
     */
    public HouseholdTable withTimestamps(String newTimestampColumn, List<Instant> newTimestamps) {
        HouseholdTable result = new HouseholdTable(newTimestampColumn, newTimestamps);
        for (Column column : columns.values()) {
            result.putColumn(column.copy());
        }
        return result;
    }

    /**
     * 以只读视角取出一个累计量序列。
     *
     * @throws StructuralDataException 列不存在或不是数值列
     */
    public CumulativeSeries series(String name) {
        return new CumulativeSeries(name, getTimestamps(), requireValueColumn(name));
    }

    /** 各列已知值数量，用于日志 */
    public Map<String, Integer> knownCounts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        columns.forEach((name, column) -> counts.put(name, column.countKnown()));
        return counts;
    }

    @Override
    public String toString() {
        return "HouseholdTable{rows=" + timestamps.size() + ", timestampColumn=" + timestampColumn
                + ", columns=" + columns.keySet() + "}";
    }
}
