package com.energy.reconcile;

import com.energy.reconcile.model.HouseholdTable;
import com.energy.reconcile.model.ValueColumn;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 测试用数据表构造工具
 */
public final class TableFixtures {

    /** 2023-01-01T00:00:00Z */
    public static final Instant START = Instant.parse("2023-01-01T00:00:00Z");

    private TableFixtures() {}

    /** 从 START 开始、间隔 periodSeconds 的 n 个时间戳 */
    public static List<Instant> regular(int n, int periodSeconds) {
        List<Instant> timestamps = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            timestamps.add(START.plusSeconds((long) i * periodSeconds));
        }
        return timestamps;
    }

    /** 相对 START 的秒数 */
    public static List<Instant> atSeconds(long... seconds) {
        List<Instant> timestamps = new ArrayList<>(seconds.length);
        for (long s : seconds) {
            timestamps.add(START.plusSeconds(s));
        }
        return timestamps;
    }

    /** 5分钟间隔、单个数值列的表 */
    public static HouseholdTable single(String column, Double... values) {
        HouseholdTable table = new HouseholdTable(regular(values.length, 300));
        table.putColumn(ValueColumn.of(column, values));
        return table;
    }
}
