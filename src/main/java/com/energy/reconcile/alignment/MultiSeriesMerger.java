package com.energy.reconcile.alignment;

import com.energy.reconcile.exception.StructuralDataException;
import com.energy.reconcile.model.Column;
import com.energy.reconcile.model.HouseholdTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 多序列合并器：把多张已对齐的设备表平移到共同相位后按时间戳外连接。
 *
 * 每张表按其起始时刻与参考时刻的带符号偏移平移，偏移折算到 [-p/2, p/2]。
 * 参考时刻为第一张表的起点，或所有起点的最优相位。
 * 同名列在多张表中出现时，按来源序号加后缀 _df&lt;i&gt;。
 */
public class MultiSeriesMerger {

    private static final Logger log = LoggerFactory.getLogger(MultiSeriesMerger.class);

    /** 采样间隔与周期允许的偏差（毫秒） */
    private static final long FREQUENCY_TOLERANCE_MS = 1000;

    private final ClockEstimator clockEstimator;

    public MultiSeriesMerger() {
        this(new ClockEstimator());
    }

    public MultiSeriesMerger(ClockEstimator clockEstimator) {
        this.clockEstimator = clockEstimator;
    }

    /**
     * @param tables                已对齐的设备表，至少一张
     * @param periodSeconds         采样周期
     * @param useFirstAsReference   true 时以第一张表的起点为参考时刻
     * @throws StructuralDataException 某张表的主采样间隔与周期相差超过 1 秒，或行数不足以判断
     */
    public HouseholdTable merge(String context, List<HouseholdTable> tables, int periodSeconds,
                                boolean useFirstAsReference) {
        if (tables == null || tables.isEmpty()) {
            throw new IllegalArgumentException("At least one table is required to merge");
        }
        if (tables.size() == 1) {
            log.info("{}: Only one table provided. No alignment necessary.", context);
            return tables.get(0);
        }

        long periodMillis = periodSeconds * 1000L;
        for (int i = 0; i < tables.size(); i++) {
            long modal = modalIntervalMillis(context, i, tables.get(i));
            if (Math.abs(modal - periodMillis) > FREQUENCY_TOLERANCE_MS) {
                throw new StructuralDataException(context + ": table " + i + " has inconsistent frequency: "
                        + modal / 1000.0 + " seconds instead of " + periodSeconds);
            }
        }

        List<Instant> firsts = new ArrayList<>();
        for (HouseholdTable table : tables) {
            firsts.add(table.minTimestamp());
        }
        Instant reference;
        if (useFirstAsReference) {
            reference = firsts.get(0);
        } else {
            reference = clockEstimator.estimatePhase(firsts, periodSeconds);
        }

        // 平移
        List<List<Instant>> shifted = new ArrayList<>();
        for (int i = 0; i < tables.size(); i++) {
            long shift = Math.floorMod(reference.toEpochMilli() - firsts.get(i).toEpochMilli(), periodMillis);
            if (shift > periodMillis / 2) {
                shift -= periodMillis;
            }
            log.info("{}: Table {} shifted by {} seconds", context, i, String.format("%.2f", shift / 1000.0));
            List<Instant> moved = new ArrayList<>(tables.get(i).rowCount());
            for (Instant ts : tables.get(i).getTimestamps()) {
                moved.add(ts.plusMillis(shift));
            }
            shifted.add(moved);
        }

        // 外连接
        TreeSet<Instant> union = new TreeSet<>();
        shifted.forEach(union::addAll);
        List<Instant> merged = new ArrayList<>(union);
        Map<Instant, Integer> position = new HashMap<>();
        for (int r = 0; r < merged.size(); r++) {
            position.put(merged.get(r), r);
        }

        Map<String, Integer> nameCounts = new HashMap<>();
        for (HouseholdTable table : tables) {
            for (String name : table.getColumnNames()) {
                nameCounts.merge(name, 1, Integer::sum);
            }
        }

        HouseholdTable result = new HouseholdTable(tables.get(0).getTimestampColumn(), merged);
        for (int i = 0; i < tables.size(); i++) {
            int[] mapping = new int[merged.size()];
            Arrays.fill(mapping, -1);
            List<Instant> moved = shifted.get(i);
            for (int row = 0; row < moved.size(); row++) {
                int target = position.get(moved.get(row));
                if (mapping[target] >= 0) {
                    throw new StructuralDataException(context + ": table " + i
                            + " has duplicate timestamp " + moved.get(row));
                }
                mapping[target] = row;
            }
            for (Column column : tables.get(i).getColumns()) {
                Column selected = column.select(mapping);
                if (nameCounts.get(column.getName()) > 1) {
                    selected = selected.rename(column.getName() + "_df" + i);
                }
                result.putColumn(selected);
            }
        }

        log.info("{}: All {} tables merged into {} rows", context, tables.size(), merged.size());
        return result;
    }

    /** 相邻时间戳间隔的众数，出现次数相同时取较小值 */
    private static long modalIntervalMillis(String context, int index, HouseholdTable table) {
        if (table.rowCount() < 2) {
            throw new StructuralDataException(context + ": table " + index
                    + " has fewer than two rows, cannot determine its frequency");
        }
        List<Instant> timestamps = table.isSortedUnique()
                ? table.getTimestamps() : table.sortByTimestamp().getTimestamps();
        TreeMap<Long, Integer> counts = new TreeMap<>();
        for (int i = 1; i < timestamps.size(); i++) {
            long step = timestamps.get(i).toEpochMilli() - timestamps.get(i - 1).toEpochMilli();
            counts.merge(step, 1, Integer::sum);
        }
        long modal = counts.firstKey();
        int best = 0;
        for (Map.Entry<Long, Integer> e : counts.entrySet()) {
            if (e.getValue() > best) {
                best = e.getValue();
                modal = e.getKey();
            }
        }
        return modal;
    }
}
