package com.energy.reconcile.alignment;

import com.energy.reconcile.exception.DataIntegrityException;
import com.energy.reconcile.exception.StructuralDataException;
import com.energy.reconcile.model.*;
import com.energy.reconcile.operators.CounterDeltas;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 时间戳对齐器：把一个设备的读数对齐到时钟网格上。
 *
 * 网格从时钟参考时刻开始，到最后一个读数时刻加一个周期为止（含）。
 * 容差按原始时间戳与网格点的距离计算，等于容差的读数计入。
 *
 * <ul>
 *   <li>NEAREST：每个读数先吸附到最近的网格点，两个读数吸附到同一网格点时抛出
 *       {@link StructuralDataException}；每个网格点取容差内最近的读数，等距时取较早的一条</li>
 *   <li>INTERPOLATE：非累计量列同 NEAREST；累计量列取容差内的已知读数，
 *       两条及以上且不递减时线性插值（超出范围时取端点值），不单调时抛出
 *       {@link DataIntegrityException}，只有一条时原样使用，没有则为未知</li>
 * </ul>
 */
public class TimestampAligner {

    private static final Logger log = LoggerFactory.getLogger(TimestampAligner.class);

    /** 对齐后时间戳列名 */
    public static final String ALIGNED_TIMESTAMP = "aligned_timestamp";

    public static final Duration DEFAULT_TOLERANCE = Duration.ofSeconds(10);

    public HouseholdTable align(String context, HouseholdTable table, Clock clock) {
        return align(context, table, clock, DEFAULT_TOLERANCE, AlignmentMethod.NEAREST, Set.of());
    }

    public HouseholdTable align(String context, HouseholdTable table, Clock clock, Duration tolerance,
                                AlignmentMethod method, Set<String> cumulativeColumns) {
        if (tolerance.isNegative()) {
            throw new IllegalArgumentException("Tolerance must not be negative, got " + tolerance);
        }
        if (table.hasDuplicateTimestamps()) {
            throw new StructuralDataException(context + ": duplicate source timestamps in column '"
                    + table.getTimestampColumn() + "'");
        }
        HouseholdTable sorted = table.isSortedUnique() ? table : table.sortByTimestamp();
        List<Instant> source = sorted.getTimestamps();
        List<Instant> grid = buildGrid(clock, sorted.maxTimestamp());

        if (method == AlignmentMethod.NEAREST) {
            checkSnapCollisions(context, source, clock);
        }

        int[] nearest = nearestMapping(source, grid, tolerance.toMillis());
        HouseholdTable aligned = new HouseholdTable(ALIGNED_TIMESTAMP, grid);
        for (Column column : sorted.getColumns()) {
            boolean interpolate = method == AlignmentMethod.INTERPOLATE
                    && cumulativeColumns.contains(column.getName())
                    && column instanceof ValueColumn;
            if (interpolate) {
                aligned.putColumn(interpolateCumulative(context, (ValueColumn) column, source, grid,
                        tolerance.toMillis()));
            } else {
                aligned.putColumn(column.select(nearest));
            }
        }

        log.info("{}: Aligned {} readings onto {} grid points ({}, tolerance {}s).",
                context, source.size(), grid.size(), method, tolerance.getSeconds());
        return aligned;
    }

    private static List<Instant> buildGrid(Clock clock, Instant lastObserved) {
        List<Instant> grid = new ArrayList<>();
        if (lastObserved == null) {
            return grid;
        }
        Instant end = lastObserved.plus(clock.getPeriod());
        for (Instant g = clock.getReference(); !g.isAfter(end); g = g.plus(clock.getPeriod())) {
            grid.add(g);
        }
        return grid;
    }

    private static void checkSnapCollisions(String context, List<Instant> source, Clock clock) {
        Map<Instant, Instant> snapped = new HashMap<>();
        for (Instant ts : source) {
            Instant point = clock.nearestGridPoint(ts);
            Instant previous = snapped.putIfAbsent(point, ts);
            if (previous != null) {
                throw new StructuralDataException(context + ": multiple records found for aligned timestamp "
                        + point + " (" + previous + ", " + ts + ")");
            }
        }
    }

    /** 每个网格点取容差内最近的源行，等距取较早的；无则为 -1。source 和 grid 均已升序 */
    private static int[] nearestMapping(List<Instant> source, List<Instant> grid, long toleranceMillis) {
        int[] mapping = new int[grid.size()];
        int cursor = 0;
        for (int g = 0; g < grid.size(); g++) {
            long target = grid.get(g).toEpochMilli();
            while (cursor < source.size() && source.get(cursor).toEpochMilli() < target) {
                cursor++;
            }
            int best = -1;
            long bestDistance = Long.MAX_VALUE;
            if (cursor > 0) {
                best = cursor - 1;
                bestDistance = target - source.get(cursor - 1).toEpochMilli();
            }
            if (cursor < source.size()) {
                long distance = source.get(cursor).toEpochMilli() - target;
                if (distance < bestDistance) {
                    best = cursor;
                    bestDistance = distance;
                }
            }
            mapping[g] = (best >= 0 && bestDistance <= toleranceMillis) ? best : -1;
        }
        return mapping;
    }

    private static ValueColumn interpolateCumulative(String context, ValueColumn values, List<Instant> source,
                                                     List<Instant> grid, long toleranceMillis) {
        ValueColumn result = new ValueColumn(values.getName(), grid.size());
        int start = 0;
        for (int g = 0; g < grid.size(); g++) {
            long target = grid.get(g).toEpochMilli();
            while (start < source.size() && source.get(start).toEpochMilli() < target - toleranceMillis) {
                start++;
            }
            List<Integer> nearby = new ArrayList<>();
            for (int i = start; i < source.size() && source.get(i).toEpochMilli() <= target + toleranceMillis; i++) {
                if (values.isKnown(i)) {
                    nearby.add(i);
                }
            }
            if (nearby.isEmpty()) {
                continue;
            }
            if (nearby.size() == 1) {
                result.set(g, values.getDouble(nearby.get(0)));
                continue;
            }
            for (int k = 1; k < nearby.size(); k++) {
                if (CounterDeltas.isNegative(values.getDouble(nearby.get(k)) - values.getDouble(nearby.get(k - 1)))) {
                    throw new DataIntegrityException(context + ": decreasing cumulative values in '"
                            + values.getName() + "' near " + grid.get(g));
                }
            }
            result.set(g, interpolate(target, nearby, values, source));
        }
        return result;
    }

    /** 线性插值，目标时刻在已知点范围外时取端点值 */
    private static double interpolate(long target, List<Integer> rows, ValueColumn values, List<Instant> source) {
        int first = rows.get(0);
        int last = rows.get(rows.size() - 1);
        if (target <= source.get(first).toEpochMilli()) {
            return values.getDouble(first);
        }
        if (target >= source.get(last).toEpochMilli()) {
            return values.getDouble(last);
        }
        for (int k = 1; k < rows.size(); k++) {
            int lo = rows.get(k - 1);
            int hi = rows.get(k);
            long x0 = source.get(lo).toEpochMilli();
            long x1 = source.get(hi).toEpochMilli();
            if (target <= x1) {
                double y0 = values.getDouble(lo);
                double y1 = values.getDouble(hi);
                return y0 + (y1 - y0) * (target - x0) / (double) (x1 - x0);
            }
        }
        return values.getDouble(last);
    }
}
