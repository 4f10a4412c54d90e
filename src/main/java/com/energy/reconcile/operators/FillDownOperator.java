package com.energy.reconcile.operators;

import com.energy.reconcile.core.OperatorContext;
import com.energy.reconcile.core.TableOperator;
import com.energy.reconcile.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 低频设备填充算子。
 * 部分设备只在读数变化时上报，对这些列依次做前向填充、后向填充，剩余未知值填 0。
 * 被填充的列已有差值列或在阈值目录中属于累计量时，填充后重新计算其差值列。
 *
 * 参数：
 * - columns: 需要填充的列 (STRING_LIST, 默认 Boilervat / Radiator / Booster 三个电耗列)
 */
public class FillDownOperator implements TableOperator {

    private static final Logger log = LoggerFactory.getLogger(FillDownOperator.class);

    public static final String OPERATOR_ID = "fill_down";

    public static final List<String> DEFAULT_COLUMNS = List.of(
            "ElektriciteitsgebruikBoilervat",
            "ElektriciteitsgebruikRadiator",
            "ElektriciteitsgebruikBooster");

    private List<String> columns;
    private Set<String> cumulativeColumns;

    @Override
    public void initialize(OperatorContext context) {
        this.columns = context.getParameter("columns", DEFAULT_COLUMNS);
        this.cumulativeColumns = new HashSet<>(context.getCatalog().getCumulativeColumns());
    }

    @Override
    public void execute(OperatorContext context) {
        context.setOutputTable(fillDown(context.getHouseholdId(), context.getInputTable(), columns,
                cumulativeColumns));
    }

    public HouseholdTable fillDown(String context, HouseholdTable table, List<String> columns) {
        return fillDown(context, table, columns, Set.of());
    }

    /**
     * 对表中存在的指定列做填充，返回新表；不存在的列跳过。
     *
     * @param cumulativeColumns 累计量列名，这些列填充后总是生成差值列
     */
    public HouseholdTable fillDown(String context, HouseholdTable table, List<String> columns,
                                   Set<String> cumulativeColumns) {
        HouseholdTable result = table.copy();
        for (String name : columns) {
            ValueColumn column = result.getValueColumn(name);
            if (column == null) {
                log.debug("{}: Fill-down column '{}' not present, skipping.", context, name);
                continue;
            }
            int filled = fill(column);
            if (filled > 0) {
                log.info("{}: Filled {} missing values in '{}'.", context, filled, name);
            }
            String diffName = CounterDeltas.diffColumnName(name);
            if (result.hasColumn(diffName) || cumulativeColumns.contains(name)) {
                result.putColumn(CounterDeltas.computeDelta(column, diffName));
            }
        }
        return result;
    }

    private static int fill(ValueColumn column) {
        int n = column.size();
        int filled = 0;

        // 前向填充
        int last = -1;
        for (int i = 0; i < n; i++) {
            if (column.isKnown(i)) {
                last = i;
            } else if (last >= 0) {
                column.set(i, column.getDouble(last));
                filled++;
            }
        }

        // 后向填充，只可能剩下开头一段
        int first = column.firstKnownRow();
        if (first > 0) {
            double value = column.getDouble(first);
            for (int i = 0; i < first; i++) {
                column.set(i, value);
                filled++;
            }
        } else if (first < 0) {
            for (int i = 0; i < n; i++) {
                column.set(i, 0.0);
                filled++;
            }
        }
        return filled;
    }

    @Override
    public void cleanup() {
        // 无需清理
    }

    @Override
    public OperatorMetadata getMetadata() {
        return new OperatorMetadata(OPERATOR_ID, "低频设备填充算子", "1.0.0",
                "对只在变化时上报的设备列做前向、后向填充，全部缺失时填 0。",
                List.of(VariableKind.CUMULATIVE),
                List.of(ParameterDefinition.stringList("columns", DEFAULT_COLUMNS, "需要填充的列")));
    }
}
