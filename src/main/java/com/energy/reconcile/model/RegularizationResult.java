package com.energy.reconcile.model;

/**
 * 采样间隔规整结果。
 */
public final class RegularizationResult {

    /** 规整方式 */
    public enum Outcome {
        /** 行数与期望一致，原样返回 */
        UNCHANGED,
        /** 外连接补齐缺失网格点 */
        GAPS_FILLED,
        /** 外连接后行数超出期望（重复或不在网格上的时间戳），改用左连接 */
        DUPLICATES_LEFT_JOINED,
        /** 行数多于期望，左连接到网格 */
        EXCESS_LEFT_JOINED
    }

    private final HouseholdTable table;
    private final Outcome outcome;
    private final long expectedRows;
    private final int insertedRows;
    private final int droppedRows;

    public RegularizationResult(HouseholdTable table, Outcome outcome,
                                long expectedRows, int insertedRows, int droppedRows) {
        this.table = table;
        this.outcome = outcome;
        this.expectedRows = expectedRows;
        this.insertedRows = insertedRows;
        this.droppedRows = droppedRows;
    }

    public HouseholdTable getTable() { return table; }
    public Outcome getOutcome() { return outcome; }
    public long getExpectedRows() { return expectedRows; }
    public int getInsertedRows() { return insertedRows; }
    public int getDroppedRows() { return droppedRows; }
}
