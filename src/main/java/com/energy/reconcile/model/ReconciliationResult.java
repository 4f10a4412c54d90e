package com.energy.reconcile.model;

/**
 * 单个累计量列的修复结果：修正后的列、重新计算的差值列、被置为未知的值数量，
 * 以及该家庭是否因诊断未通过而被丢弃。
 */
public final class ReconciliationResult {

    private final ValueColumn corrected;
    private final ValueColumn delta;
    private final int nulledCount;
    private final boolean dropped;

    public ReconciliationResult(ValueColumn corrected, ValueColumn delta, int nulledCount, boolean dropped) {
        this.corrected = corrected;
        this.delta = delta;
        this.nulledCount = nulledCount;
        this.dropped = dropped;
    }

    public ValueColumn getCorrected() { return corrected; }
    public ValueColumn getDelta() { return delta; }
    public int getNulledCount() { return nulledCount; }
    public boolean isDropped() { return dropped; }
}
