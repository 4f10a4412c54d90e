package com.energy.reconcile.model;

/**
 * 诊断列使用的三值逻辑：真、假、未知。
 * 未知表示该行无法判定（例如参与校验的值缺失），不等同于校验失败。
 */
public enum TriState {
    TRUE,
    FALSE,
    UNKNOWN;

    public static TriState of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public boolean isKnown() {
        return this != UNKNOWN;
    }

    /** 与另一个判定结果做三值与运算 */
    public TriState and(TriState other) {
        if (this == FALSE || other == FALSE) return FALSE;
        if (this == UNKNOWN || other == UNKNOWN) return UNKNOWN;
        return TRUE;
    }
}
