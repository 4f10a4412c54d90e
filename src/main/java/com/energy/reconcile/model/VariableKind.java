package com.energy.reconcile.model;

import java.util.Locale;

/**
 * 变量类型。
 */
public enum VariableKind {
    /** 单调递增的累计计数器，例如电表读数 */
    CUMULATIVE,
    /** 五分钟区间量 */
    INSTANTANEOUS,
    /** 瞬时量，例如温度、功率 */
    MOMENTARY;

    /**
     * 解析阈值表中的类型名，同时接受英文名与数据模型中的荷兰语名。
     *
     * @throws IllegalArgumentException 无法识别的类型名
     */
    public static VariableKind parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Variable kind must not be null");
        }
        switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "cumulative":
            case "cumulatief":
                return CUMULATIVE;
            case "instantaneous":
            case "5-minute":
                return INSTANTANEOUS;
            case "momentary":
            case "momentaan":
                return MOMENTARY;
            default:
                throw new IllegalArgumentException("Unknown variable kind: '" + text + "'");
        }
    }
}
