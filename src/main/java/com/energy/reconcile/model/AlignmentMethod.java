package com.energy.reconcile.model;

import java.util.Locale;

/**
 * 时间戳对齐方式
 */
public enum AlignmentMethod {
    NEAREST,
    INTERPOLATE;

    public static AlignmentMethod parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Alignment method must not be null");
        }
        try {
            return valueOf(text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown alignment method: '" + text
                    + "', expected nearest or interpolate", e);
        }
    }
}
