package com.energy.reconcile.model;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * 单个变量的阈值记录：名称、类型、单位与可选的上下限。
 * 缺失的界限表示该方向不设限。
 */
public final class VariableThreshold {

    private final String name;
    private final VariableKind kind;
    private final String unit;
    private final Double min;
    private final Double max;
    private final String description;

    public VariableThreshold(String name, VariableKind kind, String unit, Double min, Double max) {
        this(name, kind, unit, min, max, null);
    }

    public VariableThreshold(String name, VariableKind kind, String unit,
                             Double min, Double max, String description) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Variable name must not be null or blank");
        }
        if (min != null && max != null && min > max) {
            throw new IllegalArgumentException("Variable '" + name + "' has min " + min
                    + " greater than max " + max);
        }
        this.name = name;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.unit = unit;
        this.min = min;
        this.max = max;
        this.description = description;
    }

    public String getName() { return name; }
    public VariableKind getKind() { return kind; }
    public String getUnit() { return unit; }
    public String getDescription() { return description; }

    public OptionalDouble getMin() {
        return (min != null) ? OptionalDouble.of(min) : OptionalDouble.empty();
    }

    public OptionalDouble getMax() {
        return (max != null) ? OptionalDouble.of(max) : OptionalDouble.empty();
    }

    public boolean isCumulative() {
        return kind == VariableKind.CUMULATIVE;
    }

    /** 数值是否落在 [min, max] 内，缺失的界限视为无界 */
    public boolean isWithinBounds(double value) {
        if (min != null && value < min) return false;
        return max == null || value <= max;
    }

    @Override
    public String toString() {
        return "VariableThreshold{" + name + ", " + kind + ", [" + (min != null ? min : "-inf")
                + ", " + (max != null ? max : "+inf") + "] " + (unit != null ? unit : "") + "}";
    }
}
