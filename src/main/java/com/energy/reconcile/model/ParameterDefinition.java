package com.energy.reconcile.model;

import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * 算子参数定义，由各算子在元数据中声明，管理器据此在执行前校验管道配置。
 */
public final class ParameterDefinition {

    /** 参数类型 */
    public enum Type {
        /** 数值，可带上下限 */
        NUMBER,
        /** 布尔值，也接受 "true"/"false" 文本 */
        BOOLEAN,
        /** 取值限定在给定集合内的字符串 */
        ENUM,
        /** 字符串列表，或逗号分隔的单个字符串 */
        STRING_LIST
    }

    private final String name;
    private final Type type;
    private final Object defaultValue;
    private final String description;
    private final boolean required;
    private final Double minValue;
    private final Double maxValue;
    private final List<String> allowedValues;

    private ParameterDefinition(String name, Type type, Object defaultValue, String description, boolean required,
                                Double minValue, Double maxValue, List<String> allowedValues) {
        this.name = name;
        this.type = type;
        this.defaultValue = defaultValue;
        this.description = description;
        this.required = required;
        this.minValue = minValue;
        this.maxValue = maxValue;
        this.allowedValues = allowedValues;
    }

    /**
     * @param min 下限，null 表示不限
     * @param max 上限，null 表示不限
     */
    public static ParameterDefinition number(String name, Number defaultValue, Double min, Double max,
                                             String description) {
        return new ParameterDefinition(name, Type.NUMBER, defaultValue, description, false, min, max,
                Collections.emptyList());
    }

    public static ParameterDefinition flag(String name, boolean defaultValue, String description) {
        return new ParameterDefinition(name, Type.BOOLEAN, defaultValue, description, false, null, null,
                Collections.emptyList());
    }

    public static ParameterDefinition oneOf(String name, String defaultValue, List<String> allowedValues,
                                            String description) {
        return new ParameterDefinition(name, Type.ENUM, defaultValue, description, false, null, null,
                List.copyOf(allowedValues));
    }

    public static ParameterDefinition stringList(String name, List<String> defaultValue, String description) {
        return new ParameterDefinition(name, Type.STRING_LIST, defaultValue, description, false, null, null,
                Collections.emptyList());
    }

    /** 返回一个必填的副本 */
    public ParameterDefinition required() {
        return new ParameterDefinition(name, type, defaultValue, description, true, minValue, maxValue,
                allowedValues);
    }

    /**
     * 校验一个已提供的参数值。
     *
     * @return 错误信息，值合法时返回 null
     */
    public String check(Object value) {
        switch (type) {
            case NUMBER:
                if (!(value instanceof Number)) {
                    return "Parameter '" + name + "' expects a number, got: " + describe(value);
                }
                double number = ((Number) value).doubleValue();
                if (minValue != null && number < minValue) {
                    return "Parameter '" + name + "' value " + number + " is below minimum " + minValue;
                }
                if (maxValue != null && number > maxValue) {
                    return "Parameter '" + name + "' value " + number + " exceeds maximum " + maxValue;
                }
                return null;
            case BOOLEAN:
                if (value instanceof Boolean) {
                    return null;
                }
                if (value instanceof String) {
                    String text = ((String) value).trim().toLowerCase(Locale.ROOT);
                    if (text.equals("true") || text.equals("false")) {
                        return null;
                    }
                }
                return "Parameter '" + name + "' expects true or false, got: " + value;
            case ENUM:
                if (!(value instanceof String) || !allowedValues.contains(value)) {
                    return "Parameter '" + name + "' value '" + value + "' is not one of " + allowedValues;
                }
                return null;
            case STRING_LIST:
                if (value instanceof String) {
                    return null;
                }
                if (!(value instanceof List)) {
                    return "Parameter '" + name + "' expects a list of column names, got: " + describe(value);
                }
                for (Object item : (List<?>) value) {
                    if (!(item instanceof String)) {
                        return "Parameter '" + name + "' expects a list of column names, found element: " + item;
                    }
                }
                return null;
            default:
                throw new IllegalStateException("Unhandled parameter type " + type);
        }
    }

    private static String describe(Object value) {
        return value.getClass().getSimpleName() + " '" + value + "'";
    }

    public String getName() { return name; }
    public Type getType() { return type; }
    public Object getDefaultValue() { return defaultValue; }
    public String getDescription() { return description; }
    public boolean isRequired() { return required; }
    public Double getMinValue() { return minValue; }
    public Double getMaxValue() { return maxValue; }
    public List<String> getAllowedValues() { return allowedValues; }

    @Override
    public String toString() {
        return name + ":" + type + (required ? " (required)" : "");
    }
}
