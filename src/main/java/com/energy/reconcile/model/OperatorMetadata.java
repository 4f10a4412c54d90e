package com.energy.reconcile.model;

import java.util.List;

/**
 * 算子元数据：标识、版本、适用的变量类型和参数定义
 */
public final class OperatorMetadata {

    private final String operatorId;
    private final String name;
    private final String version;
    private final String description;
    private final List<VariableKind> applicableKinds;
    private final List<ParameterDefinition> parameterDefinitions;

    public OperatorMetadata(String operatorId, String name, String version, String description,
                            List<VariableKind> applicableKinds, List<ParameterDefinition> parameterDefinitions) {
        this.operatorId = operatorId;
        this.name = name;
        this.version = version;
        this.description = description;
        this.applicableKinds = List.copyOf(applicableKinds);
        this.parameterDefinitions = List.copyOf(parameterDefinitions);
    }

    /** 无参数、适用于所有变量类型的元数据 */
    public static OperatorMetadata of(String operatorId, String version) {
        return new OperatorMetadata(operatorId, operatorId, version, "", List.of(VariableKind.values()), List.of());
    }

    /** 按名称查找参数定义，不存在时返回 null */
    public ParameterDefinition findParameter(String parameterName) {
        for (ParameterDefinition definition : parameterDefinitions) {
            if (definition.getName().equals(parameterName)) {
                return definition;
            }
        }
        return null;
    }

    public String getOperatorId() { return operatorId; }
    public String getName() { return name; }
    public String getVersion() { return version; }
    public String getDescription() { return description; }
    public List<VariableKind> getApplicableKinds() { return applicableKinds; }
    public List<ParameterDefinition> getParameterDefinitions() { return parameterDefinitions; }

    @Override
    public String toString() {
        return operatorId + "@" + version + parameterDefinitions;
    }
}
