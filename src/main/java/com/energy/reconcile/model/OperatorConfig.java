package com.energy.reconcile.model;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 处理管道中的一个步骤：引用一个已注册算子，并给出它的执行位置和参数。
 * 创建后不可修改，同一配置可以被多个家庭的处理共享。
 */
public final class OperatorConfig {

    /** 按执行位置升序 */
    public static final Comparator<OperatorConfig> BY_ORDER = Comparator.comparingInt(OperatorConfig::getOrder);

    private final String operatorId;
    private final int order;
    private final Map<String, Object> parameters;

    public OperatorConfig(String operatorId, int order, Map<String, Object> parameters) {
        if (operatorId == null || operatorId.isEmpty()) {
            throw new IllegalArgumentException("Operator id must not be empty");
        }
        this.operatorId = operatorId;
        this.order = order;
        this.parameters = (parameters == null)
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public String getOperatorId() { return operatorId; }
    public int getOrder() { return order; }
    public Map<String, Object> getParameters() { return parameters; }

    @Override
    public String toString() {
        return operatorId + "#" + order + parameters;
    }
}
