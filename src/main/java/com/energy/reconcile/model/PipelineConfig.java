package com.energy.reconcile.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 家庭数据处理管道配置，定义算子链及其参数
 */
public class PipelineConfig {
    /** 算子步骤，执行时按 order 排序 */
    private final List<OperatorConfig> operatorPipeline = new ArrayList<>();
    private String description;

    public PipelineConfig addOperator(OperatorConfig operator) {
        this.operatorPipeline.add(operator);
        return this;
    }

    /** 按算子标识查找步骤，不存在时返回 null */
    public OperatorConfig findOperator(String operatorId) {
        for (OperatorConfig step : operatorPipeline) {
            if (step.getOperatorId().equals(operatorId)) {
                return step;
            }
        }
        return null;
    }

    public List<OperatorConfig> getOperatorPipeline() { return Collections.unmodifiableList(operatorPipeline); }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
}
