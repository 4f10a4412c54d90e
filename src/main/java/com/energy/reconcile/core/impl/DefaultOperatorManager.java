package com.energy.reconcile.core.impl;

import com.energy.reconcile.core.OperatorManager;
import com.energy.reconcile.core.TableOperator;
import com.energy.reconcile.model.OperatorMetadata;
import com.energy.reconcile.model.ParameterDefinition;
import com.energy.reconcile.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 算子管理器默认实现。
 * 使用ConcurrentHashMap存储算子注册表，启动后只读，可在多个家庭的处理之间共享。
 */
public class DefaultOperatorManager implements OperatorManager {

    private static final Logger log = LoggerFactory.getLogger(DefaultOperatorManager.class);

    /** 算子注册表：operatorId -> TableOperator实例 */
    private final ConcurrentHashMap<String, TableOperator> operatorRegistry = new ConcurrentHashMap<>();

    @Override
    public boolean registerOperator(String operatorId, TableOperator operator) {
        if (operatorId == null || operatorId.isBlank()) {
            log.error("Cannot register operator with null or blank id");
            return false;
        }
        if (operator == null) {
            log.error("Cannot register null operator for id: {}", operatorId);
            return false;
        }

        TableOperator existing = operatorRegistry.putIfAbsent(operatorId, operator);
        if (existing != null) {
            log.warn("Operator '{}' is already registered, registration rejected.", operatorId);
            return false;
        }

        log.info("Operator '{}' registered successfully. Version: {}",
                operatorId, operator.getMetadata().getVersion());
        return true;
    }

    @Override
    public boolean unregisterOperator(String operatorId) {
        if (operatorId == null || operatorId.isBlank()) {
            return false;
        }

        TableOperator removed = operatorRegistry.remove(operatorId);
        if (removed == null) {
            log.warn("Operator '{}' not found, nothing to unregister.", operatorId);
            return false;
        }

        try {
            removed.cleanup();
        } catch (RuntimeException e) {
            log.error("Error during cleanup of operator '{}': {}", operatorId, e.getMessage(), e);
        }

        log.info("Operator '{}' unregistered successfully.", operatorId);
        return true;
    }

    @Override
    public TableOperator getOperator(String operatorId) {
        return operatorRegistry.get(operatorId);
    }

    @Override
    public List<TableOperator> getAllOperators() {
        return new ArrayList<>(operatorRegistry.values());
    }

    @Override
    public ValidationResult validateOperator(String operatorId, Map<String, Object> parameters) {
        TableOperator operator = operatorRegistry.get(operatorId);
        if (operator == null) {
            return ValidationResult.failure("Operator '" + operatorId + "' is not registered.");
        }

        OperatorMetadata metadata = operator.getMetadata();
        Map<String, Object> params = (parameters != null) ? parameters : Collections.emptyMap();
        ValidationResult result = new ValidationResult();

        for (ParameterDefinition definition : metadata.getParameterDefinitions()) {
            Object value = params.get(definition.getName());
            if (value == null) {
                // 可选参数未提供时由算子取默认值
                if (definition.isRequired()) {
                    result.addError("Required parameter '" + definition.getName() + "' is missing.");
                }
                continue;
            }
            String error = definition.check(value);
            if (error != null) {
                result.addError(error);
            }
        }

        for (String key : params.keySet()) {
            if (metadata.findParameter(key) == null) {
                result.addWarning("Parameter '" + key + "' is not defined in operator '"
                        + operatorId + "' metadata, it will be ignored.");
            }
        }

        if (!result.isValid()) {
            log.warn("Operator '{}' parameters rejected: {}", operatorId, result.summary());
        }
        return result;
    }
}
