package com.energy.reconcile.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 算子参数校验结果。
 * 有错误时管道拒绝执行；警告只记录，不影响执行。
 */
public class ValidationResult {

    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    public static ValidationResult success() {
        return new ValidationResult();
    }

    public static ValidationResult failure(String error) {
        ValidationResult result = new ValidationResult();
        result.addError(error);
        return result;
    }

    public void addError(String error) {
        errors.add(error);
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }

    /**
     * 合并某个算子的校验结果，消息前加上算子标识
     */
    public void absorb(String operatorId, ValidationResult other) {
        other.errors.forEach(e -> errors.add(operatorId + ": " + e));
        other.warnings.forEach(w -> warnings.add(operatorId + ": " + w));
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    /** 错误摘要，用于日志和 REJECTED 结果 */
    public String summary() {
        return errors.size() + " error(s): " + String.join("; ", errors);
    }
}
