package com.energy.reconcile.exception;

/**
 * 结构性数据错误：缺少必需列、对齐后时间戳重复、数值列出现非数值、采样周期不一致等。
 * 抛出后当前处理单元（一个家庭或一组设备序列）立即终止，不做任何隐式修正。
 */
public class StructuralDataException extends RuntimeException {

    public StructuralDataException(String message) {
        super(message);
    }

    public StructuralDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
