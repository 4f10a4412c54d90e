package com.energy.reconcile.exception;

/**
 * 后置条件被破坏：修复后的累计序列仍存在负增量，或插值阶段遇到非单调的累计值。
 * 说明输入数据已损坏到修复算法无法处理的程度，必须显式暴露。
 */
public class DataIntegrityException extends RuntimeException {

    public DataIntegrityException(String message) {
        super(message);
    }
}
