package com.energy.reconcile.model;

/**
 * 单个家庭的处理状态
 */
public enum ProcessingStatus {
    /** 全部算子执行成功 */
    COMPLETED,
    /** 诊断未通过且配置为失败即丢弃，本轮不输出数据表 */
    DROPPED,
    /** 结构错误或后置条件被破坏 */
    FAILED,
    /** 算子参数校验未通过，未执行任何算子 */
    REJECTED
}
