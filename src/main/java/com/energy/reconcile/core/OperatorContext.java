package com.energy.reconcile.core;

import com.energy.reconcile.model.AnomalyReport;
import com.energy.reconcile.model.HouseholdTable;
import com.energy.reconcile.model.ThresholdCatalog;

/**
 * 算子上下文接口：算子与管道交互的唯一桥梁。
 *
 * 为算子提供以下能力：
 * 1. 获取输入数据表
 * 2. 输出处理后的数据表
 * 3. 读取配置参数
 * 4. 查询阈值目录
 * 5. 上报警告、异常报告和丢弃标记
 */
public interface OperatorContext {

    /** 当前处理的家庭标识，用作日志前缀 */
    String getHouseholdId();

    /**
     * 获取输入数据表。管道第一个算子读取原始表，后续算子读取前一个算子的输出。
     *
     * @return 输入数据表，不为null
     */
    HouseholdTable getInputTable();

    /**
     * 设置输出数据表。算子未调用此方法时，输出等同于输入。
     */
    void setOutputTable(HouseholdTable table);

    /**
     * 获取指定名称的算子参数，支持泛型类型安全转换。
     *
     * @param paramName    参数名称
     * @param defaultValue 参数不存在时的默认值，同时用于推断返回类型
     * @param <T>          参数值类型
     * @return 参数值；参数不存在时返回defaultValue
     */
    <T> T getParameter(String paramName, T defaultValue);

    /** 阈值目录，只读 */
    ThresholdCatalog getCatalog();

    void addWarning(String warning);

    void addAnomalyReport(AnomalyReport report);

    /**
     * 标记当前家庭本轮被丢弃，管道在当前算子结束后停止。
     *
     * @param reason 丢弃原因
     */
    void markDropped(String reason);

    boolean isDropped();
}
