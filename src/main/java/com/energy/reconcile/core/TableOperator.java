package com.energy.reconcile.core;

import com.energy.reconcile.model.OperatorMetadata;

/**
 * 统一算子接口：所有家庭数据处理算子的基础契约。
 *
 * 算子是处理逻辑的最小执行单元，对一张家庭数据表执行一种特定处理。
 * 多个算子按指定顺序串联组成处理管道，数据表依次流经各算子。
 *
 * 算子生命周期：
 *   initialize → execute → cleanup
 *
 * 实现约定：
 * - 算子不得修改输入表，结果通过 OperatorContext#setOutputTable 输出
 * - 数据质量问题记录到诊断列、异常报告或警告中，不抛异常
 * - 结构错误抛 StructuralDataException，后置条件被破坏抛 DataIntegrityException
 */
public interface TableOperator {

    /**
     * 算子初始化，在每个家庭执行前调用，完成参数解析。
     *
     * @param context 算子上下文，提供参数读取能力
     */
    void initialize(OperatorContext context);

    /**
     * 执行处理逻辑。
     * 通过context获取输入表，执行处理逻辑，通过context输出结果。
     */
    void execute(OperatorContext context);

    /**
     * 算子清理，在算子卸载时调用。
     */
    void cleanup();

    /**
     * 返回算子的元数据信息，用于参数校验和算子发现。
     */
    OperatorMetadata getMetadata();
}
