package com.energy.reconcile.core;

import com.energy.reconcile.model.ValidationResult;

import java.util.List;
import java.util.Map;

/**
 * 算子管理器接口：算子的注册、查询与参数校验。
 */
public interface OperatorManager {

    /**
     * 注册算子。
     *
     * @param operatorId 算子唯一标识
     * @param operator   算子实例
     * @return 注册成功返回true；标识已存在或参数非法时返回false
     */
    boolean registerOperator(String operatorId, TableOperator operator);

    /**
     * 注销算子，同时调用其cleanup。
     */
    boolean unregisterOperator(String operatorId);

    /**
     * @return 算子实例；未注册时返回null
     */
    TableOperator getOperator(String operatorId);

    List<TableOperator> getAllOperators();

    /**
     * 按算子元数据中的参数定义校验参数。
     * 类型不符、越界、必选缺失为错误；未定义的参数为警告。
     */
    ValidationResult validateOperator(String operatorId, Map<String, Object> parameters);
}
