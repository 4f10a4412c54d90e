package com.energy.reconcile.core;

import com.energy.reconcile.model.AnomalyReport;
import com.energy.reconcile.model.HouseholdTable;

import java.util.List;
import java.util.Map;

/**
 * 家庭数据存储接口。
 *
 * 存储层只负责读写，不参与任何处理决策；表名、文件布局由实现决定。
 * 所有方法在底层失败时抛 StorageException。
 */
public interface HouseholdStorage {

    /** 列出所有存有原始数据的家庭标识，按标识排序 */
    List<String> listRawHouseholds();

    /**
     * 读取家庭原始数据表。
     *
     * @return 原始数据表；家庭不存在时返回null
     */
    HouseholdTable loadRawHousehold(String householdId);

    /** 写入家庭原始数据表，已存在则覆盖 */
    void saveRawHousehold(String householdId, HouseholdTable table);

    /** 写入处理后的家庭数据表，已存在则覆盖 */
    void saveHousehold(String householdId, HouseholdTable table);

    /**
     * 读取处理后的家庭数据表。
     *
     * @return 处理后的数据表；不存在时返回null
     */
    HouseholdTable loadHousehold(String householdId);

    /** 写入家庭各累计量列的异常报告，替换该家庭已有的报告 */
    void saveAnomalyReports(String householdId, Map<String, AnomalyReport> reports);

    /** 读取家庭各累计量列的异常报告，按列名索引 */
    Map<String, AnomalyReport> loadAnomalyReports(String householdId);

    /** 关闭存储，释放连接 */
    void shutdown();
}
