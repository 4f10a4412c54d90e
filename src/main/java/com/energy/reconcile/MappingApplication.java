package com.energy.reconcile;

import com.energy.reconcile.alignment.DeviceAlignmentService;
import com.energy.reconcile.core.HouseholdStorage;
import com.energy.reconcile.core.TableOperator;
import com.energy.reconcile.core.impl.DefaultOperatorManager;
import com.energy.reconcile.core.impl.HouseholdPipeline;
import com.energy.reconcile.model.*;
import com.energy.reconcile.operators.CounterReconciler;
import com.energy.reconcile.operators.FillDownOperator;
import com.energy.reconcile.operators.IntervalRegularizer;
import com.energy.reconcile.operators.RecordValidationOperator;
import com.energy.reconcile.storage.SQLiteHouseholdStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

/**
 * 系统启动引导类。
 * 创建存储、加载阈值目录、注册算子，然后逐个家庭执行处理管道并写回结果。
 *
 * 用法：java -jar meter-reconcile.jar [配置文件路径]
 */
public class MappingApplication {

    private static final Logger log = LoggerFactory.getLogger(MappingApplication.class);

    private final AppConfig config;
    private final HouseholdStorage storage;
    private final ThresholdCatalog catalog;
    private final DefaultOperatorManager operatorManager;
    private final HouseholdPipeline pipeline;
    private final DeviceAlignmentService alignmentService;

    public MappingApplication(AppConfig config, HouseholdStorage storage, ThresholdCatalog catalog) {
        this.config = config;
        this.storage = storage;
        this.catalog = catalog;

        this.operatorManager = new DefaultOperatorManager();
        registerBuiltinOperators(operatorManager);

        this.pipeline = new HouseholdPipeline(operatorManager, catalog, config.toPipelineConfig());
        this.alignmentService = new DeviceAlignmentService(config.getPeriodSeconds(), config.getTolerance(),
                config.getAlignmentMethod(), new HashSet<>(catalog.getCumulativeColumns()));
    }

    /**
     * 注册系统预置的四类算子
     */
    private void registerBuiltinOperators(DefaultOperatorManager manager) {
        manager.registerOperator(IntervalRegularizer.OPERATOR_ID, new IntervalRegularizer());
        manager.registerOperator(CounterReconciler.OPERATOR_ID, new CounterReconciler());
        manager.registerOperator(FillDownOperator.OPERATOR_ID, new FillDownOperator());
        manager.registerOperator(RecordValidationOperator.OPERATOR_ID, new RecordValidationOperator());

        log.info("Registered {} built-in operators.", manager.getAllOperators().size());
    }

    /**
     * 把一个家庭的多个设备表对齐到共同时钟并合并，合并结果作为该家庭的原始数据表写入存储。
     */
    public HouseholdTable importDevices(String householdId, Map<String, HouseholdTable> deviceTables) {
        HouseholdTable merged = alignmentService.alignAndMerge(householdId, deviceTables, false);
        HouseholdTable raw = merged.withTimestamps(HouseholdTable.READING_DATE, merged.getTimestamps());
        storage.saveRawHousehold(householdId, raw);
        return raw;
    }

    /** 处理单个家庭并写回结果 */
    public ProcessingResult processHousehold(String householdId) {
        HouseholdTable raw = storage.loadRawHousehold(householdId);
        if (raw == null) {
            log.warn("{}: No raw data found, skipping.", householdId);
            return ProcessingResult.rejected(householdId, "No raw data found");
        }

        ProcessingResult result = pipeline.process(householdId, raw);
        switch (result.getStatus()) {
            case COMPLETED:
                storage.saveHousehold(householdId, result.getTable());
                storage.saveAnomalyReports(householdId, result.getAnomalyReports());
                break;
            case DROPPED:
                // 丢弃的家庭只保留异常报告
                storage.saveAnomalyReports(householdId, result.getAnomalyReports());
                break;
            default:
                log.error("{}: Not stored, status {}: {}", householdId, result.getStatus(),
                        result.getErrorMessage());
        }
        return result;
    }

    /**
     * 逐个处理存储中的全部家庭，单个家庭失败不影响后续家庭。
     */
    public BatchSummary processAll() {
        List<String> households = storage.listRawHouseholds();
        log.info("=== Processing {} households ===", households.size());

        BatchSummary summary = new BatchSummary();
        for (String householdId : households) {
            summary.record(processHousehold(householdId));
        }
        log.info("=== Batch finished: {} ===", summary);
        return summary;
    }

    public void shutdown() {
        for (TableOperator operator : operatorManager.getAllOperators()) {
            operatorManager.unregisterOperator(operator.getMetadata().getOperatorId());
        }
        storage.shutdown();
        log.info("=== Application shut down ===");
    }

    public AppConfig getConfig() {
        return config;
    }

    public HouseholdPipeline getPipeline() {
        return pipeline;
    }

    public DeviceAlignmentService getAlignmentService() {
        return alignmentService;
    }

    public ThresholdCatalog getCatalog() {
        return catalog;
    }

    /**
     * 批处理汇总：各状态的家庭数
     */
    public static class BatchSummary {
        private final Map<ProcessingStatus, Integer> counts = new EnumMap<>(ProcessingStatus.class);

        void record(ProcessingResult result) {
            counts.merge(result.getStatus(), 1, Integer::sum);
        }

        public int getCount(ProcessingStatus status) {
            return counts.getOrDefault(status, 0);
        }

        public int getTotal() {
            return counts.values().stream().mapToInt(Integer::intValue).sum();
        }

        @Override
        public String toString() {
            return "BatchSummary" + counts;
        }
    }

    /**
     * 应用入口
     */
    public static void main(String[] args) {
        String configPath = (args.length > 0) ? args[0] : "config/application.properties";

        AppConfig config = AppConfig.load(configPath);
        log.info("Starting with config: {}", config);

        ThresholdCatalog catalog = (config.getThresholdsFile() != null)
                ? ThresholdCatalog.load(Paths.get(config.getThresholdsFile()))
                : ThresholdCatalog.loadDefault();

        MappingApplication app = new MappingApplication(config,
                new SQLiteHouseholdStorage(config.getStorageRoot(), config.getStorageDatabase()), catalog);
        try {
            app.processAll();
        } finally {
            app.shutdown();
        }
    }
}
