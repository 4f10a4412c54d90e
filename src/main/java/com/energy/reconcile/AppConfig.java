package com.energy.reconcile;

import com.energy.reconcile.model.AlignmentMethod;
import com.energy.reconcile.model.OperatorConfig;
import com.energy.reconcile.model.PipelineConfig;
import com.energy.reconcile.operators.CounterReconciler;
import com.energy.reconcile.operators.FillDownOperator;
import com.energy.reconcile.operators.IntervalRegularizer;
import com.energy.reconcile.operators.RecordValidationOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * 应用配置类。
 * 对应配置文件中的存储、管道与对齐参数。
 */
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    // ---- 存储 ----
    private String storageRoot = "data/storage";
    private String storageDatabase = "households.db";

    // ---- 阈值目录 ----
    private String thresholdsFile;             // 为空时读取classpath中的thresholds.csv

    // ---- 处理管道 ----
    private int periodSeconds = 300;
    private double maxGapMinutes = 60.0;
    private double minCoverage = 0.9;
    private boolean dropOnFailure = false;
    private List<String> fillDownColumns = FillDownOperator.DEFAULT_COLUMNS;

    // ---- 时间戳对齐 ----
    private long toleranceSeconds = 10;
    private AlignmentMethod alignmentMethod = AlignmentMethod.NEAREST;

    public static AppConfig load(String configPath) {
        AppConfig config = new AppConfig();
        try (InputStream in = new FileInputStream(configPath)) {
            Properties props = new Properties();
            props.load(in);
            config.apply(props);
        } catch (IOException e) {
            log.error("Failed to load config from {}, using defaults. Error: {}", configPath, e.getMessage());
        }
        return config;
    }

    public static AppConfig fromProperties(Properties props) {
        AppConfig config = new AppConfig();
        config.apply(props);
        return config;
    }

    private void apply(Properties props) {
        storageRoot = props.getProperty("storage.root", storageRoot);
        storageDatabase = props.getProperty("storage.database", storageDatabase);
        String thresholds = props.getProperty("thresholds.file", "").trim();
        thresholdsFile = thresholds.isEmpty() ? null : thresholds;

        periodSeconds = Integer.parseInt(
                props.getProperty("pipeline.period.seconds", String.valueOf(periodSeconds)).trim());
        maxGapMinutes = Double.parseDouble(
                props.getProperty("pipeline.max.gap.minutes", String.valueOf(maxGapMinutes)).trim());
        minCoverage = Double.parseDouble(
                props.getProperty("pipeline.min.coverage", String.valueOf(minCoverage)).trim());
        dropOnFailure = Boolean.parseBoolean(
                props.getProperty("pipeline.drop.on.failure", String.valueOf(dropOnFailure)).trim());
        String fillDown = props.getProperty("pipeline.fill.down.columns");
        if (fillDown != null) {
            fillDownColumns = splitList(fillDown);
        }

        toleranceSeconds = Long.parseLong(
                props.getProperty("alignment.tolerance.seconds", String.valueOf(toleranceSeconds)).trim());
        alignmentMethod = AlignmentMethod.parse(
                props.getProperty("alignment.method", alignmentMethod.name()).trim());
    }

    /**
     * 按配置生成默认处理管道：区间规整 → 累计量修复 → 向下填充 → 逐行校验
     */
    public PipelineConfig toPipelineConfig() {
        Map<String, Object> regularization = new LinkedHashMap<>();
        regularization.put("periodSeconds", periodSeconds);

        Map<String, Object> reconciliation = new LinkedHashMap<>();
        reconciliation.put("maxGapMinutes", maxGapMinutes);
        reconciliation.put("minCoverage", minCoverage);
        reconciliation.put("dropOnFailure", dropOnFailure);

        Map<String, Object> fillDown = new LinkedHashMap<>();
        fillDown.put("columns", new ArrayList<>(fillDownColumns));

        Map<String, Object> validation = new LinkedHashMap<>();
        validation.put("periodSeconds", periodSeconds);

        PipelineConfig pipeline = new PipelineConfig()
                .addOperator(new OperatorConfig(IntervalRegularizer.OPERATOR_ID, 1, regularization))
                .addOperator(new OperatorConfig(CounterReconciler.OPERATOR_ID, 2, reconciliation))
                .addOperator(new OperatorConfig(FillDownOperator.OPERATOR_ID, 3, fillDown))
                .addOperator(new OperatorConfig(RecordValidationOperator.OPERATOR_ID, 4, validation));
        pipeline.setDescription("household reconciliation, period " + periodSeconds + "s");
        return pipeline;
    }

    private static List<String> splitList(String value) {
        List<String> items = new ArrayList<>();
        for (String item : Arrays.asList(value.split(","))) {
            if (!item.trim().isEmpty()) {
                items.add(item.trim());
            }
        }
        return items;
    }

    // ---- Getters ----
    public String getStorageRoot() { return storageRoot; }
    public String getStorageDatabase() { return storageDatabase; }
    public String getThresholdsFile() { return thresholdsFile; }
    public int getPeriodSeconds() { return periodSeconds; }
    public double getMaxGapMinutes() { return maxGapMinutes; }
    public double getMinCoverage() { return minCoverage; }
    public boolean isDropOnFailure() { return dropOnFailure; }
    public List<String> getFillDownColumns() { return fillDownColumns; }
    public Duration getTolerance() { return Duration.ofSeconds(toleranceSeconds); }
    public AlignmentMethod getAlignmentMethod() { return alignmentMethod; }

    @Override
    public String toString() {
        return "AppConfig{storageRoot='" + storageRoot + "'"
                + ", database='" + storageDatabase + "'"
                + ", period=" + periodSeconds + "s"
                + ", maxGap=" + maxGapMinutes + "min"
                + ", minCoverage=" + minCoverage
                + ", dropOnFailure=" + dropOnFailure
                + ", tolerance=" + toleranceSeconds + "s"
                + ", method=" + alignmentMethod + "}";
    }
}
