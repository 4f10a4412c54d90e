package com.energy.reconcile.core.impl;

import com.energy.reconcile.core.OperatorManager;
import com.energy.reconcile.core.TableOperator;
import com.energy.reconcile.exception.DataIntegrityException;
import com.energy.reconcile.exception.StructuralDataException;
import com.energy.reconcile.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 家庭数据处理管道。
 * 按配置顺序串联执行算子，前一个算子的输出即后一个算子的输入。
 *
 * 单个家庭的结构错误或后置条件失败不会中断整批处理，而是转换为 FAILED 结果；
 * 参数校验失败时不执行任何算子，结果为 REJECTED。
 */
public class HouseholdPipeline {

    private static final Logger log = LoggerFactory.getLogger(HouseholdPipeline.class);

    private final OperatorManager operatorManager;
    private final ThresholdCatalog catalog;
    private final List<OperatorConfig> pipeline;

    /** 执行统计 */
    private final AtomicInteger totalCompleted = new AtomicInteger(0);
    private final AtomicInteger totalDropped = new AtomicInteger(0);
    private final AtomicInteger totalFailed = new AtomicInteger(0);
    private final AtomicInteger totalRejected = new AtomicInteger(0);

    public HouseholdPipeline(OperatorManager operatorManager, ThresholdCatalog catalog, PipelineConfig config) {
        this.operatorManager = operatorManager;
        this.catalog = catalog;
        this.pipeline = new ArrayList<>(config.getOperatorPipeline());
        this.pipeline.sort(OperatorConfig.BY_ORDER);
    }

    /**
     * 校验管道中所有算子的参数。
     */
    public ValidationResult validate() {
        ValidationResult result = new ValidationResult();
        for (OperatorConfig opConfig : pipeline) {
            result.absorb(opConfig.getOperatorId(),
                    operatorManager.validateOperator(opConfig.getOperatorId(), opConfig.getParameters()));
        }
        return result;
    }

    /**
     * 处理单个家庭。
     *
     * @param householdId 家庭标识
     * @param input       原始数据表，不会被修改
     */
    public ProcessingResult process(String householdId, HouseholdTable input) {
        long startTime = System.currentTimeMillis();

        ValidationResult validation = validate();
        if (!validation.isValid()) {
            log.error("{}: Operator parameter validation failed, {}", householdId, validation.summary());
            totalRejected.incrementAndGet();
            return ProcessingResult.rejected(householdId,
                    "Operator parameter validation failed, " + validation.summary());
        }
        validation.getWarnings().forEach(w -> log.warn("{}: {}", householdId, w));

        PipelineDiagnostics diagnostics = new PipelineDiagnostics();
        validation.getWarnings().forEach(diagnostics::addWarning);

        DefaultOperatorContext previousContext = null;
        try {
            for (OperatorConfig opConfig : pipeline) {
                TableOperator operator = operatorManager.getOperator(opConfig.getOperatorId());
                if (operator == null) {
                    throw new IllegalStateException("Operator not found: " + opConfig.getOperatorId());
                }

                DefaultOperatorContext context = new DefaultOperatorContext(
                        householdId,
                        opConfig.getParameters(),
                        catalog,
                        diagnostics,
                        previousContext == null ? input : null,
                        previousContext);

                // 执行算子
                operator.initialize(context);
                operator.execute(context);
                previousContext = context;

                if (diagnostics.isDropped()) {
                    totalDropped.incrementAndGet();
                    log.error("{}: Household dropped by operator '{}': {}",
                            householdId, opConfig.getOperatorId(), diagnostics.getDropReason());
                    return new ProcessingResult(householdId, ProcessingStatus.DROPPED, null,
                            diagnostics.getAnomalyReports(), diagnostics.getWarnings(),
                            diagnostics.getDropReason(), System.currentTimeMillis() - startTime);
                }
            }
        } catch (StructuralDataException | DataIntegrityException e) {
            return failed(householdId, diagnostics, e, startTime);
        } catch (RuntimeException e) {
            log.error("{}: Unexpected error in pipeline", householdId, e);
            return failed(householdId, diagnostics, e, startTime);
        }

        HouseholdTable output = (previousContext != null) ? previousContext.getOutputTable() : input.copy();
        long elapsed = System.currentTimeMillis() - startTime;
        totalCompleted.incrementAndGet();
        log.info("{}: Pipeline completed in {}ms, {} rows, {} warnings",
                householdId, elapsed, output.rowCount(), diagnostics.getWarnings().size());
        return new ProcessingResult(householdId, ProcessingStatus.COMPLETED, output,
                diagnostics.getAnomalyReports(), diagnostics.getWarnings(), null, elapsed);
    }

    private ProcessingResult failed(String householdId, PipelineDiagnostics diagnostics,
                                    RuntimeException e, long startTime) {
        totalFailed.incrementAndGet();
        log.error("{}: Household failed: {}", householdId, e.getMessage());
        return new ProcessingResult(householdId, ProcessingStatus.FAILED, null,
                diagnostics.getAnomalyReports(), diagnostics.getWarnings(), e.getMessage(),
                System.currentTimeMillis() - startTime);
    }

    public List<OperatorConfig> getPipeline() {
        return pipeline;
    }

    /** 获取执行统计 */
    public int getTotalCompleted() { return totalCompleted.get(); }
    public int getTotalDropped() { return totalDropped.get(); }
    public int getTotalFailed() { return totalFailed.get(); }
    public int getTotalRejected() { return totalRejected.get(); }
}
