package com.energy.reconcile.operators;

import com.energy.reconcile.TableFixtures;
import com.energy.reconcile.core.impl.DefaultOperatorContext;
import com.energy.reconcile.exception.StructuralDataException;
import com.energy.reconcile.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("累计计数器修复")
class CounterReconcilerTest {

    private static final String GAS = "Gasgebruik";

    private CounterReconciler reconciler;
    private CounterAnomalyClassifier classifier;
    private ThresholdCatalog catalog;

    @BeforeEach
    void setUp() {
        reconciler = new CounterReconciler();
        classifier = new CounterAnomalyClassifier();
        catalog = ThresholdCatalog.builder()
                .add(GAS, VariableKind.CUMULATIVE, 0.0, null)
                .build();
    }

    private ReconciliationResult reconcile(Double... values) {
        HouseholdTable table = TableFixtures.single(GAS, values);
        CumulativeSeries series = table.series(GAS);
        return reconciler.reconcile("h1", series, classifier.classify("h1", series), false);
    }

    @Test
    @DisplayName("单调序列不做修改，首个差值为 0")
    void monotonicSeries_unchanged() {
        ReconciliationResult result = reconcile(0.0, 1.5, 1.5, 4.0);

        assertThat(result.getNulledCount()).isZero();
        assertThat(result.getCorrected().toList()).containsExactly(0.0, 1.5, 1.5, 4.0);
        assertThat(result.getDelta().getName()).isEqualTo("GasgebruikDiff");
        assertThat(result.getDelta().toList()).containsExactly(0.0, 1.5, 0.0, 2.5);
    }

    @Test
    @DisplayName("瞬时回落后恢复：只置空回落的读数")
    void transientGlitch_nullsSingleValue() {
        // Arrange & Act
        ReconciliationResult result = reconcile(0.0, 100.0, 200.0, 50.0, 250.0, 300.0);

        // Assert
        assertThat(result.getCorrected().toList()).containsExactly(0.0, 100.0, 200.0, null, 250.0, 300.0);
        assertThat(result.getDelta().toList()).containsExactly(0.0, 100.0, 100.0, null, null, 50.0);
        assertThat(CounterDeltas.hasNegative(result.getDelta())).isFalse();
        assertThat(result.getNulledCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("回落之后再无增长：置空回落点及其后全部读数")
    void dipWithoutRecovery_nullsTail() {
        ReconciliationResult result = reconcile(0.0, 100.0, 200.0, 50.0);

        assertThat(result.getCorrected().toList()).containsExactly(0.0, 100.0, 200.0, null);
        assertThat(CounterDeltas.hasNegative(result.getDelta())).isFalse();
    }

    @Test
    @DisplayName("回落之后只有零增长：从回落点起全部置空")
    void dipFollowedByFlatValues_nullsTail() {
        ReconciliationResult result = reconcile(0.0, 100.0, 50.0, 50.0, 50.0);

        assertThat(result.getCorrected().toList()).containsExactly(0.0, 100.0, null, null, null);
        assertThat(result.getNulledCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("计数器复位：牺牲复位点一个读数")
    void counterReset_sacrificesResetPoint() {
        ReconciliationResult result = reconcile(0.0, 100.0, 200.0, 5.0, 10.0, 20.0);

        assertThat(result.getCorrected().toList()).containsExactly(0.0, 100.0, 200.0, null, 10.0, 20.0);
        assertThat(result.getDelta().toList()).containsExactly(0.0, 100.0, 100.0, null, null, 10.0);
    }

    @Test
    @DisplayName("连续两次回落：两段都被置空")
    void consecutiveDips_nullsBoth() {
        ReconciliationResult result = reconcile(0.0, 100.0, 50.0, 20.0, 200.0);

        assertThat(result.getCorrected().toList()).containsExactly(0.0, 100.0, null, null, 200.0);
        assertThat(CounterDeltas.hasNegative(result.getDelta())).isFalse();
    }

    @Test
    @DisplayName("对已修复序列再次修复不再改变任何值")
    void reconcile_isIdempotent() {
        ReconciliationResult first = reconcile(0.0, 100.0, 200.0, 5.0, 10.0, 20.0);
        Double[] corrected = first.getCorrected().toList().toArray(new Double[0]);

        ReconciliationResult second = reconcile(corrected);

        assertThat(second.getNulledCount()).isZero();
        assertThat(second.getCorrected().toList()).isEqualTo(first.getCorrected().toList());
        assertThat(second.getDelta().toList()).isEqualTo(first.getDelta().toList());
    }

    @Test
    @DisplayName("未知值两侧的差值为未知")
    void delta_unknownNeighbours() {
        ReconciliationResult result = reconcile(1.0, null, 3.0, 4.0);

        assertThat(result.getDelta().toList()).containsExactly(0.0, null, null, 1.0);
    }

    @Test
    @DisplayName("诊断未通过且要求丢弃时返回丢弃结果")
    void reconcile_dropOnFailure() {
        HouseholdTable table = TableFixtures.single(GAS, 0.0, 100.0, 50.0, 150.0);
        CumulativeSeries series = table.series(GAS);
        AnomalyReport report = classifier.classify("h1", series);

        ReconciliationResult result = reconciler.reconcile("h1", series, report, true);

        assertThat(result.isDropped()).isTrue();
        assertThat(result.getCorrected().toList()).containsExactly(0.0, 100.0, 50.0, 150.0);
    }

    @Test
    @DisplayName("算子执行：追加差值列并登记异常报告")
    void execute_addsDiffColumnAndReports() {
        HouseholdTable input = TableFixtures.single(GAS, 0.0, 100.0, 200.0, 50.0, 250.0, 300.0);
        DefaultOperatorContext context = DefaultOperatorContext.standalone("h1", input, Map.of(), catalog);

        reconciler.initialize(context);
        reconciler.execute(context);

        HouseholdTable output = context.getOutputTable();
        assertThat(output.getValueColumn(GAS).toList()).containsExactly(0.0, 100.0, 200.0, null, 250.0, 300.0);
        assertThat(output.hasColumn("GasgebruikDiff")).isTrue();
        assertThat(context.getAnomalyReports().get(GAS).isNoNegativeDiff()).isFalse();
        assertThat(context.getWarnings()).anyMatch(w -> w.contains("Nulled 1"));
        assertThat(input.getValueColumn(GAS).isKnown(3)).isTrue();
    }

    @Test
    @DisplayName("算子执行：dropOnFailure 时诊断未通过的家庭被标记丢弃")
    void execute_dropOnFailure_marksDropped() {
        HouseholdTable input = TableFixtures.single(GAS, 0.0, 100.0, 50.0, 150.0);
        Map<String, Object> params = new HashMap<>();
        params.put("dropOnFailure", true);
        DefaultOperatorContext context = DefaultOperatorContext.standalone("h1", input, params, catalog);

        reconciler.initialize(context);
        reconciler.execute(context);

        assertThat(context.isDropped()).isTrue();
    }

    @Test
    @DisplayName("算子执行：缺失的累计量列只报告、不修复")
    void execute_missingColumn_reportedAndSkipped() {
        HouseholdTable input = TableFixtures.single("Other", 1.0, 2.0);
        DefaultOperatorContext context = DefaultOperatorContext.standalone("h1", input,
                Map.<String, Object>of("columns", List.of(GAS)), catalog);

        reconciler.initialize(context);
        reconciler.execute(context);

        assertThat(context.getAnomalyReports().get(GAS).hasColumn()).isFalse();
        assertThat(context.getOutputTable().hasColumn("GasgebruikDiff")).isFalse();
    }

    @Test
    @DisplayName("算子执行：重复时间戳是结构性错误")
    void execute_duplicateTimestamps_throws() {
        HouseholdTable input = new HouseholdTable(TableFixtures.atSeconds(0, 300, 300));
        input.putColumn(ValueColumn.of(GAS, 1.0, 2.0, 3.0));
        DefaultOperatorContext context = DefaultOperatorContext.standalone("h1", input, Map.of(), catalog);

        reconciler.initialize(context);

        assertThatThrownBy(() -> reconciler.execute(context)).isInstanceOf(StructuralDataException.class);
    }
}
