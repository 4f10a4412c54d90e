package com.energy.reconcile;

import com.energy.reconcile.core.HouseholdStorage;
import com.energy.reconcile.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("应用批处理")
class MappingApplicationTest {

    private static final String GAS = "Gasgebruik";

    @Mock
    private HouseholdStorage mockStorage;

    private MappingApplication app;

    @BeforeEach
    void setUp() {
        ThresholdCatalog catalog = ThresholdCatalog.builder()
                .add(GAS, VariableKind.CUMULATIVE, 0.0, null)
                .build();
        app = new MappingApplication(new AppConfig(), mockStorage, catalog);
    }

    @Test
    @DisplayName("逐个家庭处理：完成的写回数据与报告，未完成的不写回")
    void processAll_storesCompletedOnly() {
        // Arrange
        HouseholdTable good = TableFixtures.single(GAS, 0.0, 100.0, 200.0, 50.0, 250.0, 300.0);
        when(mockStorage.listRawHouseholds()).thenReturn(List.of("bad", "good"));
        when(mockStorage.loadRawHousehold("good")).thenReturn(good);
        when(mockStorage.loadRawHousehold("bad")).thenReturn(null);

        // Act
        MappingApplication.BatchSummary summary = app.processAll();

        // Assert
        assertThat(summary.getTotal()).isEqualTo(2);
        assertThat(summary.getCount(ProcessingStatus.COMPLETED)).isEqualTo(1);
        assertThat(summary.getCount(ProcessingStatus.REJECTED)).isEqualTo(1);

        ArgumentCaptor<HouseholdTable> saved = ArgumentCaptor.forClass(HouseholdTable.class);
        verify(mockStorage).saveHousehold(eq("good"), saved.capture());
        assertThat(saved.getValue().getValueColumn(GAS).isKnown(3)).isFalse();
        assertThat(saved.getValue().hasColumn("GasgebruikDiff")).isTrue();
        verify(mockStorage).saveAnomalyReports(eq("good"), anyMap());
        verify(mockStorage, never()).saveHousehold(eq("bad"), any());
        verify(mockStorage, never()).saveAnomalyReports(eq("bad"), anyMap());
    }

    @Test
    @DisplayName("重复时间戳经区间规整后保留第一条，家庭仍可完成处理")
    void duplicateTimestamps_leftJoinedByRegularizer() {
        HouseholdTable duplicated = new HouseholdTable(TableFixtures.atSeconds(0, 300, 300, 600));
        duplicated.putColumn(ValueColumn.of(GAS, 1.0, 2.0, 9.0, 3.0));
        when(mockStorage.loadRawHousehold("h1")).thenReturn(duplicated);

        ProcessingResult result = app.processHousehold("h1");

        assertThat(result.getStatus()).isEqualTo(ProcessingStatus.COMPLETED);
        assertThat(result.getTable().getValueColumn(GAS).toList()).containsExactly(1.0, 2.0, 3.0);
    }

    @Test
    @DisplayName("丢弃的家庭只写回异常报告")
    void droppedHousehold_storesReportsOnly() {
        Properties props = new Properties();
        props.setProperty("pipeline.drop.on.failure", "true");
        ThresholdCatalog catalog = ThresholdCatalog.builder().add(GAS, VariableKind.CUMULATIVE, 0.0, null).build();
        MappingApplication dropping = new MappingApplication(AppConfig.fromProperties(props), mockStorage, catalog);
        when(mockStorage.loadRawHousehold("h1"))
                .thenReturn(TableFixtures.single(GAS, 0.0, 100.0, 50.0, 150.0));

        ProcessingResult result = dropping.processHousehold("h1");

        assertThat(result.getStatus()).isEqualTo(ProcessingStatus.DROPPED);
        verify(mockStorage).saveAnomalyReports(eq("h1"), anyMap());
        verify(mockStorage, never()).saveHousehold(any(), any());
    }

    @Test
    @DisplayName("缺少原始数据的家庭被拒绝")
    void missingRawData_rejected() {
        when(mockStorage.loadRawHousehold("h1")).thenReturn(null);

        assertThat(app.processHousehold("h1").getStatus()).isEqualTo(ProcessingStatus.REJECTED);
    }

    @Test
    @DisplayName("多个设备表对齐合并后作为原始数据写入")
    void importDevices_alignsAndStores() {
        Map<String, HouseholdTable> devices = new LinkedHashMap<>();
        HouseholdTable meter = new HouseholdTable(List.of(Instant.ofEpochSecond(7),
                Instant.ofEpochSecond(307), Instant.ofEpochSecond(607)));
        meter.putColumn(ValueColumn.of(GAS, 1.0, 2.0, 3.0));
        HouseholdTable heatpump = new HouseholdTable(List.of(Instant.ofEpochSecond(298),
                Instant.ofEpochSecond(598), Instant.ofEpochSecond(898)));
        heatpump.putColumn(ValueColumn.of("ElektriciteitsgebruikWarmtepomp", 5.0, 6.0, 7.0));
        devices.put("meter", meter);
        devices.put("heatpump", heatpump);

        HouseholdTable raw = app.importDevices("h1", devices);

        assertThat(raw.getTimestampColumn()).isEqualTo(HouseholdTable.READING_DATE);
        assertThat(raw.getColumnNames()).containsExactly(GAS, "ElektriciteitsgebruikWarmtepomp");
        assertThat(raw.getValueColumn(GAS).countKnown()).isEqualTo(3);
        verify(mockStorage).saveRawHousehold("h1", raw);
    }

    @Test
    @DisplayName("配置文件缺失时使用默认值")
    void config_defaultsWhenFileMissing() {
        AppConfig config = AppConfig.load("does/not/exist.properties");

        assertThat(config.getPeriodSeconds()).isEqualTo(300);
        assertThat(config.getAlignmentMethod()).isEqualTo(AlignmentMethod.NEAREST);
        assertThat(config.toPipelineConfig().getOperatorPipeline())
                .extracting(OperatorConfig::getOperatorId)
                .containsExactly("interval_regularization", "counter_reconciliation", "fill_down",
                        "record_validation");
    }

    @Test
    @DisplayName("配置项写入对应算子的参数")
    void config_propertiesFlowIntoOperatorParameters() {
        Properties props = new Properties();
        props.setProperty("pipeline.min.coverage", "0.75");
        props.setProperty("pipeline.drop.on.failure", "true");
        props.setProperty("pipeline.fill.down.columns", "ElektriciteitsgebruikBoilervat, ,Zonne-energie");

        PipelineConfig pipeline = AppConfig.fromProperties(props).toPipelineConfig();

        assertThat(pipeline.findOperator("counter_reconciliation").getParameters())
                .containsEntry("minCoverage", 0.75)
                .containsEntry("dropOnFailure", true);
        assertThat(pipeline.findOperator("fill_down").getParameters().get("columns"))
                .isEqualTo(List.of("ElektriciteitsgebruikBoilervat", "Zonne-energie"));
        assertThat(pipeline.findOperator("smoothing")).isNull();
    }
}
