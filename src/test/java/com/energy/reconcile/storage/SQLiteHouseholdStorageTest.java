package com.energy.reconcile.storage;

import com.energy.reconcile.TableFixtures;
import com.energy.reconcile.model.*;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.energy.reconcile.model.TriState.FALSE;
import static com.energy.reconcile.model.TriState.TRUE;
import static com.energy.reconcile.model.TriState.UNKNOWN;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SQLite 家庭数据存储")
class SQLiteHouseholdStorageTest {

    @TempDir
    Path tempDir;

    private SQLiteHouseholdStorage storage;

    @BeforeEach
    void setUp() {
        storage = new SQLiteHouseholdStorage(tempDir.toString(), "test.db");
    }

    @AfterEach
    void tearDown() {
        storage.shutdown();
    }

    @Test
    @DisplayName("数值、诊断与文本列往返后保持不变")
    void household_roundTrip() {
        // Arrange
        HouseholdTable table = TableFixtures.single("Gasgebruik", 1.5, null, 3.25);
        table.putColumn(FlagColumn.of("validate_Gasgebruik", TRUE, UNKNOWN, FALSE));
        table.putColumn(TextColumn.of("Note", "a", null, "c"));

        // Act
        storage.saveHousehold("house-1", table);
        HouseholdTable loaded = storage.loadHousehold("house-1");

        // Assert
        assertThat(loaded.getTimestampColumn()).isEqualTo(HouseholdTable.READING_DATE);
        assertThat(loaded.getTimestamps()).isEqualTo(table.getTimestamps());
        assertThat(loaded.getColumnNames()).containsExactly("Gasgebruik", "validate_Gasgebruik", "Note");
        assertThat(loaded.getValueColumn("Gasgebruik").toList()).containsExactly(1.5, null, 3.25);
        assertThat(loaded.getFlagColumn("validate_Gasgebruik").toList()).containsExactly(TRUE, UNKNOWN, FALSE);
        assertThat(((TextColumn) loaded.getColumn("Note")).toList()).containsExactly("a", null, "c");
    }

    @Test
    @DisplayName("原始表按家庭标识列出，覆盖写入后读取最新数据")
    void raw_listAndOverwrite() {
        storage.saveRawHousehold("b", TableFixtures.single("x", 1.0));
        storage.saveRawHousehold("a", TableFixtures.single("x", 1.0));
        storage.saveRawHousehold("a", TableFixtures.single("x", 2.0, 3.0));
        storage.saveHousehold("c", TableFixtures.single("x", 1.0));

        assertThat(storage.listRawHouseholds()).containsExactly("a", "b");
        assertThat(storage.loadRawHousehold("a").getValueColumn("x").toList()).containsExactly(2.0, 3.0);
        assertThat(storage.loadRawHousehold("c")).isNull();
        assertThat(storage.loadHousehold("missing")).isNull();
    }

    @Test
    @DisplayName("异常报告往返并替换旧报告")
    void anomalyReports_roundTrip() {
        AnomalyReport report = AnomalyReport.builder("Gasgebruik")
                .gapWithinBound(false)
                .worstGap(TableFixtures.START, Duration.ofMinutes(90))
                .noNegativeDiff(false)
                .addNegativeDiffTimestamp(TableFixtures.START.plusSeconds(600))
                .addNegativeDiffTimestamp(TableFixtures.START.plusSeconds(1200))
                .noUnexpectedZero(false)
                .zeroRange(TableFixtures.START.plusSeconds(600), TableFixtures.START.plusSeconds(900))
                .coverage(0.75)
                .enoughCoverage(false)
                .build();
        Map<String, AnomalyReport> reports = new LinkedHashMap<>();
        reports.put("Gasgebruik", report);
        reports.put("Zon-opwekTotaal", AnomalyReport.missingColumn("Zon-opwekTotaal"));
        storage.saveAnomalyReports("h1", Map.of("old", AnomalyReport.missingColumn("old")));

        storage.saveAnomalyReports("h1", reports);
        Map<String, AnomalyReport> loaded = storage.loadAnomalyReports("h1");

        assertThat(loaded).containsOnlyKeys("Gasgebruik", "Zon-opwekTotaal");
        AnomalyReport gas = loaded.get("Gasgebruik");
        assertThat(gas.checks()).isEqualTo(report.checks());
        assertThat(gas.getWorstGap()).contains(Duration.ofMinutes(90));
        assertThat(gas.getWorstGapStart()).contains(TableFixtures.START);
        assertThat(gas.getNegativeDiffTimestamps()).isEqualTo(report.getNegativeDiffTimestamps());
        assertThat(gas.getZeroRangeEnd()).contains(TableFixtures.START.plusSeconds(900));
        assertThat(gas.getCoverage()).isEqualTo(0.75);
        assertThat(loaded.get("Zon-opwekTotaal").hasColumn()).isFalse();
    }

    @Test
    @DisplayName("家庭标识中的特殊字符被替换为合法表名")
    void sanitizeTableName() {
        assertThat(SQLiteHouseholdStorage.sanitizeTableName("house 1/a-b")).isEqualTo("house_1_a_b");
    }

    @Test
    @DisplayName("清理后同名的家庭标识写入不同的表，互不覆盖")
    void raw_idsWithSameSanitizedName_keptApart() {
        // Arrange
        storage.saveRawHousehold("h-1", TableFixtures.single("x", 1.0, 2.0));

        // Act
        storage.saveRawHousehold("h_1", TableFixtures.single("x", 9.0, 9.0));

        // Assert
        assertThat(storage.loadRawHousehold("h-1").getValueColumn("x").toList()).containsExactly(1.0, 2.0);
        assertThat(storage.loadRawHousehold("h_1").getValueColumn("x").toList()).containsExactly(9.0, 9.0);
        assertThat(SQLiteHouseholdStorage.tableSuffix("h-1"))
                .startsWith("h_1_")
                .isNotEqualTo(SQLiteHouseholdStorage.tableSuffix("h_1"));
    }

    @Test
    @DisplayName("写入过程中出现运行时异常时回滚，保留原有报告")
    void anomalyReports_runtimeFailureRollsBack() {
        // Arrange
        storage.saveAnomalyReports("h1", Map.of("old", AnomalyReport.missingColumn("old")));
        Map<String, AnomalyReport> broken = new LinkedHashMap<>();
        broken.put("Gasgebruik", AnomalyReport.missingColumn("Gasgebruik"));
        broken.put("Zon-opwekTotaal", null);

        // Act
        assertThatThrownBy(() -> storage.saveAnomalyReports("h1", broken))
                .isInstanceOf(NullPointerException.class);

        // Assert
        assertThat(storage.loadAnomalyReports("h1")).containsOnlyKeys("old");
    }
}
