package com.energy.reconcile.operators;

import com.energy.reconcile.TableFixtures;
import com.energy.reconcile.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.energy.reconcile.model.TriState.FALSE;
import static com.energy.reconcile.model.TriState.TRUE;
import static com.energy.reconcile.model.TriState.UNKNOWN;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("逐行校验")
class RecordValidationOperatorTest {

    private ThresholdCatalog catalog;
    private RecordValidationOperator operator;

    @BeforeEach
    void setUp() {
        catalog = ThresholdCatalog.builder()
                .add("Gasgebruik", VariableKind.CUMULATIVE, 0.0, null)
                .add("GasgebruikDiff", VariableKind.INSTANTANEOUS, 0.0, 1.0)
                .add("Temperatuur", VariableKind.MOMENTARY, -20.0, 50.0)
                .add("CO2", VariableKind.MOMENTARY, 0.0, 5000.0)
                .build();
        operator = new RecordValidationOperator();
    }

    @Test
    @DisplayName("阈值、合并、时间戳唯一性、采样间隔与离群点诊断列")
    void validate_addsAllFlagColumns() {
        // Arrange
        HouseholdTable table = TableFixtures.single("Gasgebruik", 0.0, 1.0, 2.0, null);
        table.putColumn(ValueColumn.of("GasgebruikDiff", 0.0, 0.5, 2.0, null));
        table.putColumn(ValueColumn.of("Temperatuur", 20.0, 60.0, null, null));

        // Act
        HouseholdTable result = operator.validate("h1", table, catalog, Duration.ofMinutes(5), true);

        // Assert
        assertThat(result.getFlagColumn("validate_Gasgebruik").toList())
                .containsExactly(TRUE, TRUE, TRUE, UNKNOWN);
        assertThat(result.getFlagColumn("validate_GasgebruikDiff").toList())
                .containsExactly(TRUE, TRUE, FALSE, UNKNOWN);
        assertThat(result.getFlagColumn("validate_Temperatuur").toList())
                .containsExactly(TRUE, FALSE, UNKNOWN, UNKNOWN);
        assertThat(result.getFlagColumn(RecordValidationOperator.COMBINED_FLAG).toList())
                .containsExactly(TRUE, FALSE, FALSE, UNKNOWN);
        assertThat(result.getFlagColumn(RecordValidationOperator.UNIQUE_DATE_FLAG).toList())
                .containsExactly(TRUE, TRUE, TRUE, TRUE);
        assertThat(result.getFlagColumn(RecordValidationOperator.INTERVAL_FLAG).toList())
                .containsExactly(UNKNOWN, TRUE, TRUE, TRUE);
        assertThat(result.getFlagColumn("validate_GasgebruikDiff_outliers").toList())
                .containsExactly(UNKNOWN, TRUE, TRUE, UNKNOWN);
        assertThat(result.hasColumn("validate_CO2")).isFalse();
        assertThat(table.hasColumn(RecordValidationOperator.COMBINED_FLAG)).isFalse();
    }

    @Test
    @DisplayName("重复时间戳与错误间隔")
    void validate_duplicateTimestampsAndIntervals() {
        HouseholdTable table = new HouseholdTable(TableFixtures.atSeconds(0, 300, 300, 900));
        table.putColumn(ValueColumn.of("Temperatuur", 1.0, 2.0, 3.0, 4.0));

        HouseholdTable result = operator.validate("h1", table, catalog, Duration.ofMinutes(5), false);

        assertThat(result.getFlagColumn(RecordValidationOperator.UNIQUE_DATE_FLAG).toList())
                .containsExactly(TRUE, TRUE, FALSE, TRUE);
        assertThat(result.getFlagColumn(RecordValidationOperator.INTERVAL_FLAG).toList())
                .containsExactly(UNKNOWN, TRUE, FALSE, FALSE);
    }

    @Test
    @DisplayName("没有阈值列时合并列全部为 UNKNOWN")
    void combine_withoutChecks_isUnknown() {
        HouseholdTable table = TableFixtures.single("Other", 1.0, 2.0);

        HouseholdTable result = operator.validate("h1", table, catalog, Duration.ofMinutes(5), true);

        assertThat(result.getFlagColumn(RecordValidationOperator.COMBINED_FLAG).toList())
                .containsExactly(UNKNOWN, UNKNOWN);
    }
}
