package com.energy.reconcile.model;

import com.energy.reconcile.exception.StructuralDataException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.io.StringReader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("阈值目录")
class ThresholdCatalogTest {

    private static final String CSV = String.join("\n",
            "variable,kind,unit,min,max,description",
            "# comment line",
            "Gasgebruik,cumulatief,m3,0,n.a.,gas",
            "GasgebruikDiff,5-minute,m3,0,1,gas per interval",
            "Temperatuur,momentaan,C,-20,N/A,",
            "");

    @Test
    @DisplayName("解析 CSV：类型、单位与缺省界限")
    void fromCsv_parsesRows() throws IOException {
        ThresholdCatalog catalog = ThresholdCatalog.fromCsv(new StringReader(CSV));

        assertThat(catalog.size()).isEqualTo(3);
        VariableThreshold gas = catalog.get("Gasgebruik").orElseThrow();
        assertThat(gas.getKind()).isEqualTo(VariableKind.CUMULATIVE);
        assertThat(gas.getUnit()).isEqualTo("m3");
        assertThat(gas.getMin().getAsDouble()).isEqualTo(0.0);
        assertThat(gas.getMax()).isEmpty();

        VariableThreshold temp = catalog.get("Temperatuur").orElseThrow();
        assertThat(temp.getDescription()).isNull();
        assertThat(temp.isWithinBounds(1000.0)).isTrue();
        assertThat(temp.isWithinBounds(-20.0)).isTrue();
        assertThat(temp.isWithinBounds(-20.5)).isFalse();

        assertThat(catalog.getCumulativeColumns()).containsExactly("Gasgebruik");
        assertThat(catalog.namesOfKind(VariableKind.INSTANTANEOUS)).containsExactly("GasgebruikDiff");
    }

    @Test
    @DisplayName("表头缺少 max 列时抛出结构性异常")
    void fromCsv_missingHeader_throws() {
        String csv = "variable,kind,min\nGasgebruik,cumulatief,0\n";

        assertThatThrownBy(() -> ThresholdCatalog.fromCsv(new StringReader(csv)))
                .isInstanceOf(StructuralDataException.class)
                .hasMessageContaining("max");
    }

    @Test
    @DisplayName("界限不是数字时抛出结构性异常")
    void fromCsv_badBound_throws() {
        String csv = "variable,kind,min,max\nGasgebruik,cumulatief,zero,n.a.\n";

        assertThatThrownBy(() -> ThresholdCatalog.fromCsv(new StringReader(csv)))
                .isInstanceOf(StructuralDataException.class)
                .hasMessageContaining("line 2");
    }

    @Test
    @DisplayName("重复变量名被拒绝")
    void builder_duplicate_throws() {
        ThresholdCatalog.Builder builder = ThresholdCatalog.builder()
                .add("Gasgebruik", VariableKind.CUMULATIVE, 0.0, null);

        assertThatThrownBy(() -> builder.add("Gasgebruik", VariableKind.CUMULATIVE, 0.0, null))
                .isInstanceOf(StructuralDataException.class);
    }

    @Test
    @DisplayName("下界大于上界时拒绝构造")
    void threshold_minAboveMax_throws() {
        assertThatThrownBy(() -> new VariableThreshold("x", VariableKind.MOMENTARY, null, 5.0, 1.0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("内置阈值表包含全部累计量")
    void loadDefault_containsCumulativeVariables() {
        ThresholdCatalog catalog = ThresholdCatalog.loadDefault();

        assertThat(catalog.getCumulativeColumns())
                .contains("ElektriciteitNetgebruikHoog", "Gasgebruik", "Zon-opwekTotaal")
                .hasSize(17);
        assertThat(catalog.contains("GasgebruikDiff")).isTrue();
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "cumulatief, CUMULATIVE",
            "Cumulative, CUMULATIVE",
            "5-minute, INSTANTANEOUS",
            "momentaan, MOMENTARY",
            "MOMENTARY, MOMENTARY"
    })
    @DisplayName("类型名解析")
    void variableKind_parse(String text, VariableKind expected) {
        assertThat(VariableKind.parse(text)).isEqualTo(expected);
    }
}
