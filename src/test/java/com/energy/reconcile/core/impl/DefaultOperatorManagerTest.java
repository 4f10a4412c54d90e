package com.energy.reconcile.core.impl;

import com.energy.reconcile.core.TableOperator;
import com.energy.reconcile.model.OperatorMetadata;
import com.energy.reconcile.model.ParameterDefinition;
import com.energy.reconcile.model.ValidationResult;
import com.energy.reconcile.model.VariableKind;
import com.energy.reconcile.operators.CounterReconciler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("算子管理器")
class DefaultOperatorManagerTest {

    @Mock
    private TableOperator mockOperator;

    private DefaultOperatorManager manager;

    @BeforeEach
    void setUp() {
        manager = new DefaultOperatorManager();
        manager.registerOperator(CounterReconciler.OPERATOR_ID, new CounterReconciler());
    }

    @Test
    @DisplayName("重复标识、空标识与空算子被拒绝")
    void register_rejectsInvalid() {
        assertThat(manager.registerOperator(CounterReconciler.OPERATOR_ID, new CounterReconciler())).isFalse();
        assertThat(manager.registerOperator(" ", new CounterReconciler())).isFalse();
        assertThat(manager.registerOperator("x", null)).isFalse();
        assertThat(manager.getAllOperators()).hasSize(1);
    }

    @Test
    @DisplayName("注销时调用 cleanup，cleanup 异常不影响注销")
    void unregister_callsCleanup() {
        when(mockOperator.getMetadata()).thenReturn(OperatorMetadata.of("mock", "1.0.0"));
        doThrow(new IllegalStateException("boom")).when(mockOperator).cleanup();
        manager.registerOperator("mock", mockOperator);

        boolean removed = manager.unregisterOperator("mock");

        assertThat(removed).isTrue();
        verify(mockOperator).cleanup();
        assertThat(manager.getOperator("mock")).isNull();
    }

    @Test
    @DisplayName("合法参数通过校验")
    void validate_validParameters() {
        Map<String, Object> params = new HashMap<>();
        params.put("maxGapMinutes", 30);
        params.put("minCoverage", 0.5);
        params.put("dropOnFailure", "true");
        params.put("columns", List.of("Gasgebruik"));

        ValidationResult result = manager.validateOperator(CounterReconciler.OPERATOR_ID, params);

        assertThat(result.isValid()).isTrue();
        assertThat(result.getWarnings()).isEmpty();
    }

    @Test
    @DisplayName("越界、类型错误为错误，未定义参数为警告")
    void validate_invalidParameters() {
        Map<String, Object> params = new HashMap<>();
        params.put("minCoverage", 1.5);
        params.put("maxGapMinutes", "sixty");
        params.put("dropOnFailure", "maybe");
        params.put("columns", List.of(1, 2));
        params.put("unknown", 1);

        ValidationResult result = manager.validateOperator(CounterReconciler.OPERATOR_ID, params);

        assertThat(result.isValid()).isFalse();
        assertThat(result.getErrors()).hasSize(4);
        assertThat(result.getWarnings()).hasSize(1).anyMatch(w -> w.contains("unknown"));
    }

    @Test
    @DisplayName("未注册算子校验失败")
    void validate_unknownOperator() {
        assertThat(manager.validateOperator("nope", Map.of()).isValid()).isFalse();
    }

    @Test
    @DisplayName("枚举参数只接受定义中的值")
    void validate_enumParameter() {
        ParameterDefinition method = ParameterDefinition.oneOf("method", "nearest",
                List.of("nearest", "interpolate"), "对齐方式");
        OperatorMetadata metadata = new OperatorMetadata("mock", "mock", "1.0.0", "",
                List.of(VariableKind.CUMULATIVE), List.of(method));
        when(mockOperator.getMetadata()).thenReturn(metadata);
        manager.registerOperator("mock", mockOperator);

        assertThat(manager.validateOperator("mock", Map.of("method", "interpolate")).isValid()).isTrue();
        assertThat(manager.validateOperator("mock", Map.of("method", "linear")).isValid()).isFalse();
    }

    @Test
    @DisplayName("必填参数缺失为错误")
    void validate_requiredParameterMissing() {
        OperatorMetadata metadata = new OperatorMetadata("mock", "mock", "1.0.0", "",
                List.of(VariableKind.CUMULATIVE),
                List.of(ParameterDefinition.number("periodSeconds", 300, 1.0, null, "采样周期").required()));
        when(mockOperator.getMetadata()).thenReturn(metadata);
        manager.registerOperator("mock", mockOperator);

        ValidationResult result = manager.validateOperator("mock", Map.of());

        assertThat(result.getErrors()).hasSize(1).anyMatch(e -> e.contains("periodSeconds"));
        assertThat(result.summary()).startsWith("1 error(s)");
    }
}
