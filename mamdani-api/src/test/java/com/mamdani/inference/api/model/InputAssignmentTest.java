package com.mamdani.inference.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InputAssignmentTest {

    @ParameterizedTest
    @ValueSource(doubles = {Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY})
    @DisplayName("Should reject non-finite input values")
    void shouldRejectNonFiniteValues(double value) {
        assertThatThrownBy(() -> InputAssignment.of("service", value, "food", 5.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("service")
                .hasMessageContaining("finite");
    }

    @Test
    @DisplayName("Should reject null input values")
    void shouldRejectNullValues() {
        Map<String, Double> values = new HashMap<>();
        values.put("food", null);

        assertThatThrownBy(() -> InputAssignment.of(values))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("food");
    }

    @Test
    @DisplayName("Should expose values by variable name")
    void shouldLookUpValues() {
        InputAssignment inputs = InputAssignment.of("service", 2.0, "food", 5.0);

        assertThat(inputs.value("service")).hasValue(2.0);
        assertThat(inputs.value("tip")).isEmpty();
        assertThat(inputs.covers("food")).isTrue();
        assertThat(inputs.covers("tip")).isFalse();
    }
}
