package com.mamdani.inference.runtime.evaluation;

import com.mamdani.inference.api.exceptions.UnknownReferenceException;
import com.mamdani.inference.runtime.TippingProblem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FuzzifierTest {

    private Fuzzifier fuzzifier;

    @BeforeEach
    void setUp() {
        fuzzifier = new Fuzzifier(TippingProblem.system());
    }

    @Test
    @DisplayName("Should fuzzify poor service at 2.0 to 0.6")
    void shouldFuzzifyPoorService() {
        assertThat(fuzzifier.fuzzify("service", "poor", 2.0)).isCloseTo(0.6, within(1e-12));
    }

    @Test
    @DisplayName("Should fuzzify food outside the rancid support to 0")
    void shouldFuzzifyOutsideSupport() {
        assertThat(fuzzifier.fuzzify("food", "rancid", 5.0)).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Should fail for an unknown variable")
    void shouldFailForUnknownVariable() {
        assertThatThrownBy(() -> fuzzifier.fuzzify("ambience", "cosy", 1.0))
                .isInstanceOf(UnknownReferenceException.class)
                .hasMessageContaining("Unknown variable: ambience")
                .extracting("kind").isEqualTo(UnknownReferenceException.Kind.VARIABLE);
    }

    @Test
    @DisplayName("Should fail for an unknown label")
    void shouldFailForUnknownLabel() {
        assertThatThrownBy(() -> fuzzifier.fuzzify("food", "bland", 1.0))
                .isInstanceOf(UnknownReferenceException.class)
                .hasMessageContaining("Unknown label 'bland' in variable food")
                .extracting("kind").isEqualTo(UnknownReferenceException.Kind.LABEL);
    }
}
