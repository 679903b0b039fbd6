package com.mamdani.inference.runtime.operators;

import com.mamdani.inference.api.model.OperatorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FuzzyOperatorsTest {

    private static final double[] DEGREES = {0.0, 0.1, 0.25, 0.5, 0.6, 0.75, 0.9, 1.0};

    @Test
    @DisplayName("Complement should be an involution")
    void complementIsInvolution() {
        for (double x : DEGREES) {
            assertThat(FuzzyOperators.not(FuzzyOperators.not(x))).isCloseTo(x, within(1e-15));
        }
        assertThat(FuzzyOperators.not(0.25)).isEqualTo(0.75);
    }

    @Test
    @DisplayName("Probabilistic sum should be commutative and associative")
    void proborCommutativeAssociative() {
        for (double x : DEGREES) {
            for (double y : DEGREES) {
                assertThat(FuzzyOperators.probor(x, y)).isCloseTo(FuzzyOperators.probor(y, x), within(1e-15));
                for (double z : DEGREES) {
                    assertThat(FuzzyOperators.probor(FuzzyOperators.probor(x, y), z))
                            .isCloseTo(FuzzyOperators.probor(x, FuzzyOperators.probor(y, z)), within(1e-12));
                }
            }
        }
    }

    @Test
    @DisplayName("Probabilistic sum should have identity 0 and absorbing element 1")
    void proborIdentityAndAbsorbing() {
        for (double y : DEGREES) {
            assertThat(FuzzyOperators.probor(0.0, y)).isEqualTo(y);
            assertThat(FuzzyOperators.probor(1.0, y)).isCloseTo(1.0, within(1e-15));
        }
    }

    @Test
    @DisplayName("Probabilistic sum should fold left over many operands")
    void proborFoldsLeft() {
        double expected = FuzzyOperators.probor(FuzzyOperators.probor(0.2, 0.5), 0.4);

        assertThat(FuzzyOperators.probor(new double[]{0.2, 0.5, 0.4})).isEqualTo(expected);
        assertThat(expected).isCloseTo(0.76, within(1e-12));
        assertThat(FuzzyOperators.probor(new double[]{0.3})).isEqualTo(0.3);
    }

    @Test
    @DisplayName("N-ary min, max and product should cover all operands")
    void naryOperators() {
        assertThat(FuzzyOperators.min(0.6, 0.2, 0.9)).isEqualTo(0.2);
        assertThat(FuzzyOperators.max(0.6, 0.2, 0.9)).isEqualTo(0.9);
        assertThat(FuzzyOperators.product(0.5, 0.5, 0.8)).isCloseTo(0.2, within(1e-15));
    }

    @Test
    @DisplayName("Should reject an empty operand list")
    void shouldRejectNoOperands() {
        assertThatThrownBy(() -> FuzzyOperators.max())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("At least one operand");
    }

    @Test
    @DisplayName("Should dispatch operator tags to their formulas")
    void shouldDispatchOperatorKinds() {
        assertThat(OperatorEvaluator.apply(OperatorKind.MIN, 0.6, 0.0)).isEqualTo(0.0);
        assertThat(OperatorEvaluator.apply(OperatorKind.MAX, 0.6, 0.0)).isEqualTo(0.6);
        assertThat(OperatorEvaluator.apply(OperatorKind.PROBOR, 0.5, 0.5)).isEqualTo(0.75);
        assertThat(OperatorEvaluator.apply(OperatorKind.PRODUCT, 0.5, 0.4)).isCloseTo(0.2, within(1e-15));
        assertThat(OperatorEvaluator.apply(OperatorKind.NOT, 0.6)).isCloseTo(0.4, within(1e-15));
    }

    @Test
    @DisplayName("Complement should reject more than one operand")
    void notRequiresOneOperand() {
        assertThatThrownBy(() -> OperatorEvaluator.apply(OperatorKind.NOT, 0.2, 0.3))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not expects 1 operand but got 2");
    }
}
