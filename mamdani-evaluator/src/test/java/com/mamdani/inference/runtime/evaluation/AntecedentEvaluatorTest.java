package com.mamdani.inference.runtime.evaluation;

import com.mamdani.inference.api.exceptions.InvalidDefinitionException;
import com.mamdani.inference.api.exceptions.MissingInputException;
import com.mamdani.inference.api.exceptions.UnknownReferenceException;
import com.mamdani.inference.api.model.Expression;
import com.mamdani.inference.api.model.InferenceSystem;
import com.mamdani.inference.api.model.InputAssignment;
import com.mamdani.inference.api.model.NaryOperation;
import com.mamdani.inference.api.model.OperatorKind;
import com.mamdani.inference.api.model.RuleActivation;
import com.mamdani.inference.runtime.TippingProblem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.mamdani.inference.api.model.Expression.and;
import static com.mamdani.inference.api.model.Expression.is;
import static com.mamdani.inference.api.model.Expression.not;
import static com.mamdani.inference.api.model.Expression.or;
import static com.mamdani.inference.api.model.MembershipFunction.lins;
import static com.mamdani.inference.api.model.MembershipFunction.tri;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AntecedentEvaluatorTest {

    private InferenceSystem system;
    private AntecedentEvaluator evaluator;

    @BeforeEach
    void setUp() {
        system = TippingProblem.system();
        evaluator = new AntecedentEvaluator(system, new Fuzzifier(system));
    }

    @Test
    @DisplayName("Should take the max of poor service and rancid food")
    void shouldEvaluateOrAntecedent() {
        double strength = evaluator.evaluate(
                or(is("service", "poor"), is("food", "rancid")), TippingProblem.sampleInputs());

        assertThat(strength).isCloseTo(0.6, within(1e-12));
    }

    @Test
    @DisplayName("Should evaluate every rule in rule-base order")
    void shouldEvaluateRulesInOrder() {
        List<RuleActivation> activations = evaluator.evaluateRules(TippingProblem.sampleInputs());

        assertThat(activations).extracting(RuleActivation::label)
                .containsExactly("cheap", "average", "generous");
        assertThat(activations).extracting(RuleActivation::ruleIndex).containsExactly(0, 1, 2);
        assertThat(activations.get(0).strength()).isCloseTo(0.6, within(1e-12));
        assertThat(activations.get(1).strength()).isCloseTo(0.4, within(1e-12));
        assertThat(activations.get(2).strength()).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Should apply and, not and nested operators")
    void shouldEvaluateNestedOperators() {
        InputAssignment inputs = TippingProblem.sampleInputs();

        assertThat(evaluator.evaluate(and(is("service", "poor"), is("service", "good")), inputs))
                .isCloseTo(0.4, within(1e-12));
        assertThat(evaluator.evaluate(not(is("service", "poor")), inputs))
                .isCloseTo(0.4, within(1e-12));
        assertThat(evaluator.evaluate(
                and(not(is("food", "rancid")), or(is("service", "good"), is("service", "excellent"))), inputs))
                .isCloseTo(0.4, within(1e-12));
    }

    @Test
    @DisplayName("Should resolve custom operator symbols through the bindings")
    void shouldUseCustomOperatorBindings() {
        InferenceSystem custom = InferenceSystem.builder()
                .variable("a", Map.of("high", lins(0, 1)))
                .variable("b", Map.of("high", lins(0, 1)))
                .variable("out", Map.of("on", tri(0, 1, 2)))
                .operator("either", OperatorKind.PROBOR)
                .operator("both", OperatorKind.PRODUCT)
                .build();
        AntecedentEvaluator customEvaluator = new AntecedentEvaluator(custom, new Fuzzifier(custom));
        InputAssignment inputs = InputAssignment.of("a", 0.5, "b", 0.4);

        assertThat(customEvaluator.evaluate(Expression.apply("either", is("a", "high"), is("b", "high")), inputs))
                .isCloseTo(0.7, within(1e-12));
        assertThat(customEvaluator.evaluate(Expression.apply("both", is("a", "high"), is("b", "high")), inputs))
                .isCloseTo(0.2, within(1e-12));
    }

    @Test
    @DisplayName("Should report a missing input variable")
    void shouldReportMissingInput() {
        assertThatThrownBy(() -> evaluator.evaluate(is("food", "rancid"), InputAssignment.of("service", 2.0)))
                .isInstanceOf(MissingInputException.class)
                .hasMessageContaining("food");
    }

    @Test
    @DisplayName("Should report an unbound operator symbol")
    void shouldReportUnknownOperator() {
        NaryOperation xor = new NaryOperation("xor", List.of(is("service", "poor"), is("food", "rancid")));

        assertThatThrownBy(() -> evaluator.evaluate(xor, TippingProblem.sampleInputs()))
                .isInstanceOf(UnknownReferenceException.class)
                .hasMessageContaining("Unknown operator: xor");
    }

    @Test
    @DisplayName("Should report a unary operator applied to several operands")
    void shouldReportArityMismatch() {
        NaryOperation badNot = new NaryOperation("not", List.of(is("service", "poor"), is("food", "rancid")));

        assertThatThrownBy(() -> evaluator.evaluate(badNot, TippingProblem.sampleInputs()))
                .isInstanceOf(InvalidDefinitionException.class)
                .hasMessageContaining("Operator 'not'");
    }
}
