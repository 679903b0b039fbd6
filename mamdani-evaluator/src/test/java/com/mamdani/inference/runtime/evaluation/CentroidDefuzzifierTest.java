package com.mamdani.inference.runtime.evaluation;

import com.mamdani.inference.api.model.CentroidResult;
import com.mamdani.inference.api.model.InferenceSystem;
import com.mamdani.inference.api.model.LinguisticVariable;
import com.mamdani.inference.api.model.Predicate;
import com.mamdani.inference.api.model.RuleActivation;
import com.mamdani.inference.runtime.TippingProblem;
import com.mamdani.inference.runtime.config.AggregationMethod;
import com.mamdani.inference.runtime.config.ImplicationMethod;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.mamdani.inference.api.model.MembershipFunction.lins;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CentroidDefuzzifierTest {

    private Fuzzifier fuzzifier;
    private OutputAggregator aggregator;

    @BeforeEach
    void setUp() {
        fuzzifier = new Fuzzifier(TippingProblem.system());
        aggregator = new OutputAggregator(fuzzifier, ImplicationMethod.MIN, AggregationMethod.MAX);
    }

    @Test
    @DisplayName("Should exclude the upper domain bound from the sum")
    void shouldExcludeUpperBound() {
        InferenceSystem ramp = InferenceSystem.builder()
                .variable("out", Map.of("rising", lins(0.0, 1.0)))
                .build();
        OutputAggregator rampAggregator =
                new OutputAggregator(new Fuzzifier(ramp), ImplicationMethod.MIN, AggregationMethod.MAX);
        CentroidDefuzzifier defuzzifier = new CentroidDefuzzifier(rampAggregator, 0.25);

        CentroidResult result = defuzzifier.centroid(
                List.of(new RuleActivation(0, new Predicate("out", "rising"), 1.0)),
                ramp.variable("out").orElseThrow());

        // samples at 0, 0.25, 0.5, 0.75; x = 1.0 is not sampled
        assertThat(result.samples()).isEqualTo(4);
        assertThat(result.numerator()).isEqualTo(0.875);
        assertThat(result.denominator()).isEqualTo(1.5);
        assertThat(result.crisp()).hasValueCloseTo(0.875 / 1.5, within(1e-15));
    }

    @Test
    @DisplayName("Should accumulate in ascending order with repeated step addition")
    void shouldAccumulateAscending() {
        LinguisticVariable tip = TippingProblem.system().variable("tip").orElseThrow();
        List<RuleActivation> activations = List.of(
                new RuleActivation(0, new Predicate("tip", "cheap"), 0.6),
                new RuleActivation(1, new Predicate("tip", "average"), 0.4));

        double num = 0.0;
        double den = 0.0;
        int samples = 0;
        for (double x = 0.0; x < 30.0; x += 0.1) {
            double mu = aggregator.degree(activations, tip, x);
            num += mu * x;
            den += mu;
            samples++;
        }

        CentroidResult result = new CentroidDefuzzifier(aggregator, 0.1).centroid(activations, tip);

        assertThat(result.samples()).isEqualTo(samples);
        assertThat(result.numerator()).isEqualTo(num);
        assertThat(result.denominator()).isEqualTo(den);
        assertThat(result.crisp().getAsDouble()).isCloseTo(9.3243, within(1e-4));
    }

    @Test
    @DisplayName("Should report an empty result when nothing fires")
    void shouldReportEmptyFiring() {
        LinguisticVariable tip = TippingProblem.system().variable("tip").orElseThrow();
        List<RuleActivation> silent = List.of(new RuleActivation(0, new Predicate("tip", "cheap"), 0.0));

        CentroidResult result = new CentroidDefuzzifier(aggregator, 0.1).centroid(silent, tip);

        assertThat(result.fired()).isFalse();
        assertThat(result.denominator()).isEqualTo(0.0);
        assertThat(result.crisp()).isEmpty();
    }

    @Test
    @DisplayName("Should reject non-positive steps")
    void shouldRejectInvalidStep() {
        assertThatThrownBy(() -> new CentroidDefuzzifier(aggregator, 0.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CentroidDefuzzifier(aggregator, Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
