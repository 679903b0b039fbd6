/*
 * Copyright (c) 2025 Mamdani Inference Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mamdani.inference.runtime.evaluation;

import com.mamdani.inference.api.model.CentroidResult;
import com.mamdani.inference.api.model.LinguisticVariable;
import com.mamdani.inference.api.model.RuleActivation;

import java.util.List;
import java.util.Objects;

/**
 * Centre-of-gravity defuzzification by Riemann sum.
 *
 * <p>The domain runs from the smallest to the largest parameter of the output
 * variable's sets. Sampling starts at the lower bound, advances by repeated
 * addition of the step and stops before reaching the upper bound, so the
 * upper bound itself is never sampled. Summation is strictly ascending in
 * {@code x}; the accumulated floating-point value depends on that order.
 */
public final class CentroidDefuzzifier {

    private final OutputAggregator aggregator;
    private final double step;

    public CentroidDefuzzifier(OutputAggregator aggregator, double step) {
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator must not be null");
        if (!(step > 0.0) || Double.isInfinite(step)) {
            throw new IllegalArgumentException("step must be a positive finite number: " + step);
        }
        this.step = step;
    }

    public CentroidResult centroid(List<RuleActivation> activations, LinguisticVariable output) {
        double min = output.domainMin();
        double max = output.domainMax();
        if (min < max && (min + step <= min || max - step >= max)) {
            throw new IllegalArgumentException(
                    "step " + step + " is below the floating-point resolution of domain [" + min + ", " + max + "]");
        }

        double numerator = 0.0;
        double denominator = 0.0;
        int samples = 0;
        for (double x = min; x < max; x += step) {
            double mu = aggregator.degree(activations, output, x);
            numerator += mu * x;
            denominator += mu;
            samples++;
        }
        return new CentroidResult(output.name(), numerator, denominator, samples);
    }
}
