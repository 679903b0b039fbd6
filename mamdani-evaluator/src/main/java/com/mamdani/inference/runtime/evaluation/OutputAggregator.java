/*
 * Copyright (c) 2025 Mamdani Inference Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mamdani.inference.runtime.evaluation;

import com.mamdani.inference.api.model.LinguisticVariable;
import com.mamdani.inference.api.model.RuleActivation;
import com.mamdani.inference.runtime.config.AggregationMethod;
import com.mamdani.inference.runtime.config.ImplicationMethod;

import java.util.List;
import java.util.Objects;

/**
 * Implication and aggregation at a single probe point.
 *
 * <p>Each activation targeting the output variable shapes its consequent set
 * at {@code x} by its firing strength (implication); the shaped values are
 * folded into one degree (aggregation). The aggregated curve is never
 * materialized: each probe point is computed on its own.
 */
public final class OutputAggregator {

    private final Fuzzifier fuzzifier;
    private final ImplicationMethod implication;
    private final AggregationMethod aggregation;

    public OutputAggregator(Fuzzifier fuzzifier, ImplicationMethod implication, AggregationMethod aggregation) {
        this.fuzzifier = Objects.requireNonNull(fuzzifier, "fuzzifier must not be null");
        this.implication = Objects.requireNonNull(implication, "implication must not be null");
        this.aggregation = Objects.requireNonNull(aggregation, "aggregation must not be null");
    }

    /**
     * Aggregated membership of {@code output} at {@code x}; 0 when no
     * activation targets {@code output}.
     */
    public double degree(List<RuleActivation> activations, LinguisticVariable output, double x) {
        double acc = 0.0;
        boolean any = false;
        for (RuleActivation activation : activations) {
            if (!activation.targets(output.name())) {
                continue;
            }
            double membership = fuzzifier.fuzzify(output, activation.label(), x);
            double implied = implication.apply(activation.strength(), membership);
            acc = any ? aggregation.combine(acc, implied) : implied;
            any = true;
        }
        return acc;
    }
}
