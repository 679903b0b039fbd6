/*
 * Copyright (c) 2025 Mamdani Inference Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mamdani.inference.api.model;

import java.util.OptionalDouble;

/**
 * Outcome of centroid defuzzification for one output variable.
 *
 * <p>When no rule fires anywhere in the sampled domain the denominator is
 * zero and {@link #crisp()} is empty; callers choose their own fallback.
 *
 * @param outputVariable the defuzzified variable
 * @param numerator      sum of {@code mu(x) * x} over the samples
 * @param denominator    sum of {@code mu(x)} over the samples
 * @param samples        number of probe points taken
 */
public record CentroidResult(
        String outputVariable,
        double numerator,
        double denominator,
        int samples) {

    public boolean fired() {
        return denominator > 0.0;
    }

    public OptionalDouble crisp() {
        return fired() ? OptionalDouble.of(numerator / denominator) : OptionalDouble.empty();
    }
}
