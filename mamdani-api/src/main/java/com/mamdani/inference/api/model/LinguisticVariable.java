/*
 * Copyright (c) 2025 Mamdani Inference Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mamdani.inference.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A named linguistic variable and its labeled fuzzy sets.
 *
 * <p>The {@code sets} map binds each label (unique within the variable) to a
 * {@link MembershipFunction}. Label order is preserved as given. The numeric
 * domain of the variable is implicitly the span of all parameters of its
 * sets, see {@link #domainMin()} and {@link #domainMax()}.
 *
 * @param name variable name
 * @param sets label to membership function, at least one entry
 */
public record LinguisticVariable(
        @JsonProperty("name") String name,
        @JsonProperty("sets") Map<String, MembershipFunction> sets) {

    public LinguisticVariable {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(sets, "sets must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Variable name must not be blank");
        }
        if (sets.isEmpty()) {
            throw new IllegalArgumentException("Variable '" + name + "' must define at least one set");
        }
        sets.forEach((label, fn) -> {
            Objects.requireNonNull(label, "label must not be null in variable " + name);
            Objects.requireNonNull(fn, "membership function for '" + label + "' must not be null");
        });
        sets = Collections.unmodifiableMap(new LinkedHashMap<>(sets));
    }

    public Optional<MembershipFunction> set(String label) {
        return Optional.ofNullable(sets.get(label));
    }

    public boolean hasLabel(String label) {
        return sets.containsKey(label);
    }

    /**
     * Minimum over every parameter of every set of this variable.
     */
    public double domainMin() {
        return sets.values().stream().mapToDouble(MembershipFunction::min).min().orElseThrow();
    }

    /**
     * Maximum over every parameter of every set of this variable.
     */
    public double domainMax() {
        return sets.values().stream().mapToDouble(MembershipFunction::max).max().orElseThrow();
    }
}
