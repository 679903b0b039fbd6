/*
 * Copyright (c) 2025 Mamdani Inference Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mamdani.inference.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * "variable IS label". Leaf of an antecedent and the consequent of every rule.
 *
 * @param variable linguistic variable name
 * @param label    set label within that variable
 */
public record Predicate(
        @JsonProperty("variable") String variable,
        @JsonProperty("label") String label) implements Expression {

    public Predicate {
        Objects.requireNonNull(variable, "variable must not be null");
        Objects.requireNonNull(label, "label must not be null");
    }

    @Override
    public String toString() {
        return variable + " IS " + label;
    }
}
