/*
 * Copyright (c) 2025 Mamdani Inference Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mamdani.inference.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * IF {@code antecedent} THEN {@code consequent}.
 */
public record Rule(
        @JsonProperty("antecedent") Expression antecedent,
        @JsonProperty("consequent") Predicate consequent) {

    public Rule {
        Objects.requireNonNull(antecedent, "antecedent must not be null");
        Objects.requireNonNull(consequent, "consequent must not be null");
    }

    @Override
    public String toString() {
        return "IF " + antecedent + " THEN " + consequent;
    }
}
