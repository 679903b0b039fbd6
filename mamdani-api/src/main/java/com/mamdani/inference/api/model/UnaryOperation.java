/*
 * Copyright (c) 2025 Mamdani Inference Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mamdani.inference.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Operator applied to a single operand, typically {@code not}.
 */
public record UnaryOperation(
        @JsonProperty("operator") String operator,
        @JsonProperty("operand") Expression operand) implements Expression {

    public UnaryOperation {
        Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(operand, "operand must not be null");
    }

    @Override
    public String toString() {
        return operator + "(" + operand + ")";
    }
}
