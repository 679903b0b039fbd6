/*
 * Copyright (c) 2025 Mamdani Inference Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mamdani.inference.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Operator applied to an ordered list of operands, typically {@code and} or
 * {@code or}.
 */
public record NaryOperation(
        @JsonProperty("operator") String operator,
        @JsonProperty("operands") List<Expression> operands) implements Expression {

    public NaryOperation {
        Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(operands, "operands must not be null");
        operands = List.copyOf(operands);
        if (operands.isEmpty()) {
            throw new IllegalArgumentException("Operator '" + operator + "' needs at least one operand");
        }
    }

    @Override
    public String toString() {
        return operands.stream()
                .map(Expression::toString)
                .collect(Collectors.joining(", ", operator + "(", ")"));
    }
}
