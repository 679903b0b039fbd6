/*
 * Copyright (c) 2025 Mamdani Inference Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mamdani.inference.api.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * A rule antecedent: a tree of {@link Predicate} leaves joined by operator
 * nodes.
 *
 * <p>Operator nodes carry an operator <em>symbol</em> (e.g. {@code "and"}),
 * resolved against {@link InferenceSystem#operators()} at evaluation time.
 * Operands are evaluated in their listed order before the operator is
 * applied.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * Expression poorOrRancid = Expression.or(
 *     Expression.is("service", "poor"),
 *     Expression.is("food", "rancid"));
 * }</pre>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Predicate.class, name = "is"),
        @JsonSubTypes.Type(value = UnaryOperation.class, name = "unary"),
        @JsonSubTypes.Type(value = NaryOperation.class, name = "nary")
})
public sealed interface Expression permits Predicate, UnaryOperation, NaryOperation {

    String AND = "and";
    String OR = "or";
    String NOT = "not";

    static Predicate is(String variable, String label) {
        return new Predicate(variable, label);
    }

    static UnaryOperation not(Expression operand) {
        return new UnaryOperation(NOT, operand);
    }

    static NaryOperation and(Expression... operands) {
        return new NaryOperation(AND, List.of(operands));
    }

    static NaryOperation or(Expression... operands) {
        return new NaryOperation(OR, List.of(operands));
    }

    /**
     * Builds an operator node for a custom symbol. One operand yields a
     * {@link UnaryOperation}, anything else a {@link NaryOperation}.
     */
    static Expression apply(String operator, Expression... operands) {
        if (operands.length == 1) {
            return new UnaryOperation(operator, operands[0]);
        }
        return new NaryOperation(operator, List.of(operands));
    }
}
