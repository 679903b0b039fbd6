/*
 * Copyright (c) 2025 Mamdani Inference Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mamdani.inference.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A complete fuzzy inference definition: linguistic variables, the ordered
 * rule base and the operator-symbol bindings.
 *
 * <p>Instances are immutable and can be shared by any number of concurrent
 * evaluations. Reference integrity (every variable, label and operator symbol
 * used by a rule exists) is checked by the evaluator before use, not here,
 * so that an incomplete definition can still be built and inspected.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * InferenceSystem tipping = InferenceSystem.builder()
 *     .variable("service", Map.of("poor", MembershipFunction.tri(0, 0, 5)))
 *     .variable("tip", Map.of("cheap", MembershipFunction.tri(0, 5, 10)))
 *     .rule(Expression.is("service", "poor"), Expression.is("tip", "cheap"))
 *     .defaultOperators()
 *     .build();
 * }</pre>
 *
 * @param variables variable name to variable, keys equal the variable names
 * @param rules     rule base, in evaluation order
 * @param operators operator symbol to operator
 */
public record InferenceSystem(
        @JsonProperty("variables") Map<String, LinguisticVariable> variables,
        @JsonProperty("rules") List<Rule> rules,
        @JsonProperty("operators") Map<String, OperatorKind> operators) {

    public InferenceSystem {
        Objects.requireNonNull(variables, "variables must not be null");
        Objects.requireNonNull(rules, "rules must not be null");
        Objects.requireNonNull(operators, "operators must not be null");
        variables.forEach((key, variable) -> {
            if (!key.equals(variable.name())) {
                throw new IllegalArgumentException(
                        "Variable registered as '" + key + "' is named '" + variable.name() + "'");
            }
        });
        variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        rules = List.copyOf(rules);
        operators = Collections.unmodifiableMap(new LinkedHashMap<>(operators));
    }

    public Optional<LinguisticVariable> variable(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    public Optional<OperatorKind> operator(String symbol) {
        return Optional.ofNullable(operators.get(symbol));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder. Rejects duplicate variable names and duplicate labels.
     */
    public static final class Builder {
        private final Map<String, LinguisticVariable> variables = new LinkedHashMap<>();
        private final List<Rule> rules = new ArrayList<>();
        private final Map<String, OperatorKind> operators = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder variable(LinguisticVariable variable) {
            if (variables.putIfAbsent(variable.name(), variable) != null) {
                throw new IllegalArgumentException("Duplicate variable: " + variable.name());
            }
            return this;
        }

        public Builder variable(String name, Map<String, MembershipFunction> sets) {
            return variable(new LinguisticVariable(name, sets));
        }

        /**
         * Starts a variable whose sets are added one label at a time, keeping
         * declaration order.
         */
        public VariableBuilder variable(String name) {
            return new VariableBuilder(this, name);
        }

        public Builder rule(Rule rule) {
            rules.add(Objects.requireNonNull(rule, "rule must not be null"));
            return this;
        }

        public Builder rule(Expression antecedent, Predicate consequent) {
            return rule(new Rule(antecedent, consequent));
        }

        public Builder operator(String symbol, OperatorKind kind) {
            operators.put(Objects.requireNonNull(symbol, "symbol must not be null"),
                    Objects.requireNonNull(kind, "kind must not be null"));
            return this;
        }

        /**
         * Binds {@code and} to MIN, {@code or} to MAX and {@code not} to NOT.
         */
        public Builder defaultOperators() {
            operator(Expression.AND, OperatorKind.MIN);
            operator(Expression.OR, OperatorKind.MAX);
            operator(Expression.NOT, OperatorKind.NOT);
            return this;
        }

        public InferenceSystem build() {
            return new InferenceSystem(variables, rules, operators);
        }
    }

    /**
     * Collects the labeled sets of one variable.
     */
    public static final class VariableBuilder {
        private final Builder parent;
        private final String name;
        private final Map<String, MembershipFunction> sets = new LinkedHashMap<>();

        private VariableBuilder(Builder parent, String name) {
            this.parent = parent;
            this.name = name;
        }

        public VariableBuilder set(String label, MembershipFunction function) {
            if (sets.putIfAbsent(label, function) != null) {
                throw new IllegalArgumentException("Duplicate label '" + label + "' in variable " + name);
            }
            return this;
        }

        public Builder end() {
            return parent.variable(new LinguisticVariable(name, sets));
        }
    }
}
