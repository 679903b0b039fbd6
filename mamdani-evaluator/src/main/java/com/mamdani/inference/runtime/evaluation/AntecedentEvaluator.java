/*
 * Copyright (c) 2025 Mamdani Inference Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mamdani.inference.runtime.evaluation;

import com.mamdani.inference.api.exceptions.InvalidDefinitionException;
import com.mamdani.inference.api.exceptions.MissingInputException;
import com.mamdani.inference.api.exceptions.UnknownReferenceException;
import com.mamdani.inference.api.model.Expression;
import com.mamdani.inference.api.model.InferenceSystem;
import com.mamdani.inference.api.model.InputAssignment;
import com.mamdani.inference.api.model.NaryOperation;
import com.mamdani.inference.api.model.OperatorKind;
import com.mamdani.inference.api.model.Predicate;
import com.mamdani.inference.api.model.Rule;
import com.mamdani.inference.api.model.RuleActivation;
import com.mamdani.inference.api.model.UnaryOperation;
import com.mamdani.inference.runtime.operators.OperatorEvaluator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Computes rule firing strengths by walking antecedent expressions.
 *
 * <p>A predicate leaf fuzzifies its variable's input value; an operator node
 * evaluates all of its operands first, left to right, then applies the
 * operator bound to its symbol.
 */
public final class AntecedentEvaluator {

    private final InferenceSystem system;
    private final Fuzzifier fuzzifier;

    public AntecedentEvaluator(InferenceSystem system, Fuzzifier fuzzifier) {
        this.system = Objects.requireNonNull(system, "system must not be null");
        this.fuzzifier = Objects.requireNonNull(fuzzifier, "fuzzifier must not be null");
    }

    /**
     * Firing strength of every rule, in rule-base order.
     */
    public List<RuleActivation> evaluateRules(InputAssignment inputs) {
        List<Rule> rules = system.rules();
        List<RuleActivation> activations = new ArrayList<>(rules.size());
        for (int i = 0; i < rules.size(); i++) {
            Rule rule = rules.get(i);
            activations.add(new RuleActivation(i, rule.consequent(), evaluate(rule.antecedent(), inputs)));
        }
        return activations;
    }

    /**
     * Degree to which {@code expression} holds for {@code inputs}.
     *
     * @throws MissingInputException      if a predicate's variable has no input
     * @throws UnknownReferenceException  for an undefined variable, label or operator
     * @throws InvalidDefinitionException if an operator gets the wrong operand count
     */
    public double evaluate(Expression expression, InputAssignment inputs) {
        if (expression instanceof Predicate predicate) {
            OptionalDouble value = inputs.value(predicate.variable());
            if (value.isEmpty()) {
                throw MissingInputException.of(predicate.variable());
            }
            return fuzzifier.fuzzify(predicate.variable(), predicate.label(), value.getAsDouble());
        }
        if (expression instanceof UnaryOperation unary) {
            double operand = evaluate(unary.operand(), inputs);
            return applyOperator(unary.operator(), operand);
        }
        if (expression instanceof NaryOperation nary) {
            List<Expression> operands = nary.operands();
            double[] values = new double[operands.size()];
            for (int i = 0; i < values.length; i++) {
                values[i] = evaluate(operands.get(i), inputs);
            }
            return applyOperator(nary.operator(), values);
        }
        throw new InvalidDefinitionException("Unsupported expression: " + expression);
    }

    private double applyOperator(String symbol, double... operands) {
        OperatorKind kind = system.operator(symbol)
                .orElseThrow(() -> UnknownReferenceException.operator(symbol));
        try {
            return OperatorEvaluator.apply(kind, operands);
        } catch (IllegalArgumentException e) {
            throw new InvalidDefinitionException("Operator '" + symbol + "': " + e.getMessage(), e);
        }
    }
}
