/*
 * Copyright (c) 2025 Mamdani Inference Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mamdani.inference.runtime.validation;

import com.mamdani.inference.api.exceptions.InvalidDefinitionException;
import com.mamdani.inference.api.exceptions.MissingInputException;
import com.mamdani.inference.api.exceptions.UnknownReferenceException;
import com.mamdani.inference.api.model.Expression;
import com.mamdani.inference.api.model.InferenceSystem;
import com.mamdani.inference.api.model.InputAssignment;
import com.mamdani.inference.api.model.LinguisticVariable;
import com.mamdani.inference.api.model.NaryOperation;
import com.mamdani.inference.api.model.OperatorKind;
import com.mamdani.inference.api.model.Predicate;
import com.mamdani.inference.api.model.Rule;
import com.mamdani.inference.api.model.UnaryOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Cross-checks an {@link InferenceSystem} and its inputs before evaluation,
 * so that dangling references fail up front instead of deep inside the
 * recursive antecedent walk.
 *
 * <p>Checks performed on the definition:
 * <ul>
 *   <li>every predicate in an antecedent or consequent names a defined
 *       variable and one of its labels</li>
 *   <li>every operator symbol is bound in {@link InferenceSystem#operators()}</li>
 *   <li>unary operators ({@code not}) are applied to exactly one operand</li>
 * </ul>
 */
public final class InferenceSystemValidator {

    private static final Logger logger = LoggerFactory.getLogger(InferenceSystemValidator.class);

    private final InferenceSystem system;
    private final Set<String> antecedentVariables;

    private InferenceSystemValidator(InferenceSystem system) {
        this.system = system;
        this.antecedentVariables = collectAntecedentVariables(system);
    }

    /**
     * Validates {@code system} and returns a validator for input assignments
     * against it.
     *
     * @throws UnknownReferenceException  for an undefined variable, label or
     *                                    operator symbol
     * @throws InvalidDefinitionException for an operator arity mismatch
     */
    public static InferenceSystemValidator validate(InferenceSystem system) {
        List<Rule> rules = system.rules();
        for (int i = 0; i < rules.size(); i++) {
            Rule rule = rules.get(i);
            try {
                checkExpression(system, rule.antecedent());
                checkPredicate(system, rule.consequent());
            } catch (UnknownReferenceException e) {
                throw new UnknownReferenceException(e.kind(), e.name(), "Rule " + i + " (" + rule + "): " + e.getMessage());
            } catch (InvalidDefinitionException e) {
                throw new InvalidDefinitionException("Rule " + i + " (" + rule + "): " + e.getMessage(), e);
            }
        }
        InferenceSystemValidator validator = new InferenceSystemValidator(system);
        logger.debug("Validated inference system: {} variables, {} rules, antecedent inputs {}",
                system.variables().size(), rules.size(), validator.antecedentVariables);
        return validator;
    }

    /**
     * Variables read by at least one rule antecedent, in first-use order.
     */
    public Set<String> antecedentVariables() {
        return antecedentVariables;
    }

    /**
     * Checks that {@code inputs} covers every antecedent variable.
     *
     * @throws MissingInputException listing every uncovered variable
     */
    public void validateInputs(InputAssignment inputs) {
        Set<String> missing = new TreeSet<>();
        for (String variable : antecedentVariables) {
            if (!inputs.covers(variable)) {
                missing.add(variable);
            }
        }
        if (!missing.isEmpty()) {
            throw new MissingInputException(missing);
        }
    }

    /**
     * Checks that {@code outputVariable} is defined in the system.
     *
     * @throws UnknownReferenceException if it is not
     */
    public LinguisticVariable requireVariable(String outputVariable) {
        return system.variable(outputVariable)
                .orElseThrow(() -> UnknownReferenceException.variable(outputVariable));
    }

    private static void checkExpression(InferenceSystem system, Expression expression) {
        if (expression instanceof Predicate predicate) {
            checkPredicate(system, predicate);
        } else if (expression instanceof UnaryOperation unary) {
            checkOperator(system, unary.operator(), 1);
            checkExpression(system, unary.operand());
        } else if (expression instanceof NaryOperation nary) {
            checkOperator(system, nary.operator(), nary.operands().size());
            for (Expression operand : nary.operands()) {
                checkExpression(system, operand);
            }
        } else {
            throw new InvalidDefinitionException("Unsupported expression: " + expression);
        }
    }

    private static void checkPredicate(InferenceSystem system, Predicate predicate) {
        LinguisticVariable variable = system.variable(predicate.variable())
                .orElseThrow(() -> UnknownReferenceException.variable(predicate.variable()));
        if (!variable.hasLabel(predicate.label())) {
            throw UnknownReferenceException.label(predicate.variable(), predicate.label());
        }
    }

    private static void checkOperator(InferenceSystem system, String symbol, int operandCount) {
        OperatorKind kind = system.operator(symbol)
                .orElseThrow(() -> UnknownReferenceException.operator(symbol));
        if (kind.unary() && operandCount != 1) {
            throw new InvalidDefinitionException(
                    "Operator '" + symbol + "' (" + kind.tag() + ") takes 1 operand but is applied to " + operandCount);
        }
    }

    private static Set<String> collectAntecedentVariables(InferenceSystem system) {
        Set<String> variables = new LinkedHashSet<>();
        for (Rule rule : system.rules()) {
            collect(rule.antecedent(), variables);
        }
        return Collections.unmodifiableSet(variables);
    }

    private static void collect(Expression expression, Set<String> into) {
        if (expression instanceof Predicate predicate) {
            into.add(predicate.variable());
        } else if (expression instanceof UnaryOperation unary) {
            collect(unary.operand(), into);
        } else if (expression instanceof NaryOperation nary) {
            for (Expression operand : nary.operands()) {
                collect(operand, into);
            }
        }
    }
}
