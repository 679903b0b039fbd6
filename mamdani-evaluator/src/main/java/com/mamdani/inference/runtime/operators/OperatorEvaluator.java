/*
 * Copyright (c) 2025 Mamdani Inference Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mamdani.inference.runtime.operators;

import com.mamdani.inference.api.model.OperatorKind;

/**
 * Maps operator tags to their formulas.
 */
public final class OperatorEvaluator {

    private OperatorEvaluator() {
    }

    /**
     * Applies {@code kind} to the operand degrees, in their given order.
     *
     * @throws IllegalArgumentException if a unary operator receives other
     *                                  than one operand, or no operand is given
     */
    public static double apply(OperatorKind kind, double... operands) {
        switch (kind) {
            case NOT:
                if (operands.length != 1) {
                    throw new IllegalArgumentException("not expects 1 operand but got " + operands.length);
                }
                return FuzzyOperators.not(operands[0]);
            case MIN:
                return FuzzyOperators.min(operands);
            case MAX:
                return FuzzyOperators.max(operands);
            case PRODUCT:
                return FuzzyOperators.product(operands);
            case PROBOR:
                return FuzzyOperators.probor(operands);
            default:
                throw new IllegalArgumentException("Unsupported operator: " + kind);
        }
    }
}
