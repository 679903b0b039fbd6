/*
 * Copyright (c) 2025 Mamdani Inference Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mamdani.inference.runtime.operators;

/**
 * Fuzzy logical combinators over membership degrees.
 *
 * <p>N-ary operators fold their arguments left to right. Every method expects
 * at least one argument.
 */
public final class FuzzyOperators {

    private FuzzyOperators() {
    }

    /**
     * Complement {@code 1 - x}.
     */
    public static double not(double x) {
        return 1.0 - x;
    }

    /**
     * Probabilistic sum of two degrees, {@code a + b - ab}.
     */
    public static double probor(double a, double b) {
        return a + b - a * b;
    }

    /**
     * Probabilistic OR: {@code probor(probor(x0, x1), x2)...}. Identity 0,
     * absorbing element 1.
     */
    public static double probor(double... values) {
        requireOperands(values);
        double acc = values[0];
        for (int i = 1; i < values.length; i++) {
            acc = probor(acc, values[i]);
        }
        return acc;
    }

    public static double min(double... values) {
        requireOperands(values);
        double acc = values[0];
        for (int i = 1; i < values.length; i++) {
            acc = Math.min(acc, values[i]);
        }
        return acc;
    }

    public static double max(double... values) {
        requireOperands(values);
        double acc = values[0];
        for (int i = 1; i < values.length; i++) {
            acc = Math.max(acc, values[i]);
        }
        return acc;
    }

    /**
     * Algebraic product t-norm.
     */
    public static double product(double... values) {
        requireOperands(values);
        double acc = values[0];
        for (int i = 1; i < values.length; i++) {
            acc *= values[i];
        }
        return acc;
    }

    private static void requireOperands(double[] values) {
        if (values.length == 0) {
            throw new IllegalArgumentException("At least one operand is required");
        }
    }
}
