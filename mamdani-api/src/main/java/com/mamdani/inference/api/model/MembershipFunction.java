/*
 * Copyright (c) 2025 Mamdani Inference Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mamdani.inference.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * A membership function as pure data: a {@link Shape} tag plus its ordered
 * parameters.
 *
 * <p>The formulas live in the evaluator, which dispatches on the shape. The
 * parameter count is checked here; parameter ordering is not, and degenerate
 * segments are resolved when the function is evaluated.
 *
 * @param shape      the shape tag
 * @param parameters breakpoints and shape coefficients, in the shape's order
 */
public record MembershipFunction(
        @JsonProperty("shape") Shape shape,
        @JsonProperty("parameters") List<Double> parameters) {

    public MembershipFunction {
        Objects.requireNonNull(shape, "shape must not be null");
        Objects.requireNonNull(parameters, "parameters must not be null");
        parameters = List.copyOf(parameters);
        if (parameters.size() != shape.arity()) {
            throw new IllegalArgumentException(String.format(
                    "%s expects %d parameters but got %d", shape.tag(), shape.arity(), parameters.size()));
        }
        for (Double p : parameters) {
            if (!Double.isFinite(p)) {
                throw new IllegalArgumentException(shape.tag() + " parameters must be finite: " + parameters);
            }
        }
    }

    public static MembershipFunction of(Shape shape, double... parameters) {
        Double[] boxed = new Double[parameters.length];
        for (int i = 0; i < parameters.length; i++) {
            boxed[i] = parameters[i];
        }
        return new MembershipFunction(shape, List.of(boxed));
    }

    public static MembershipFunction tri(double a, double b, double c) {
        return of(Shape.TRI, a, b, c);
    }

    public static MembershipFunction trap(double a, double b, double c, double d) {
        return of(Shape.TRAP, a, b, c, d);
    }

    public static MembershipFunction linz(double a, double b) {
        return of(Shape.LINZ, a, b);
    }

    public static MembershipFunction lins(double a, double b) {
        return of(Shape.LINS, a, b);
    }

    public static MembershipFunction gauss(double s, double c) {
        return of(Shape.GAUSS, s, c);
    }

    public static MembershipFunction gauss2(double s1, double c1, double s2, double c2) {
        return of(Shape.GAUSS2, s1, c1, s2, c2);
    }

    public static MembershipFunction gbell(double a, double b, double c) {
        return of(Shape.GBELL, a, b, c);
    }

    public static MembershipFunction sig(double a, double c) {
        return of(Shape.SIG, a, c);
    }

    public static MembershipFunction dsig(double a1, double c1, double a2, double c2) {
        return of(Shape.DSIG, a1, c1, a2, c2);
    }

    public static MembershipFunction psig(double a1, double c1, double a2, double c2) {
        return of(Shape.PSIG, a1, c1, a2, c2);
    }

    public static MembershipFunction z(double a, double b) {
        return of(Shape.Z, a, b);
    }

    public static MembershipFunction s(double a, double b) {
        return of(Shape.S, a, b);
    }

    public static MembershipFunction pi(double a, double b, double c, double d) {
        return of(Shape.PI, a, b, c, d);
    }

    /**
     * Returns parameter {@code index} unboxed.
     */
    public double parameter(int index) {
        return parameters.get(index);
    }

    /**
     * Smallest parameter. Used as a structural lower bound of the support;
     * shapes with unbounded tails only contribute their explicit arguments.
     */
    public double min() {
        return parameters.stream().mapToDouble(Double::doubleValue).min().orElseThrow();
    }

    /**
     * Largest parameter, see {@link #min()}.
     */
    public double max() {
        return parameters.stream().mapToDouble(Double::doubleValue).max().orElseThrow();
    }

    @Override
    public String toString() {
        return shape.tag() + parameters;
    }
}
