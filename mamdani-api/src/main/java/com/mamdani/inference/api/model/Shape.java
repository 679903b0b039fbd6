/*
 * Copyright (c) 2025 Mamdani Inference Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mamdani.inference.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Catalog of membership-function shapes.
 *
 * <p>Each shape has a short tag, used in serialized definitions, and a fixed
 * number of parameters. Parameter order follows the usual fuzzy-toolbox
 * conventions (feet before shoulders, spread before centre).
 */
public enum Shape {
    /** Triangle {@code (a, b, c)}: feet a and c, peak b. */
    TRI("tri", 3),
    /** Trapezoid {@code (a, b, c, d)}: feet a and d, shoulders b and c. */
    TRAP("trap", 4),
    /** Linear z-shaped saturation {@code (a, b)}. */
    LINZ("linz", 2),
    /** Linear s-shaped saturation {@code (a, b)}. */
    LINS("lins", 2),
    /** Gaussian {@code (s, c)}. */
    GAUSS("gauss", 2),
    /** Two-sided Gaussian {@code (s1, c1, s2, c2)}. */
    GAUSS2("gauss2", 4),
    /** Generalized bell {@code (a, b, c)}. */
    GBELL("gbell", 3),
    /** Sigmoid {@code (a, c)}. */
    SIG("sig", 2),
    /** Difference of two sigmoids {@code (a1, c1, a2, c2)}. */
    DSIG("dsig", 4),
    /** Product of two sigmoids {@code (a1, c1, a2, c2)}. */
    PSIG("psig", 4),
    /** Quadratic z-curve {@code (a, b)}. */
    Z("z", 2),
    /** Quadratic s-curve {@code (a, b)}. */
    S("s", 2),
    /** Pi curve {@code (a, b, c, d)}. */
    PI("pi", 4);

    private final String tag;
    private final int arity;

    Shape(String tag, int arity) {
        this.tag = tag;
        this.arity = arity;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    public int arity() {
        return arity;
    }

    /**
     * Resolves a shape from its tag, ignoring case.
     *
     * @throws IllegalArgumentException if no shape has the given tag
     */
    @JsonCreator
    public static Shape fromTag(String tag) {
        if (tag != null) {
            String normalized = tag.trim().toLowerCase(Locale.ROOT);
            for (Shape shape : values()) {
                if (shape.tag.equals(normalized)) {
                    return shape;
                }
            }
        }
        throw new IllegalArgumentException("Unknown membership function shape: " + tag);
    }
}
