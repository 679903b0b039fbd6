/*
 * Copyright (c) 2025 Mamdani Inference Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mamdani.inference.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Fuzzy logical operators an operator symbol can be bound to.
 *
 * <p>Bindings reference these tags instead of holding functions, so an
 * {@link InferenceSystem} stays plain data.
 */
public enum OperatorKind {
    /** Minimum t-norm, the usual AND. */
    MIN("min", false),
    /** Maximum t-conorm, the usual OR. */
    MAX("max", false),
    /** Algebraic product t-norm. */
    PRODUCT("prod", false),
    /** Probabilistic sum {@code a + b - ab}. */
    PROBOR("probor", false),
    /** Complement {@code 1 - x}. */
    NOT("not", true);

    private final String tag;
    private final boolean unary;

    OperatorKind(String tag, boolean unary) {
        this.tag = tag;
        this.unary = unary;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    /**
     * True when the operator accepts exactly one operand.
     */
    public boolean unary() {
        return unary;
    }

    @JsonCreator
    public static OperatorKind fromTag(String tag) {
        if (tag != null) {
            String normalized = tag.trim().toLowerCase(Locale.ROOT);
            for (OperatorKind kind : values()) {
                if (kind.tag.equals(normalized)) {
                    return kind;
                }
            }
        }
        throw new IllegalArgumentException("Unknown fuzzy operator: " + tag);
    }
}
