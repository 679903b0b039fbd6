/*
 * Copyright (c) 2025 Mamdani Inference Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mamdani.inference.api.exceptions;

/**
 * A variable, label or operator symbol is referenced but not defined.
 */
public class UnknownReferenceException extends InferenceException {

    public enum Kind {
        VARIABLE,
        LABEL,
        OPERATOR
    }

    private final Kind kind;
    private final String name;

    public UnknownReferenceException(Kind kind, String name, String message) {
        super(message);
        this.kind = kind;
        this.name = name;
    }

    public static UnknownReferenceException variable(String variable) {
        return new UnknownReferenceException(Kind.VARIABLE, variable, "Unknown variable: " + variable);
    }

    public static UnknownReferenceException label(String variable, String label) {
        return new UnknownReferenceException(Kind.LABEL, label,
                "Unknown label '" + label + "' in variable " + variable);
    }

    public static UnknownReferenceException operator(String symbol) {
        return new UnknownReferenceException(Kind.OPERATOR, symbol, "Unknown operator: " + symbol);
    }

    public Kind kind() {
        return kind;
    }

    public String name() {
        return name;
    }
}
