/*
 * Copyright (c) 2025 Mamdani Inference Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mamdani.inference.api.exceptions;

/**
 * The inference definition is structurally unusable for a reason other than
 * a dangling reference, e.g. a unary operator applied to several operands.
 */
public class InvalidDefinitionException extends InferenceException {

    public InvalidDefinitionException(String message) {
        super(message);
    }

    public InvalidDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
