/*
 * Copyright (c) 2025 Mamdani Inference Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mamdani.inference.api.exceptions;

/**
 * Base class of all inference failures.
 *
 * <p>Unchecked: definition and input errors are programming or configuration
 * mistakes the caller fixes at the source rather than recovers from inline.
 */
public class InferenceException extends RuntimeException {

    public InferenceException(String message) {
        super(message);
    }

    public InferenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
