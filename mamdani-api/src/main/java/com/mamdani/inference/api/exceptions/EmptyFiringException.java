/*
 * Copyright (c) 2025 Mamdani Inference Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mamdani.inference.api.exceptions;

/**
 * No rule contributes any membership to the output variable over its sampled
 * domain, so the centroid is undefined.
 */
public class EmptyFiringException extends InferenceException {

    private final String outputVariable;

    public EmptyFiringException(String outputVariable) {
        super("No rule fires for output variable " + outputVariable + "; centroid is undefined");
        this.outputVariable = outputVariable;
    }

    public String outputVariable() {
        return outputVariable;
    }
}
