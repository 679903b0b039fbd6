/*
 * Copyright (c) 2025 Mamdani Inference Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mamdani.inference.api.exceptions;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Variables referenced by rule antecedents have no crisp input value.
 */
public class MissingInputException extends InferenceException {

    private final Set<String> missing;

    public MissingInputException(Set<String> missing) {
        super("Missing input values for: " + new TreeSet<>(missing));
        this.missing = Collections.unmodifiableSet(new TreeSet<>(missing));
    }

    public static MissingInputException of(String variable) {
        return new MissingInputException(Set.of(variable));
    }

    public Set<String> missing() {
        return missing;
    }
}
