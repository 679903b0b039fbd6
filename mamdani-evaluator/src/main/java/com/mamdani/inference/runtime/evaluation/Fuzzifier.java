/*
 * Copyright (c) 2025 Mamdani Inference Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mamdani.inference.runtime.evaluation;

import com.mamdani.inference.api.exceptions.UnknownReferenceException;
import com.mamdani.inference.api.model.InferenceSystem;
import com.mamdani.inference.api.model.LinguisticVariable;
import com.mamdani.inference.api.model.MembershipFunction;
import com.mamdani.inference.runtime.membership.MembershipFunctions;

import java.util.Objects;

/**
 * Evaluates the membership function of a labeled set at a crisp value.
 */
public final class Fuzzifier {

    private final InferenceSystem system;

    public Fuzzifier(InferenceSystem system) {
        this.system = Objects.requireNonNull(system, "system must not be null");
    }

    /**
     * @throws UnknownReferenceException if the variable or label is not defined
     */
    public double fuzzify(String variable, String label, double value) {
        LinguisticVariable lv = system.variable(variable)
                .orElseThrow(() -> UnknownReferenceException.variable(variable));
        return fuzzify(lv, label, value);
    }

    /**
     * @throws UnknownReferenceException if the label is not defined in {@code variable}
     */
    public double fuzzify(LinguisticVariable variable, String label, double value) {
        MembershipFunction fn = variable.set(label)
                .orElseThrow(() -> UnknownReferenceException.label(variable.name(), label));
        return MembershipFunctions.evaluate(fn, value);
    }
}
