/*
 * Copyright (c) 2025 Mamdani Inference Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mamdani.inference.api;

import com.mamdani.inference.api.model.CentroidResult;
import com.mamdani.inference.api.model.InferenceSystem;
import com.mamdani.inference.api.model.InputAssignment;
import com.mamdani.inference.api.model.RuleActivation;

import java.util.List;

/**
 * Contract for evaluating crisp inputs against one fuzzy inference system.
 *
 * <p>An engine is bound to a single {@link InferenceSystem}; several engines
 * over different systems can coexist.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * IInferenceEngine engine = new MamdaniEngine(tipping);
 *
 * InputAssignment inputs = InputAssignment.of("service", 2.0, "food", 5.0);
 * double tip = engine.defuzzify(inputs, "tip");
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>Implementations must be thread-safe. Evaluations share no mutable state,
 * so one engine can score many input assignments concurrently.
 */
public interface IInferenceEngine {

    /**
     * The definition this engine evaluates.
     */
    InferenceSystem system();

    /**
     * Degree of membership of {@code value} in set {@code label} of
     * {@code variable}.
     *
     * @throws com.mamdani.inference.api.exceptions.UnknownReferenceException
     *         if the variable or label is not defined
     */
    double fuzzify(String variable, String label, double value);

    /**
     * Firing strength of every rule, in rule-base order.
     *
     * @throws com.mamdani.inference.api.exceptions.MissingInputException
     *         if an antecedent variable has no input value
     */
    List<RuleActivation> evaluateRules(InputAssignment inputs);

    /**
     * Aggregated output membership of {@code outputVariable} at probe point
     * {@code x}: every rule targeting the variable clips its consequent set
     * by its firing strength, and the clipped values are combined. Zero when
     * no rule targets the variable.
     */
    double infer(InputAssignment inputs, String outputVariable, double x);

    /**
     * Centroid of the aggregated output membership of {@code outputVariable}.
     *
     * @throws com.mamdani.inference.api.exceptions.EmptyFiringException
     *         if no rule fires anywhere in the variable's domain
     */
    double defuzzify(InputAssignment inputs, String outputVariable);

    /**
     * Centroid defuzzification reporting an empty firing as an empty result
     * instead of an exception.
     */
    CentroidResult centroid(InputAssignment inputs, String outputVariable);

    /**
     * Defuzzifies several input assignments.
     *
     * @return results in the same order as {@code inputs}
     */
    default List<CentroidResult> centroidBatch(List<InputAssignment> inputs, String outputVariable) {
        return inputs.stream()
                .map(input -> centroid(input, outputVariable))
                .toList();
    }
}
