/*
 * Copyright (c) 2025 Mamdani Inference Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mamdani.inference.runtime.evaluation;

import com.mamdani.inference.api.IInferenceEngine;
import com.mamdani.inference.api.exceptions.EmptyFiringException;
import com.mamdani.inference.api.model.CentroidResult;
import com.mamdani.inference.api.model.InferenceSystem;
import com.mamdani.inference.api.model.InputAssignment;
import com.mamdani.inference.api.model.LinguisticVariable;
import com.mamdani.inference.api.model.RuleActivation;
import com.mamdani.inference.runtime.config.InferenceConfig;
import com.mamdani.inference.runtime.validation.InferenceSystemValidator;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Mamdani fuzzy inference over one {@link InferenceSystem}.
 *
 * <h2>Pipeline</h2>
 * <ol>
 *   <li>{@link AntecedentEvaluator}: rule firing strengths from crisp inputs</li>
 *   <li>{@link OutputAggregator}: implication and aggregation at a probe point</li>
 *   <li>{@link CentroidDefuzzifier}: centre of gravity over the output domain</li>
 * </ol>
 *
 * <p>The definition is validated once, at construction. Input assignments
 * are checked against the antecedent variables before rule evaluation unless
 * {@link InferenceConfig#isValidateInputs()} is off.
 *
 * <h2>Thread Safety</h2>
 * <p>Fully thread-safe: the system is immutable and evaluation keeps no
 * state between calls.
 */
public final class MamdaniEngine implements IInferenceEngine {
    private static final Logger logger = LoggerFactory.getLogger(MamdaniEngine.class);

    private final InferenceSystem system;
    private final InferenceConfig config;
    private final Tracer tracer;
    private final InferenceSystemValidator validator;
    private final Fuzzifier fuzzifier;
    private final AntecedentEvaluator antecedentEvaluator;
    private final OutputAggregator aggregator;
    private final CentroidDefuzzifier defuzzifier;

    /**
     * Creates an engine with full configuration.
     *
     * @param system definition to evaluate
     * @param config evaluation settings
     * @param tracer OpenTelemetry tracer for observability
     * @throws com.mamdani.inference.api.exceptions.UnknownReferenceException  if a rule
     *         references an undefined variable, label or operator
     * @throws com.mamdani.inference.api.exceptions.InvalidDefinitionException on an
     *         operator arity mismatch
     */
    public MamdaniEngine(InferenceSystem system, InferenceConfig config, Tracer tracer) {
        this.system = Objects.requireNonNull(system, "system must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        this.validator = InferenceSystemValidator.validate(system);
        this.fuzzifier = new Fuzzifier(system);
        this.antecedentEvaluator = new AntecedentEvaluator(system, fuzzifier);
        this.aggregator = new OutputAggregator(fuzzifier, config.getImplication(), config.getAggregation());
        this.defuzzifier = new CentroidDefuzzifier(aggregator, config.getIntegrationStep());

        logger.info("MamdaniEngine initialized: {} variables, {} rules, {}",
                system.variables().size(), system.rules().size(), config);
    }

    public MamdaniEngine(InferenceSystem system, InferenceConfig config) {
        this(system, config, OpenTelemetry.noop().getTracer("mamdani-evaluator"));
    }

    /**
     * Creates an engine with built-in defaults and a no-op tracer.
     */
    public MamdaniEngine(InferenceSystem system) {
        this(system, InferenceConfig.defaults());
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // IInferenceEngine INTERFACE IMPLEMENTATION
    // ════════════════════════════════════════════════════════════════════════════════

    @Override
    public InferenceSystem system() {
        return system;
    }

    @Override
    public double fuzzify(String variable, String label, double value) {
        return fuzzifier.fuzzify(variable, label, value);
    }

    @Override
    public List<RuleActivation> evaluateRules(InputAssignment inputs) {
        Objects.requireNonNull(inputs, "inputs must not be null");
        Span span = tracer.spanBuilder("evaluate-rules").startSpan();
        try (Scope scope = span.makeCurrent()) {
            if (config.isValidateInputs()) {
                validator.validateInputs(inputs);
            }
            List<RuleActivation> activations = antecedentEvaluator.evaluateRules(inputs);
            span.setAttribute("rules", activations.size());
            if (logger.isDebugEnabled()) {
                logger.debug("Rule activations for {}: {}", inputs.values(), activations);
            }
            return activations;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public double infer(InputAssignment inputs, String outputVariable, double x) {
        LinguisticVariable output = validator.requireVariable(outputVariable);
        return aggregator.degree(evaluateRules(inputs), output, x);
    }

    @Override
    public double defuzzify(InputAssignment inputs, String outputVariable) {
        CentroidResult result = centroid(inputs, outputVariable);
        return result.crisp().orElseThrow(() -> new EmptyFiringException(outputVariable));
    }

    /**
     * Firing strengths are computed once and reused at every probe point;
     * rule evaluation is pure, so this matches re-evaluating per point.
     */
    @Override
    public CentroidResult centroid(InputAssignment inputs, String outputVariable) {
        LinguisticVariable output = validator.requireVariable(outputVariable);
        Span span = tracer.spanBuilder("defuzzify").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("outputVariable", outputVariable);
            List<RuleActivation> activations = evaluateRules(inputs);
            CentroidResult result = defuzzifier.centroid(activations, output);

            span.setAttribute("samples", result.samples());
            span.setAttribute("fired", result.fired());
            if (result.fired()) {
                span.setAttribute("crisp", result.crisp().getAsDouble());
            } else {
                logger.debug("No rule fires for {} with inputs {}", outputVariable, inputs.values());
            }
            return result;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Evaluates the assignments on {@link InferenceConfig#getBatchParallelism()}
     * threads. Each assignment is defuzzified independently; results keep the
     * input order.
     */
    @Override
    public List<CentroidResult> centroidBatch(List<InputAssignment> inputs, String outputVariable) {
        Objects.requireNonNull(inputs, "inputs must not be null");
        int parallelism = Math.min(config.getBatchParallelism(), inputs.size());
        if (parallelism <= 1) {
            return IInferenceEngine.super.centroidBatch(inputs, outputVariable);
        }

        ExecutorService executor = Executors.newFixedThreadPool(parallelism);
        try {
            List<CompletableFuture<CentroidResult>> futures = new ArrayList<>(inputs.size());
            for (InputAssignment input : inputs) {
                futures.add(CompletableFuture.supplyAsync(() -> centroid(input, outputVariable), executor));
            }
            List<CentroidResult> results = new ArrayList<>(futures.size());
            for (CompletableFuture<CentroidResult> future : futures) {
                results.add(join(future));
            }
            logger.debug("Batch of {} assignments defuzzified on {} threads", inputs.size(), parallelism);
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private static CentroidResult join(CompletableFuture<CentroidResult> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
