/*
 * Copyright (c) 2025 Mamdani Inference Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mamdani.inference.runtime.config;

import com.mamdani.inference.runtime.operators.FuzzyOperators;

/**
 * How implied consequents of several rules combine into one output degree.
 * Both methods have identity 0, so folding starts from 0.
 */
public enum AggregationMethod {
    MAX {
        @Override
        public double combine(double acc, double value) {
            return Math.max(acc, value);
        }
    },
    PROBOR {
        @Override
        public double combine(double acc, double value) {
            return FuzzyOperators.probor(acc, value);
        }
    };

    public abstract double combine(double acc, double value);
}
