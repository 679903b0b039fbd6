/*
 * Copyright (c) 2025 Mamdani Inference Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mamdani.inference.runtime.config;

import com.mamdani.inference.runtime.operators.FuzzyOperators;

/**
 * How a rule's firing strength shapes its consequent set.
 */
public enum ImplicationMethod {
    /** Clip the consequent at the firing strength (Mamdani). */
    MIN {
        @Override
        public double apply(double strength, double membership) {
            return Math.min(strength, membership);
        }
    },
    /** Scale the consequent by the firing strength (Larsen). */
    PRODUCT {
        @Override
        public double apply(double strength, double membership) {
            return FuzzyOperators.product(strength, membership);
        }
    };

    public abstract double apply(double strength, double membership);
}
