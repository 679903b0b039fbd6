/*
 * Copyright (c) 2025 Mamdani Inference Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mamdani.inference.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Crisp input values keyed by input-variable name. Values must be finite.
 *
 * @param values variable name to crisp value
 */
public record InputAssignment(@JsonProperty("values") Map<String, Double> values) {

    public InputAssignment {
        Objects.requireNonNull(values, "values must not be null");
        values.forEach((name, value) -> {
            Objects.requireNonNull(name, "input name must not be null");
            Objects.requireNonNull(value, "input '" + name + "' must not be null");
            if (!Double.isFinite(value)) {
                throw new IllegalArgumentException("input '" + name + "' must be finite: " + value);
            }
        });
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static InputAssignment of(Map<String, Double> values) {
        return new InputAssignment(values);
    }

    public static InputAssignment of(String name, double value) {
        return new InputAssignment(Map.of(name, value));
    }

    public static InputAssignment of(String name1, double value1, String name2, double value2) {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put(name1, value1);
        values.put(name2, value2);
        return new InputAssignment(values);
    }

    public OptionalDouble value(String name) {
        Double value = values.get(name);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public boolean covers(String name) {
        return values.containsKey(name);
    }
}
