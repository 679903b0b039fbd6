/*
 * Copyright (c) 2025 Mamdani Inference Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mamdani.inference.api.model;

/**
 * Firing strength of one rule, paired with the rule's consequent.
 *
 * @param ruleIndex  position of the rule in the rule base
 * @param consequent the rule's consequent predicate
 * @param strength   degree to which the antecedent holds
 */
public record RuleActivation(int ruleIndex, Predicate consequent, double strength) {

    public String variable() {
        return consequent.variable();
    }

    public String label() {
        return consequent.label();
    }

    public boolean targets(String outputVariable) {
        return consequent.variable().equals(outputVariable);
    }
}
