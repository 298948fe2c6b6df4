package com.decisionengine.domain.model;

/**
 * One outcome of a risk profile: a final payoff and its (possibly cumulative) probability.
 */
public record RiskProfilePoint(double value, double probability) {}
