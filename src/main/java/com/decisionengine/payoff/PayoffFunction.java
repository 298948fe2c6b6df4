package com.decisionengine.payoff;

/**
 * Computes the monetary value of a terminal from the branches taken on its root path.
 *
 * <p>Implementations must be stateless: registry copies share the same instance.
 */
@FunctionalInterface
public interface PayoffFunction {

    double evaluate(PayoffContext context);
}
