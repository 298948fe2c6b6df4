package com.decisionengine.payoff;

/**
 * Default payoff: the arithmetic sum of every outcome value accumulated on the path.
 */
public final class SumOfValuesPayoff implements PayoffFunction {

    public static final SumOfValuesPayoff INSTANCE = new SumOfValuesPayoff();

    private SumOfValuesPayoff() {}

    @Override
    public double evaluate(PayoffContext context) {
        return context.getValues().values().stream()
                .mapToDouble(Double::doubleValue)
                .sum();
    }
}
