package com.decisionengine.variable;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One outgoing branch of a decision or chance variable.
 *
 * <p>Branches are immutable; sensitivity sweeps replace them through the registry
 * instead of editing them in place, which keeps registry copies independent.
 */
@Getter
@Builder(toBuilder = true)
@EqualsAndHashCode
@ToString
public class Branch {

    private final String name;

    /** Probability of the branch. Null on decision branches. */
    private final Double probability;

    /** Outcome value folded into the payoff context when the branch is taken. */
    private final double value;

    /** Name of the variable the branch leads to. */
    private final String successor;

    public static Branch decision(String name, double value, String successor) {
        return Branch.builder().name(name).value(value).successor(successor).build();
    }

    public static Branch chance(String name, double probability, double value, String successor) {
        return Branch.builder()
                .name(name)
                .probability(probability)
                .value(value)
                .successor(successor)
                .build();
    }

    public Branch withProbability(double probability) {
        return toBuilder().probability(probability).build();
    }

    public Branch withValue(double value) {
        return toBuilder().value(value).build();
    }
}
