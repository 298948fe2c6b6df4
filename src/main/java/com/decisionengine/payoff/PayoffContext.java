package com.decisionengine.payoff;

import com.decisionengine.exception.BusinessException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Path context handed to a {@link PayoffFunction}: for every variable traversed from the
 * root, the outcome value, probability (chance variables only) and branch name taken.
 *
 * <p>Contexts are immutable. {@link #extend} returns a new context, so a parent's context
 * is never modified by its children.
 */
@Getter
@EqualsAndHashCode
@ToString
public class PayoffContext {

    public static final PayoffContext EMPTY = new PayoffContext(Map.of(), Map.of(), Map.of());

    private final Map<String, Double> values;
    private final Map<String, Double> probabilities;
    private final Map<String, String> branches;

    public PayoffContext(
            Map<String, Double> values, Map<String, Double> probabilities, Map<String, String> branches) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.probabilities = Collections.unmodifiableMap(new LinkedHashMap<>(probabilities));
        this.branches = Collections.unmodifiableMap(new LinkedHashMap<>(branches));
    }

    /**
     * Returns a context with one more traversed variable folded in.
     *
     * @param variable    the variable whose branch was taken
     * @param branch      branch name
     * @param value       outcome value of the branch
     * @param probability branch probability, or null for decision branches
     */
    public PayoffContext extend(String variable, String branch, double value, Double probability) {
        Map<String, Double> nextValues = new LinkedHashMap<>(values);
        nextValues.put(variable, value);
        Map<String, String> nextBranches = new LinkedHashMap<>(branches);
        nextBranches.put(variable, branch);
        Map<String, Double> nextProbabilities = probabilities;
        if (probability != null) {
            nextProbabilities = new LinkedHashMap<>(probabilities);
            nextProbabilities.put(variable, probability);
        }
        return new PayoffContext(nextValues, nextProbabilities, nextBranches);
    }

    /**
     * Outcome value taken at {@code variable} on this path.
     *
     * @throws BusinessException if the variable was not traversed on this path
     */
    public double value(String variable) {
        Double value = values.get(variable);
        if (value == null) {
            throw new BusinessException(String.format("No value accumulated for variable '%s' on this path", variable));
        }
        return value;
    }

    public boolean hasValue(String variable) {
        return values.containsKey(variable);
    }

    public String branch(String variable) {
        return branches.get(variable);
    }
}
