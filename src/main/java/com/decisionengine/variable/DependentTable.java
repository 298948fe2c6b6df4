package com.decisionengine.variable;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;

/**
 * Per-path override of a variable's branch probabilities or outcome values.
 *
 * <p>Entries are keyed by the branch names taken at the {@code dependsOn} ancestors, in
 * the same order. Each entry holds one number per branch of {@code variable}.
 */
@Getter
public class DependentTable {

    public enum Target {
        PROBABILITY,
        OUTCOME
    }

    private final String variable;
    private final List<String> dependsOn;
    private final Map<List<String>, List<Double>> entries;
    private final Target target;

    DependentTable(String variable, List<String> dependsOn, Map<List<String>, List<Double>> entries, Target target) {
        this.variable = variable;
        this.dependsOn = List.copyOf(dependsOn);
        this.entries = Map.copyOf(entries);
        this.target = target;
    }

    /**
     * Looks up the override for a path, given the branch taken at every ancestor variable.
     * Returns empty when an ancestor in {@code dependsOn} is not on the path or the
     * combination has no entry.
     */
    public Optional<List<Double>> lookup(Map<String, String> branchesOnPath) {
        if (!branchesOnPath.keySet().containsAll(dependsOn)) {
            return Optional.empty();
        }
        List<String> key = dependsOn.stream().map(branchesOnPath::get).toList();
        return Optional.ofNullable(entries.get(key));
    }
}
