package com.decisionengine.variable;

import com.decisionengine.domain.enums.OptimizationSense;
import com.decisionengine.domain.enums.ProbabilityMode;
import com.decisionengine.domain.enums.VariableKind;
import com.decisionengine.exception.BusinessException;
import com.decisionengine.exception.MalformedDeclarationException;
import com.decisionengine.exception.UnknownVariableException;
import com.decisionengine.payoff.PayoffFunction;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.apache.commons.math3.util.Precision;

/**
 * Named variable declarations from which a decision tree is unfolded.
 *
 * <p>The registry is the registration surface of the engine: {@link #decision},
 * {@link #chance} and {@link #terminal} validate a declaration before storing it, so a
 * malformed variable never reaches the tree builder. Successor names are not resolved here;
 * an unknown successor surfaces as {@link UnknownVariableException} when a tree is built.
 *
 * <p>Chance probabilities are checked according to the {@link ProbabilityMode}:
 * <ul>
 *   <li>STRICT: the branch probabilities must sum to 1 within {@code tolerance}</li>
 *   <li>NORMALIZE: the probabilities are rescaled to sum to 1 (a zero sum is rejected)</li>
 * </ul>
 *
 * <p>The first registered variable is the default root. Registering a name again
 * replaces the earlier declaration in place.
 *
 * <p>Not thread-safe. A {@link com.decisionengine.tree.DecisionTree} works on its own
 * {@link #copy()}, so the caller's registry is never touched by tree operations.
 */
public class VariableRegistry {

    public static final double DEFAULT_TOLERANCE = 1e-9;

    private final ProbabilityMode probabilityMode;
    private final double tolerance;
    private final Map<String, VariableDecl> variables = new LinkedHashMap<>();
    private final List<DependentTable> dependentTables = new ArrayList<>();

    public VariableRegistry() {
        this(ProbabilityMode.STRICT, DEFAULT_TOLERANCE);
    }

    public VariableRegistry(ProbabilityMode probabilityMode) {
        this(probabilityMode, DEFAULT_TOLERANCE);
    }

    public VariableRegistry(ProbabilityMode probabilityMode, double tolerance) {
        this.probabilityMode = probabilityMode != null ? probabilityMode : ProbabilityMode.STRICT;
        this.tolerance = tolerance;
    }

    // ==================== Registration ====================

    public VariableRegistry decision(String name, List<Branch> branches, OptimizationSense sense) {
        List<String> violations = new ArrayList<>();
        checkName(name, violations);
        checkBranches(VariableKind.DECISION, branches, violations);
        if (sense == null) {
            violations.add("optimization sense is required");
        }
        if (!violations.isEmpty()) {
            throw new MalformedDeclarationException(name, violations);
        }
        variables.put(name, VariableDecl.decision(name, branches, sense));
        return this;
    }

    public VariableRegistry decision(String name, List<Branch> branches, boolean maximize) {
        return decision(name, branches, maximize ? OptimizationSense.MAXIMIZE : OptimizationSense.MINIMIZE);
    }

    public VariableRegistry chance(String name, List<Branch> branches) {
        List<String> violations = new ArrayList<>();
        checkName(name, violations);
        checkBranches(VariableKind.CHANCE, branches, violations);
        if (!violations.isEmpty()) {
            throw new MalformedDeclarationException(name, violations);
        }

        List<Double> probabilities =
                branches.stream().map(Branch::getProbability).toList();
        List<Double> checked = checkProbabilities(name, probabilities);

        List<Branch> stored = new ArrayList<>(branches.size());
        for (int i = 0; i < branches.size(); i++) {
            stored.add(branches.get(i).withProbability(checked.get(i)));
        }
        variables.put(name, VariableDecl.chance(name, stored));
        return this;
    }

    /**
     * Registers a terminal. A null payoff function falls back to the sum of the outcome
     * values accumulated along the path.
     */
    public VariableRegistry terminal(String name, PayoffFunction payoffFunction) {
        List<String> violations = new ArrayList<>();
        checkName(name, violations);
        if (!violations.isEmpty()) {
            throw new MalformedDeclarationException(name, violations);
        }
        variables.put(name, VariableDecl.terminal(name, payoffFunction));
        return this;
    }

    public VariableRegistry terminal(String name) {
        return terminal(name, null);
    }

    /**
     * Makes the probabilities of a chance variable depend on the branches taken at earlier
     * variables on the same path.
     *
     * @param variable  the chance variable whose branch probabilities are overridden
     * @param dependsOn ancestor variables, in key order
     * @param table     ancestor branch names to one probability per branch of {@code variable}
     */
    public VariableRegistry dependentProbabilities(
            String variable, List<String> dependsOn, Map<List<String>, List<Double>> table) {
        VariableDecl decl = get(variable);
        if (decl.getKind() != VariableKind.CHANCE) {
            throw new MalformedDeclarationException(variable, "dependent probabilities require a CHANCE variable");
        }
        checkDependencyShape(decl, dependsOn, table);
        List<String> violations = new ArrayList<>();
        table.forEach((key, probabilities) -> {
            for (int i = 0; i < probabilities.size(); i++) {
                Double probability = probabilities.get(i);
                if (probability != null
                        && (probability < 0.0 || probability > 1.0 || probability.isNaN())) {
                    violations.add("entry for " + key + " probability #" + i + " " + probability
                            + " is outside [0, 1]");
                }
            }
        });
        if (!violations.isEmpty()) {
            throw new MalformedDeclarationException(variable, violations);
        }

        Map<List<String>, List<Double>> checked = new LinkedHashMap<>();
        for (Map.Entry<List<String>, List<Double>> entry : table.entrySet()) {
            checked.put(List.copyOf(entry.getKey()), checkProbabilities(variable, entry.getValue()));
        }
        dependentTables.add(new DependentTable(variable, dependsOn, checked, DependentTable.Target.PROBABILITY));
        return this;
    }

    /**
     * Makes the outcome values of a decision or chance variable depend on the branches
     * taken at earlier variables on the same path.
     */
    public VariableRegistry dependentOutcomes(
            String variable, List<String> dependsOn, Map<List<String>, List<Double>> table) {
        VariableDecl decl = get(variable);
        if (!decl.getKind().hasBranches()) {
            throw new MalformedDeclarationException(variable, "dependent outcomes require a DECISION or CHANCE variable");
        }
        checkDependencyShape(decl, dependsOn, table);
        dependentTables.add(new DependentTable(variable, dependsOn, table, DependentTable.Target.OUTCOME));
        return this;
    }

    // ==================== Lookup ====================

    public VariableDecl get(String name) {
        VariableDecl decl = variables.get(name);
        if (decl == null) {
            throw new UnknownVariableException(name);
        }
        return decl;
    }

    public boolean contains(String name) {
        return variables.containsKey(name);
    }

    public Set<String> getVariableNames() {
        return Collections.unmodifiableSet(variables.keySet());
    }

    public Collection<VariableDecl> getVariables() {
        return Collections.unmodifiableCollection(variables.values());
    }

    public List<DependentTable> getDependentTables() {
        return Collections.unmodifiableList(dependentTables);
    }

    public String getInitialVariable() {
        if (variables.isEmpty()) {
            throw new BusinessException("Registry has no variables");
        }
        return variables.keySet().iterator().next();
    }

    public int size() {
        return variables.size();
    }

    public ProbabilityMode getProbabilityMode() {
        return probabilityMode;
    }

    public double getTolerance() {
        return tolerance;
    }

    // ==================== Mutation (forced branches, sensitivity) ====================

    public void forceBranch(String variable, String branchName) {
        VariableDecl decl = get(variable);
        int index = decl.branchIndex(branchName);
        if (index < 0) {
            throw new BusinessException(String.format("Variable '%s' has no branch '%s'", variable, branchName));
        }
        forceBranch(variable, index);
    }

    public void forceBranch(String variable, int branchIndex) {
        VariableDecl decl = get(variable);
        if (!decl.getKind().hasBranches()) {
            throw new BusinessException(String.format("Cannot force a branch on terminal variable '%s'", variable));
        }
        if (branchIndex < 0 || branchIndex >= decl.getBranches().size()) {
            throw new BusinessException(String.format(
                    "Branch index %d out of range for variable '%s' (%d branches)",
                    branchIndex, variable, decl.getBranches().size()));
        }
        decl.setForcedBranch(branchIndex);
    }

    public void clearForcedBranch(String variable) {
        get(variable).setForcedBranch(null);
    }

    /**
     * Replaces the outcome value of one branch. No validation beyond the branch lookup.
     */
    public void setBranchValue(String variable, String branchName, double value) {
        VariableDecl decl = get(variable);
        int index = decl.branchIndex(branchName);
        if (index < 0) {
            throw new BusinessException(String.format("Variable '%s' has no branch '%s'", variable, branchName));
        }
        List<Branch> branches = new ArrayList<>(decl.getBranches());
        branches.set(index, branches.get(index).withValue(value));
        decl.setBranches(branches);
    }

    /**
     * Replaces all branch probabilities of a chance variable without checking that they sum
     * to 1. Sensitivity sweeps pass through intermediate states that would fail STRICT
     * validation, such as all branches but two pinned to zero.
     */
    public void setBranchProbabilities(String variable, List<Double> probabilities) {
        VariableDecl decl = get(variable);
        if (decl.getKind() != VariableKind.CHANCE) {
            throw new BusinessException(String.format("Variable '%s' is not a CHANCE variable", variable));
        }
        if (probabilities.size() != decl.getBranches().size()) {
            throw new BusinessException(String.format(
                    "Variable '%s' has %d branches, got %d probabilities",
                    variable, decl.getBranches().size(), probabilities.size()));
        }
        List<Branch> branches = new ArrayList<>(decl.getBranches().size());
        for (int i = 0; i < probabilities.size(); i++) {
            branches.add(decl.getBranch(i).withProbability(probabilities.get(i)));
        }
        decl.setBranches(branches);
    }

    /**
     * Returns {top, bottom}: the positions of the first highest-valued and the first
     * lowest-valued branches of a variable.
     */
    public int[] topBottomBranches(String variable) {
        List<Branch> branches = get(variable).getBranches();
        int top = 0;
        int bottom = 0;
        for (int i = 1; i < branches.size(); i++) {
            if (branches.get(i).getValue() > branches.get(top).getValue()) {
                top = i;
            }
            if (branches.get(i).getValue() < branches.get(bottom).getValue()) {
                bottom = i;
            }
        }
        return new int[] {top, bottom};
    }

    /**
     * Deep copy. Declarations and their forced-branch state are duplicated; branches and
     * dependent tables are immutable and shared; payoff functions are shared.
     */
    public VariableRegistry copy() {
        VariableRegistry copy = new VariableRegistry(probabilityMode, tolerance);
        variables.forEach((name, decl) -> copy.variables.put(name, decl.copy()));
        copy.dependentTables.addAll(dependentTables);
        return copy;
    }

    // ==================== Validation ====================

    private void checkName(String name, List<String> violations) {
        if (name == null || name.isBlank()) {
            violations.add("name is required");
        }
    }

    private void checkBranches(VariableKind kind, List<Branch> branches, List<String> violations) {
        if (branches == null || branches.isEmpty()) {
            violations.add("branches must not be empty");
            return;
        }
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < branches.size(); i++) {
            Branch branch = branches.get(i);
            if (branch == null) {
                violations.add("branch #" + i + " is null");
                continue;
            }
            if (branch.getName() == null || branch.getName().isBlank()) {
                violations.add("branch #" + i + " has no name");
            } else if (!seen.add(branch.getName())) {
                violations.add("branch name '" + branch.getName() + "' is used twice");
            }
            if (branch.getSuccessor() == null || branch.getSuccessor().isBlank()) {
                violations.add("branch #" + i + " has no successor");
            }
            if (kind == VariableKind.DECISION && branch.getProbability() != null) {
                violations.add("branch #" + i + " of a DECISION variable must not carry a probability");
            }
            if (kind == VariableKind.CHANCE) {
                Double probability = branch.getProbability();
                if (probability == null) {
                    violations.add("branch #" + i + " of a CHANCE variable requires a probability");
                } else if (probability < 0.0 || probability > 1.0 || probability.isNaN()) {
                    violations.add("branch #" + i + " probability " + probability + " is outside [0, 1]");
                }
            }
        }
    }

    private List<Double> checkProbabilities(String variable, List<Double> probabilities) {
        double sum = probabilities.stream().mapToDouble(Double::doubleValue).sum();
        if (Precision.equals(sum, 1.0, tolerance)) {
            return List.copyOf(probabilities);
        }
        if (probabilityMode == ProbabilityMode.STRICT) {
            throw new MalformedDeclarationException(
                    variable, String.format("probabilities must sum to 1, got %s", sum));
        }
        if (sum <= 0.0) {
            throw new MalformedDeclarationException(variable, "probabilities sum to zero and cannot be normalized");
        }
        return probabilities.stream().map(p -> p / sum).toList();
    }

    private void checkDependencyShape(
            VariableDecl decl, List<String> dependsOn, Map<List<String>, List<Double>> table) {
        List<String> violations = new ArrayList<>();
        if (dependsOn == null || dependsOn.isEmpty()) {
            violations.add("dependsOn must name at least one variable");
        } else if (dependsOn.contains(decl.getName())) {
            violations.add("a variable cannot depend on itself");
        }
        if (table == null || table.isEmpty()) {
            violations.add("dependency table must not be empty");
        }
        if (!violations.isEmpty()) {
            throw new MalformedDeclarationException(decl.getName(), violations);
        }
        int branchCount = decl.getBranches().size();
        for (Map.Entry<List<String>, List<Double>> entry : table.entrySet()) {
            if (entry.getKey() == null || entry.getKey().size() != dependsOn.size()) {
                violations.add("key " + entry.getKey() + " must name one branch per dependsOn variable");
            }
            if (entry.getValue() == null || entry.getValue().size() != branchCount) {
                violations.add("entry for " + entry.getKey() + " must hold " + branchCount + " values");
            } else if (entry.getValue().stream().anyMatch(Objects::isNull)) {
                violations.add("entry for " + entry.getKey() + " holds a null value");
            }
        }
        if (!violations.isEmpty()) {
            throw new MalformedDeclarationException(decl.getName(), violations);
        }
    }
}
