package com.decisionengine.variable;

import com.decisionengine.domain.enums.OptimizationSense;
import com.decisionengine.domain.enums.VariableKind;
import com.decisionengine.payoff.PayoffFunction;
import com.decisionengine.payoff.SumOfValuesPayoff;
import java.util.List;
import lombok.Getter;

/**
 * Declaration of one named variable in a {@link VariableRegistry}.
 *
 * <p>Only the registry mutates a declaration (branch replacement during sensitivity
 * sweeps, forced-branch pinning). Callers read it through the getters.
 */
@Getter
public class VariableDecl {

    private final String name;
    private final VariableKind kind;

    /** Ordered branches. Empty for terminals. */
    private List<Branch> branches;

    /** Selection direction. Null unless DECISION. */
    private final OptimizationSense sense;

    /** Terminal payoff. Null unless TERMINAL. */
    private final PayoffFunction payoffFunction;

    /** Index of the pinned branch, or null when rollback chooses/averages freely. */
    private Integer forcedBranch;

    private VariableDecl(
            String name,
            VariableKind kind,
            List<Branch> branches,
            OptimizationSense sense,
            PayoffFunction payoffFunction,
            Integer forcedBranch) {
        this.name = name;
        this.kind = kind;
        this.branches = List.copyOf(branches);
        this.sense = sense;
        this.payoffFunction = payoffFunction;
        this.forcedBranch = forcedBranch;
    }

    static VariableDecl decision(String name, List<Branch> branches, OptimizationSense sense) {
        return new VariableDecl(name, VariableKind.DECISION, branches, sense, null, null);
    }

    static VariableDecl chance(String name, List<Branch> branches) {
        return new VariableDecl(name, VariableKind.CHANCE, branches, null, null, null);
    }

    static VariableDecl terminal(String name, PayoffFunction payoffFunction) {
        PayoffFunction effective = payoffFunction != null ? payoffFunction : SumOfValuesPayoff.INSTANCE;
        return new VariableDecl(name, VariableKind.TERMINAL, List.of(), null, effective, null);
    }

    VariableDecl copy() {
        return new VariableDecl(name, kind, branches, sense, payoffFunction, forcedBranch);
    }

    void setBranches(List<Branch> branches) {
        this.branches = List.copyOf(branches);
    }

    void setForcedBranch(Integer forcedBranch) {
        this.forcedBranch = forcedBranch;
    }

    /**
     * Returns the position of the named branch, or -1 when the variable has no such branch.
     */
    public int branchIndex(String branchName) {
        for (int i = 0; i < branches.size(); i++) {
            if (branches.get(i).getName().equals(branchName)) {
                return i;
            }
        }
        return -1;
    }

    public Branch getBranch(int index) {
        return branches.get(index);
    }

    public boolean isForced() {
        return forcedBranch != null;
    }
}
