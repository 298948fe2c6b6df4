package com.decisionengine.domain.model;

import com.decisionengine.domain.enums.OptimizationSense;
import com.decisionengine.domain.enums.VariableKind;
import com.decisionengine.payoff.PayoffContext;
import java.util.List;
import java.util.Map;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One position in an unfolded decision tree.
 *
 * <p>Nodes live in a flat list indexed in construction pre-order (root = 0), and refer to
 * their children by index only. Because every child is created after its parent, a
 * child's index is always greater than its parent's: a forward scan visits parents before
 * children and a reverse scan visits children before parents.
 *
 * <p>Fields fill in phase by phase:
 * <ul>
 *   <li><b>Build:</b> index, variableName, kind, sense, forcedBranch, successors</li>
 *   <li><b>Tagging:</b> tagName, tagBranch, tagValue, tagProb (chance parents only); none on the root</li>
 *   <li><b>Evaluation:</b> payoffContext on every node, expectedValue on terminals</li>
 *   <li><b>Rollback:</b> expectedValue everywhere, expectedUtility/certaintyEquivalent when a
 *       utility function is active, optimalSuccessor, optimalStrategy, pathProbability</li>
 *   <li><b>Risk profile:</b> riskProfile (outcome value to probability)</li>
 * </ul>
 */
@Data
@NoArgsConstructor
public class TreeNode {

    private int index;
    private String variableName;
    private VariableKind kind;

    /** Copied from the declaration; DECISION only. */
    private OptimizationSense sense;

    /** Position of the pinned successor, or null. */
    private Integer forcedBranch;

    /** Child indices in branch order. Empty for terminals. */
    private List<Integer> successors = List.of();

    /** Variable of the parent, i.e. the variable whose branch led here. */
    private String tagName;

    private String tagBranch;
    private Double tagValue;
    private Double tagProb;

    private PayoffContext payoffContext;

    private Double expectedValue;
    private Double expectedUtility;
    private Double certaintyEquivalent;

    /** Chosen child on DECISION nodes and forced CHANCE nodes. */
    private Integer optimalSuccessor;

    private boolean optimalStrategy;
    private Double pathProbability;
    private Map<Double, Double> riskProfile;

    public boolean isRoot() {
        return index == 0;
    }

    public boolean isTerminal() {
        return kind == VariableKind.TERMINAL;
    }

    public boolean isDecision() {
        return kind == VariableKind.DECISION;
    }

    public boolean isChance() {
        return kind == VariableKind.CHANCE;
    }

    public boolean isForced() {
        return forcedBranch != null;
    }

    public boolean hasSuccessors() {
        return successors != null && !successors.isEmpty();
    }
}
