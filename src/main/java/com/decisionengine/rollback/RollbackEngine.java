package com.decisionengine.rollback;

import com.decisionengine.domain.enums.UtilityFunction;
import com.decisionengine.domain.model.TreeNode;
import com.decisionengine.exception.BusinessException;
import java.util.List;

/**
 * Backward induction over an evaluated tree.
 *
 * <p>Passes, in order:
 * <ol>
 *   <li><b>Utility:</b> terminal EU = U(EV) when a utility function is active; otherwise
 *       EU and CE are cleared tree-wide</li>
 *   <li><b>Rollback</b> (children before parents): CHANCE takes the probability-weighted
 *       mean of its children, or passes its forced child through; DECISION picks the child
 *       with the best criterion (EU when a utility is active, else EV) scanning in branch
 *       order so ties keep the earlier branch, or takes its forced child</li>
 *   <li><b>Optimal strategy</b> (parents before children): the root is on the strategy;
 *       DECISION passes the flag to its optimal successor only, CHANCE to every child
 *       unless forced, in which case only the forced child inherits it</li>
 *   <li><b>Path probability</b> (parents before children): unforced CHANCE hands
 *       {@code parent * p_i} to child i; forced CHANCE and DECISION hand the parent's
 *       probability to the chosen child and 0 to the others</li>
 *   <li><b>Certainty equivalent:</b> CE = U<sup>-1</sup>(EU) at every node when a utility is active</li>
 * </ol>
 *
 * <p>Pre-order indexing guarantees children have larger indices than their parents, so
 * the passes are index scans rather than recursion.
 */
public class RollbackEngine {

    public void rollback(List<TreeNode> nodes, UtilityFunction utilityFunction, double riskTolerance) {
        UtilityFunction utility = utilityFunction != null ? utilityFunction : UtilityFunction.NONE;
        validate(nodes, utility, riskTolerance);

        applyUtility(nodes, utility, riskTolerance);
        rollbackValues(nodes, utility.isActive());
        markOptimalStrategy(nodes);
        computePathProbabilities(nodes);
        if (utility.isActive()) {
            for (TreeNode node : nodes) {
                node.setCertaintyEquivalent(utility.inverse(node.getExpectedUtility(), riskTolerance));
            }
        }
    }

    private void validate(List<TreeNode> nodes, UtilityFunction utility, double riskTolerance) {
        if (nodes.isEmpty()) {
            throw new BusinessException("Cannot roll back an empty tree");
        }
        if (utility == UtilityFunction.EXP && !(riskTolerance > 0.0)) {
            throw new BusinessException("Exponential utility requires a positive risk tolerance, got " + riskTolerance);
        }
        if (utility == UtilityFunction.LOG) {
            for (TreeNode node : nodes) {
                if (node.isTerminal() && !(node.getExpectedValue() + riskTolerance > 0.0)) {
                    throw new BusinessException(String.format(
                            "Logarithmic utility undefined at node %d: payoff %s + risk tolerance %s <= 0",
                            node.getIndex(), node.getExpectedValue(), riskTolerance));
                }
            }
        }
    }

    private void applyUtility(List<TreeNode> nodes, UtilityFunction utility, double riskTolerance) {
        for (TreeNode node : nodes) {
            node.setCertaintyEquivalent(null);
            if (utility.isActive() && node.isTerminal()) {
                node.setExpectedUtility(utility.apply(node.getExpectedValue(), riskTolerance));
            } else {
                node.setExpectedUtility(null);
            }
        }
    }

    private void rollbackValues(List<TreeNode> nodes, boolean useUtility) {
        for (int i = nodes.size() - 1; i >= 0; i--) {
            TreeNode node = nodes.get(i);
            if (node.isChance()) {
                rollbackChance(nodes, node, useUtility);
            } else if (node.isDecision()) {
                rollbackDecision(nodes, node, useUtility);
            }
        }
    }

    private void rollbackChance(List<TreeNode> nodes, TreeNode node, boolean useUtility) {
        List<Integer> successors = node.getSuccessors();

        if (node.isForced()) {
            TreeNode forced = nodes.get(successors.get(node.getForcedBranch()));
            node.setOptimalSuccessor(forced.getIndex());
            node.setExpectedValue(forced.getExpectedValue());
            node.setExpectedUtility(useUtility ? forced.getExpectedUtility() : null);
            return;
        }

        double expectedValue = 0.0;
        double expectedUtility = 0.0;
        for (Integer successor : successors) {
            TreeNode child = nodes.get(successor);
            double probability = child.getTagProb();
            expectedValue += probability * child.getExpectedValue();
            if (useUtility) {
                expectedUtility += probability * child.getExpectedUtility();
            }
        }
        node.setOptimalSuccessor(null);
        node.setExpectedValue(expectedValue);
        node.setExpectedUtility(useUtility ? expectedUtility : null);
    }

    private void rollbackDecision(List<TreeNode> nodes, TreeNode node, boolean useUtility) {
        List<Integer> successors = node.getSuccessors();

        TreeNode chosen;
        if (node.isForced()) {
            chosen = nodes.get(successors.get(node.getForcedBranch()));
        } else {
            chosen = nodes.get(successors.get(0));
            double best = criterion(chosen, useUtility);
            for (int i = 1; i < successors.size(); i++) {
                TreeNode candidate = nodes.get(successors.get(i));
                double value = criterion(candidate, useUtility);
                if (node.getSense().isBetter(value, best)) {
                    chosen = candidate;
                    best = value;
                }
            }
        }

        node.setOptimalSuccessor(chosen.getIndex());
        node.setExpectedValue(chosen.getExpectedValue());
        node.setExpectedUtility(useUtility ? chosen.getExpectedUtility() : null);
    }

    private double criterion(TreeNode node, boolean useUtility) {
        return useUtility ? node.getExpectedUtility() : node.getExpectedValue();
    }

    private void markOptimalStrategy(List<TreeNode> nodes) {
        for (TreeNode node : nodes) {
            node.setOptimalStrategy(node.isRoot());
        }
        for (TreeNode node : nodes) {
            boolean onStrategy = node.isOptimalStrategy();
            for (Integer successor : node.getSuccessors()) {
                boolean inherits = node.isChance() && !node.isForced()
                        || successor.equals(node.getOptimalSuccessor());
                nodes.get(successor).setOptimalStrategy(onStrategy && inherits);
            }
        }
    }

    private void computePathProbabilities(List<TreeNode> nodes) {
        nodes.get(0).setPathProbability(1.0);
        for (TreeNode node : nodes) {
            double reach = node.getPathProbability();
            for (Integer successor : node.getSuccessors()) {
                TreeNode child = nodes.get(successor);
                if (node.isChance() && !node.isForced()) {
                    child.setPathProbability(reach * child.getTagProb());
                } else {
                    child.setPathProbability(successor.equals(node.getOptimalSuccessor()) ? reach : 0.0);
                }
            }
        }
    }
}
