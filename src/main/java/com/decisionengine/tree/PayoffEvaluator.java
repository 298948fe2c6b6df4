package com.decisionengine.tree;

import com.decisionengine.domain.model.TreeNode;
import com.decisionengine.payoff.PayoffContext;
import com.decisionengine.variable.VariableRegistry;
import java.util.List;

/**
 * Accumulates each node's root-path context and computes terminal payoffs.
 *
 * <p>The root gets an empty context; every other node gets its parent's context extended
 * with the node's own tag. Terminals then store the payoff function's result as their
 * expected value. Internal expected values are left to the rollback.
 */
public class PayoffEvaluator {

    public void evaluate(List<TreeNode> nodes, VariableRegistry registry) {
        if (nodes.isEmpty()) {
            return;
        }
        nodes.get(0).setPayoffContext(PayoffContext.EMPTY);

        for (TreeNode node : nodes) {
            PayoffContext context = node.getPayoffContext();

            if (node.isTerminal()) {
                double payoff = registry.get(node.getVariableName()).getPayoffFunction().evaluate(context);
                node.setExpectedValue(payoff);
                continue;
            }

            for (Integer successor : node.getSuccessors()) {
                TreeNode child = nodes.get(successor);
                child.setPayoffContext(
                        context.extend(child.getTagName(), child.getTagBranch(), child.getTagValue(), child.getTagProb()));
            }
        }
    }
}
