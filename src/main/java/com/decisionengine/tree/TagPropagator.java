package com.decisionengine.tree;

import com.decisionengine.domain.enums.VariableKind;
import com.decisionengine.domain.model.TreeNode;
import com.decisionengine.variable.Branch;
import com.decisionengine.variable.VariableDecl;
import com.decisionengine.variable.VariableRegistry;
import java.util.List;

/**
 * Labels every non-root node with the branch that produced it: the parent's variable name,
 * the branch name and outcome value, and for chance parents the branch probability.
 */
public class TagPropagator {

    public void propagate(List<TreeNode> nodes, VariableRegistry registry) {
        for (TreeNode node : nodes) {
            if (!node.hasSuccessors()) {
                continue;
            }
            VariableDecl decl = registry.get(node.getVariableName());
            List<Integer> successors = node.getSuccessors();
            for (int i = 0; i < successors.size(); i++) {
                Branch branch = decl.getBranch(i);
                TreeNode child = nodes.get(successors.get(i));
                child.setTagName(node.getVariableName());
                child.setTagBranch(branch.getName());
                child.setTagValue(branch.getValue());
                child.setTagProb(decl.getKind() == VariableKind.CHANCE ? branch.getProbability() : null);
            }
        }
    }
}
