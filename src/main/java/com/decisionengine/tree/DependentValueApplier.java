package com.decisionengine.tree;

import com.decisionengine.domain.model.TreeNode;
import com.decisionengine.variable.DependentTable;
import com.decisionengine.variable.VariableRegistry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Overwrites branch tags with path-dependent probabilities and outcomes.
 *
 * <p>Runs after {@link TagPropagator}. For every node, the branches taken from the root to
 * the node (the node's own incoming branch included) select an entry of each dependent
 * table registered for the node's variable; the entry replaces the children's
 * {@code tagProb} or {@code tagValue}. Nodes whose path matches no entry keep the
 * declared values.
 */
public class DependentValueApplier {

    public void apply(List<TreeNode> nodes, VariableRegistry registry) {
        List<DependentTable> tables = registry.getDependentTables();
        if (tables.isEmpty() || nodes.isEmpty()) {
            return;
        }

        // Parents precede children, so each node's path map is ready when it is visited.
        List<Map<String, String>> pathBranches = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            pathBranches.add(null);
        }
        pathBranches.set(0, Map.of());

        for (TreeNode node : nodes) {
            Map<String, String> branches = pathBranches.get(node.getIndex());

            for (DependentTable table : tables) {
                if (!table.getVariable().equals(node.getVariableName())) {
                    continue;
                }
                Optional<List<Double>> override = table.lookup(branches);
                override.ifPresent(values -> overwrite(nodes, node, table.getTarget(), values));
            }

            for (Integer successor : node.getSuccessors()) {
                TreeNode child = nodes.get(successor);
                Map<String, String> childBranches = new HashMap<>(branches);
                childBranches.put(child.getTagName(), child.getTagBranch());
                pathBranches.set(successor, childBranches);
            }
        }
    }

    private void overwrite(List<TreeNode> nodes, TreeNode node, DependentTable.Target target, List<Double> values) {
        List<Integer> successors = node.getSuccessors();
        for (int i = 0; i < successors.size(); i++) {
            TreeNode child = nodes.get(successors.get(i));
            if (target == DependentTable.Target.PROBABILITY) {
                child.setTagProb(values.get(i));
            } else {
                child.setTagValue(values.get(i));
            }
        }
    }
}
