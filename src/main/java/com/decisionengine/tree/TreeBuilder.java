package com.decisionengine.tree;

import com.decisionengine.domain.model.TreeNode;
import com.decisionengine.exception.CyclicRegistryException;
import com.decisionengine.variable.Branch;
import com.decisionengine.variable.VariableDecl;
import com.decisionengine.variable.VariableRegistry;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Unfolds a variable registry into a flat, pre-order indexed list of {@link TreeNode}s.
 *
 * <p>Each visit appends a node, then expands every branch's successor in branch order,
 * so {@code successors[i]} always corresponds to {@code branches[i]} of the declaration.
 * A variable reached along several paths is unfolded once per path (no sharing).
 *
 * <p>The variables on the current expansion path are tracked; reaching one of them again
 * raises {@link CyclicRegistryException} instead of recursing forever.
 */
public class TreeBuilder {

    private static final Logger log = LoggerFactory.getLogger(TreeBuilder.class);

    public List<TreeNode> build(VariableRegistry registry, String rootName) {
        List<TreeNode> nodes = new ArrayList<>();
        expand(registry, rootName, nodes, new ArrayList<>());
        log.debug("Built tree from '{}': {} nodes", rootName, nodes.size());
        return nodes;
    }

    private int expand(VariableRegistry registry, String name, List<TreeNode> nodes, List<String> path) {
        int repeatAt = path.indexOf(name);
        if (repeatAt >= 0) {
            List<String> cycle = new ArrayList<>(path.subList(repeatAt, path.size()));
            cycle.add(name);
            throw new CyclicRegistryException(cycle);
        }

        VariableDecl decl = registry.get(name);

        TreeNode node = new TreeNode();
        node.setIndex(nodes.size());
        node.setVariableName(name);
        node.setKind(decl.getKind());
        node.setSense(decl.getSense());
        node.setForcedBranch(decl.getForcedBranch());
        nodes.add(node);

        if (decl.getKind().hasBranches()) {
            path.add(name);
            List<Integer> successors = new ArrayList<>(decl.getBranches().size());
            for (Branch branch : decl.getBranches()) {
                successors.add(expand(registry, branch.getSuccessor(), nodes, path));
            }
            path.remove(path.size() - 1);
            node.setSuccessors(List.copyOf(successors));
        }
        return node.getIndex();
    }
}
