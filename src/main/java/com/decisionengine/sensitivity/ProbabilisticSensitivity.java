package com.decisionengine.sensitivity;

import com.decisionengine.domain.enums.VariableKind;
import com.decisionengine.domain.model.SensitivityRow;
import com.decisionengine.domain.model.SensitivityTable;
import com.decisionengine.domain.model.TreeNode;
import com.decisionengine.exception.InvalidSensitivityTargetException;
import com.decisionengine.tree.DecisionTree;
import com.decisionengine.variable.DependentTable;
import com.decisionengine.variable.VariableDecl;
import com.decisionengine.variable.VariableRegistry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.commons.math3.util.Precision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sweeps the probability mass of a chance variable between its lowest- and highest-valued
 * branches.
 *
 * <p>At sample {@code p} the lowest-valued branch gets probability {@code p}, the
 * highest-valued branch {@code 1 - p}, every other branch 0. The whole pipeline
 * (rebuild, evaluate, rollback) runs per sample, so every node unfolded from the variable
 * sees the new probabilities. At {@code p = 1} the result equals forcing the lowest-valued
 * branch; at {@code p = 0}, forcing the highest-valued one.
 */
public class ProbabilisticSensitivity extends SensitivitySweep {

    private static final Logger log = LoggerFactory.getLogger(ProbabilisticSensitivity.class);

    public static final int DEFAULT_POINTS = 21;

    public SensitivityTable run(DecisionTree tree, String variable, int points) {
        int[] topBottom = checkTarget(tree.getRegistry(), variable);
        List<Double> probabilities = linspace(0.0, 1.0, points);

        SensitivityTable table = tree.isolated(() -> sweep(tree, variable, topBottom, probabilities));
        log.info("Probabilistic sensitivity on '{}': {} samples over {} series",
                variable, probabilities.size(), table.getSeries().size());
        return table;
    }

    private SensitivityTable sweep(DecisionTree tree, String variable, int[] topBottom, List<Double> probabilities) {
        VariableRegistry registry = tree.getRegistry();
        int branchCount = registry.get(variable).getBranches().size();
        List<String> series = rootSeries(tree);

        List<SensitivityRow> rows = new ArrayList<>(probabilities.size());
        for (double p : probabilities) {
            List<Double> assigned = new ArrayList<>(Collections.nCopies(branchCount, 0.0));
            assigned.set(topBottom[1], p);
            assigned.set(topBottom[0], 1.0 - p);
            registry.setBranchProbabilities(variable, assigned);

            tree.rebuild();
            tree.evaluate();
            tree.rollback();
            rows.add(row(p, String.valueOf(Precision.round(p, 4)), readSeries(tree, series, TreeNode::getExpectedValue)));
        }
        return SensitivityTable.builder()
                .parameter("probability")
                .series(series)
                .rows(List.copyOf(rows))
                .build();
    }

    private int[] checkTarget(VariableRegistry registry, String variable) {
        VariableDecl decl = registry.get(variable);
        if (decl.getKind() != VariableKind.CHANCE) {
            throw new InvalidSensitivityTargetException(variable, "probabilistic sensitivity requires a CHANCE variable");
        }
        for (DependentTable dependency : registry.getDependentTables()) {
            if (dependency.getVariable().equals(variable)
                    && dependency.getTarget() == DependentTable.Target.PROBABILITY) {
                throw new InvalidSensitivityTargetException(
                        variable, "probabilities are overridden by a dependency table");
            }
        }
        int[] topBottom = registry.topBottomBranches(variable);
        if (topBottom[0] == topBottom[1]) {
            throw new InvalidSensitivityTargetException(variable, "all branches have the same outcome value");
        }
        return topBottom;
    }
}
