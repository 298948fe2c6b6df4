package com.decisionengine.sensitivity;

import com.decisionengine.domain.model.SensitivityRow;
import com.decisionengine.domain.model.SensitivityTable;
import com.decisionengine.domain.model.TreeNode;
import com.decisionengine.exception.BusinessException;
import com.decisionengine.exception.InvalidSensitivityTargetException;
import com.decisionengine.tree.DecisionTree;
import com.decisionengine.variable.DependentTable;
import com.decisionengine.variable.VariableDecl;
import com.decisionengine.variable.VariableRegistry;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.util.Precision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sweeps the outcome value of one branch across {@code [minValue, maxValue]} and records
 * the root expected value (or each root decision branch's) per sample.
 */
public class ValueSensitivity extends SensitivitySweep {

    private static final Logger log = LoggerFactory.getLogger(ValueSensitivity.class);

    public static final int DEFAULT_POINTS = 11;

    public SensitivityTable run(
            DecisionTree tree, String variable, String branch, double minValue, double maxValue, int points) {
        checkTarget(tree.getRegistry(), variable, branch);
        if (!(minValue <= maxValue)) {
            throw new BusinessException(String.format("Invalid value range [%s, %s]", minValue, maxValue));
        }
        List<Double> values = linspace(minValue, maxValue, points);

        SensitivityTable table = tree.isolated(() -> sweep(tree, variable, branch, values));
        log.info("Value sensitivity on '{}'/'{}': {} samples in [{}, {}]",
                variable, branch, values.size(), minValue, maxValue);
        return table;
    }

    private SensitivityTable sweep(DecisionTree tree, String variable, String branch, List<Double> values) {
        VariableRegistry registry = tree.getRegistry();
        List<String> series = rootSeries(tree);

        List<SensitivityRow> rows = new ArrayList<>(values.size());
        for (double value : values) {
            registry.setBranchValue(variable, branch, value);
            tree.rebuild();
            tree.evaluate();
            tree.rollback();
            rows.add(row(value, String.valueOf(Precision.round(value, 4)),
                    readSeries(tree, series, TreeNode::getExpectedValue)));
        }
        return SensitivityTable.builder()
                .parameter("value")
                .series(series)
                .rows(List.copyOf(rows))
                .build();
    }

    private void checkTarget(VariableRegistry registry, String variable, String branch) {
        VariableDecl decl = registry.get(variable);
        if (!decl.getKind().hasBranches()) {
            throw new InvalidSensitivityTargetException(variable, "terminal variables have no branch values");
        }
        if (decl.branchIndex(branch) < 0) {
            throw new InvalidSensitivityTargetException(variable, "no branch named '" + branch + "'");
        }
        for (DependentTable dependency : registry.getDependentTables()) {
            if (dependency.getVariable().equals(variable) && dependency.getTarget() == DependentTable.Target.OUTCOME) {
                throw new InvalidSensitivityTargetException(
                        variable, "outcome values are overridden by a dependency table");
            }
        }
    }
}
