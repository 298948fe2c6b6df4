package com.decisionengine.unit.tree;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.decisionengine.domain.model.TreeNode;
import com.decisionengine.tree.DecisionTree;
import com.decisionengine.unit.support.ExampleTrees;
import com.decisionengine.variable.VariableRegistry;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Path-dependent probabilities and outcomes, applied after tagging by
 * {@link com.decisionengine.tree.DependentValueApplier}.
 */
class DependentValueApplierTest {

    @Test
    @DisplayName("Cost probabilities follow the competitor bid on each path")
    void dependentProbabilities() {
        Map<List<String>, List<Double>> table = new LinkedHashMap<>();
        table.put(List.of("low"), List.of(0.40, 0.40, 0.20));
        table.put(List.of("medium"), List.of(0.25, 0.50, 0.25));
        table.put(List.of("high"), List.of(0.10, 0.45, 0.45));
        VariableRegistry registry = ExampleTrees.bid().dependentProbabilities("cost", List.of("compbid"), table);

        DecisionTree tree = new DecisionTree(registry);

        assertThat(childProbabilities(tree, 2)).containsExactly(0.40, 0.40, 0.20);
        assertThat(childProbabilities(tree, 6)).containsExactly(0.25, 0.50, 0.25);
        assertThat(childProbabilities(tree, 10)).containsExactly(0.10, 0.45, 0.45);

        tree.evaluate();
        assertThat(tree.rollback()).isCloseTo(54.5, within(1e-9));
        assertThat(tree.getNode(14).getExpectedValue()).isCloseTo(34.5, within(1e-9));
    }

    @Test
    @DisplayName("Cost outcomes follow the (competitor bid, own bid) pair")
    void dependentOutcomes() {
        Map<List<String>, List<Double>> table = new LinkedHashMap<>();
        table.put(List.of("low", "low"), List.of(170.0, 350.0, 550.0));
        table.put(List.of("medium", "low"), List.of(200.0, 400.0, 600.0));
        table.put(List.of("high", "low"), List.of(230.0, 450.0, 650.0));
        table.put(List.of("low", "high"), List.of(180.0, 380.0, 580.0));
        table.put(List.of("medium", "high"), List.of(210.0, 410.0, 610.0));
        table.put(List.of("high", "high"), List.of(240.0, 440.0, 640.0));
        VariableRegistry registry = ExampleTrees.bid().dependentOutcomes("cost", List.of("compbid", "bid"), table);

        DecisionTree tree = new DecisionTree(registry);

        assertThat(childValues(tree, 2)).containsExactly(170.0, 350.0, 550.0);
        assertThat(childValues(tree, 19)).containsExactly(210.0, 410.0, 610.0);

        tree.evaluate();
        assertThat(tree.rollback()).isCloseTo(58.25, within(1e-9));
        assertThat(tree.getNode(14).getExpectedValue()).isCloseTo(39.0, within(1e-9));
    }

    @Test
    @DisplayName("Paths without a matching entry keep the declared values")
    void partialTable() {
        VariableRegistry registry = ExampleTrees.bid()
                .dependentOutcomes(
                        "cost", List.of("compbid", "bid"), Map.of(List.of("medium", "low"), List.of(100.0, 300.0, 500.0)));

        DecisionTree tree = new DecisionTree(registry);

        assertThat(childValues(tree, 6)).containsExactly(100.0, 300.0, 500.0);
        assertThat(childValues(tree, 10)).containsExactly(200.0, 400.0, 600.0);

        tree.evaluate();
        assertThat(tree.rollback()).isCloseTo(115.0, within(1e-9));
    }

    @Test
    @DisplayName("Oil well probabilities follow the seismic result only below the test branch")
    void oilPosteriorsOnlyAfterTest() {
        DecisionTree tree = new DecisionTree(ExampleTrees.oil());

        // node 3: oil_found after ind-dry; node 21: oil_found without testing
        assertThat(childProbabilities(tree, 3)).containsExactly(0.7895, 0.1579, 0.0526);
        assertThat(childProbabilities(tree, 21)).containsExactly(0.38, 0.39, 0.23);
    }

    private List<Double> childProbabilities(DecisionTree tree, int index) {
        return tree.getNode(index).getSuccessors().stream()
                .map(child -> tree.getNode(child).getTagProb())
                .toList();
    }

    private List<Double> childValues(DecisionTree tree, int index) {
        TreeNode node = tree.getNode(index);
        return node.getSuccessors().stream()
                .map(child -> tree.getNode(child).getTagValue())
                .toList();
    }
}
