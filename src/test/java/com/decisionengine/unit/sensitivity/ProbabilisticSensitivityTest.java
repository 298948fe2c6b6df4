package com.decisionengine.unit.sensitivity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.decisionengine.domain.model.SensitivityRow;
import com.decisionengine.domain.model.SensitivityTable;
import com.decisionengine.exception.BusinessException;
import com.decisionengine.exception.InvalidSensitivityTargetException;
import com.decisionengine.tree.DecisionTree;
import com.decisionengine.unit.support.ExampleTrees;
import com.decisionengine.variable.Branch;
import com.decisionengine.variable.VariableRegistry;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ProbabilisticSensitivityTest {

    private static final double EPS = 1e-9;

    @Nested
    @DisplayName("Sweep results")
    class Results {

        @Test
        @DisplayName("21 samples from 0 to 1, one series per bid")
        void shape() {
            DecisionTree tree = new DecisionTree(ExampleTrees.bid());

            SensitivityTable table = tree.probabilisticSensitivity("cost");

            assertThat(table.getParameter()).isEqualTo("probability");
            assertThat(table.getSeries()).containsExactly("low", "high");
            assertThat(table.getRows()).hasSize(21);
            assertThat(table.inputs().get(0)).isEqualTo(0.0);
            assertThat(table.inputs().get(20)).isEqualTo(1.0);
            assertThat(table.getRows()).extracting(SensitivityRow::label).contains("0.0", "0.25", "1.0");
        }

        @Test
        @DisplayName("Endpoints match forcing the highest and lowest cost")
        void endpointsMatchForcedBranches() {
            DecisionTree tree = new DecisionTree(ExampleTrees.bid());

            SensitivityTable table = tree.probabilisticSensitivity("cost");

            // p = 0: all mass on cost 600
            SensitivityRow first = table.getRows().get(0);
            assertThat(first.values().get("low")).isCloseTo(-65.0, within(EPS));
            assertThat(first.values().get("high")).isCloseTo(15.0, within(EPS));
            assertThat(forcedRootValue("high")).isCloseTo(15.0, within(EPS));

            // p = 1: all mass on cost 200
            SensitivityRow last = table.getRows().get(20);
            assertThat(last.values().get("low")).isCloseTo(195.0, within(EPS));
            assertThat(last.values().get("high")).isCloseTo(75.0, within(EPS));
            assertThat(forcedRootValue("low")).isCloseTo(195.0, within(EPS));
        }

        @Test
        @DisplayName("Intermediate samples interpolate linearly")
        void intermediateSamples() {
            DecisionTree tree = new DecisionTree(ExampleTrees.bid());

            SensitivityTable table = tree.probabilisticSensitivity("cost");

            assertThat(table.getRows().get(5).values().get("low")).isCloseTo(0.0, within(EPS));
            assertThat(table.getRows().get(5).values().get("high")).isCloseTo(30.0, within(EPS));
            assertThat(table.getRows().get(10).values().get("low")).isCloseTo(65.0, within(EPS));
            assertThat(table.getRows().get(10).values().get("high")).isCloseTo(45.0, within(EPS));
        }

        @Test
        @DisplayName("Chance root reports a single EV series")
        void chanceRootUsesEvSeries() {
            VariableRegistry registry = new VariableRegistry()
                    .chance("market", List.of(Branch.chance("up", 0.6, 100, "cost"), Branch.chance("down", 0.4, -50, "cost")))
                    .chance("cost", List.of(Branch.chance("low", 0.5, 10, "end"), Branch.chance("high", 0.5, 30, "end")))
                    .terminal("end");
            DecisionTree tree = new DecisionTree(registry);

            SensitivityTable table = tree.probabilisticSensitivity("cost", 3);

            // market contributes 40; cost moves from 30 (p = 0) to 10 (p = 1)
            assertThat(table.getSeries()).containsExactly("EV");
            assertThat(table.column("EV").stream().mapToDouble(Double::doubleValue).toArray())
                    .containsExactly(new double[] {70.0, 60.0, 50.0}, within(EPS));
        }

        private double forcedRootValue(String costBranch) {
            DecisionTree forced = new DecisionTree(ExampleTrees.bid());
            forced.forceBranch("cost", costBranch);
            forced.evaluate();
            return forced.rollback();
        }
    }

    @Nested
    @DisplayName("Restore")
    class Restore {

        @Test
        @DisplayName("Probabilities and rollback results are restored after the sweep")
        void restoresState() {
            DecisionTree tree = new DecisionTree(ExampleTrees.bid());
            tree.evaluate();
            tree.rollback();

            tree.probabilisticSensitivity("cost", 5);

            assertThat(tree.getRegistry().get("cost").getBranches()).extracting(Branch::getProbability)
                    .containsExactly(0.25, 0.50, 0.25);
            assertThat(tree.isRolledBack()).isTrue();
            assertThat(tree.getRoot().getExpectedValue()).isCloseTo(65.0, within(EPS));
        }

        @Test
        @DisplayName("A tree that was never evaluated stays unevaluated")
        void keepsPipelineStage() {
            DecisionTree tree = new DecisionTree(ExampleTrees.bid());

            tree.probabilisticSensitivity("cost", 3);

            assertThat(tree.isEvaluated()).isFalse();
            assertThat(tree.isRolledBack()).isFalse();
        }
    }

    @Nested
    @DisplayName("Invalid targets")
    class InvalidTargets {

        @Test
        @DisplayName("Decision variables are rejected")
        void decisionRejected() {
            DecisionTree tree = new DecisionTree(ExampleTrees.bid());

            assertThatThrownBy(() -> tree.probabilisticSensitivity("bid"))
                    .isInstanceOf(InvalidSensitivityTargetException.class)
                    .hasMessageContaining("CHANCE");
        }

        @Test
        @DisplayName("Variables with dependent probabilities are rejected")
        void dependentProbabilitiesRejected() {
            DecisionTree tree = new DecisionTree(ExampleTrees.oil());

            assertThatThrownBy(() -> tree.probabilisticSensitivity("oil_found"))
                    .isInstanceOf(InvalidSensitivityTargetException.class)
                    .hasMessageContaining("dependency table");
        }

        @Test
        @DisplayName("Variables whose branches share one value are rejected")
        void flatValuesRejected() {
            VariableRegistry registry = new VariableRegistry()
                    .chance("coin", List.of(Branch.chance("heads", 0.5, 1, "end"), Branch.chance("tails", 0.5, 1, "end")))
                    .terminal("end");
            DecisionTree tree = new DecisionTree(registry);

            assertThatThrownBy(() -> tree.probabilisticSensitivity("coin"))
                    .isInstanceOf(InvalidSensitivityTargetException.class);
        }

        @Test
        @DisplayName("Fewer than two points are rejected")
        void tooFewPoints() {
            DecisionTree tree = new DecisionTree(ExampleTrees.bid());

            assertThatThrownBy(() -> tree.probabilisticSensitivity("cost", 1)).isInstanceOf(BusinessException.class);
        }
    }
}
