package com.decisionengine.unit.tree;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.decisionengine.domain.enums.RollbackView;
import com.decisionengine.domain.enums.UtilityFunction;
import com.decisionengine.exception.ErrorCode;
import com.decisionengine.exception.TreeStateException;
import com.decisionengine.tree.DecisionTree;
import com.decisionengine.unit.support.ExampleTrees;
import com.decisionengine.variable.VariableRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Pipeline ordering and registry isolation of {@link DecisionTree}.
 */
class DecisionTreeTest {

    @Nested
    @DisplayName("Pipeline state")
    class PipelineState {

        @Test
        @DisplayName("Rollback before evaluate fails with INVALID_TREE_STATE")
        void rollbackBeforeEvaluate() {
            DecisionTree tree = new DecisionTree(ExampleTrees.bid());

            assertThatThrownBy(tree::rollback)
                    .isInstanceOfSatisfying(TreeStateException.class, ex -> assertThat(ex.getErrorCode())
                            .isEqualTo(ErrorCode.INVALID_TREE_STATE))
                    .hasMessageContaining("evaluate()");
        }

        @Test
        @DisplayName("Optimal path before rollback fails")
        void optimalPathBeforeRollback() {
            DecisionTree tree = new DecisionTree(ExampleTrees.bid());
            tree.evaluate();

            assertThatThrownBy(tree::getOptimalPath).isInstanceOf(TreeStateException.class);
        }

        @Test
        @DisplayName("Rebuild discards evaluation and rollback")
        void rebuildResets() {
            DecisionTree tree = new DecisionTree(ExampleTrees.bid());
            tree.evaluate();
            tree.rollback();

            tree.rebuild();

            assertThat(tree.isEvaluated()).isFalse();
            assertThat(tree.isRolledBack()).isFalse();
            assertThat(tree.getRoot().getExpectedValue()).isNull();
        }

        @Test
        @DisplayName("Re-evaluating requires a fresh rollback")
        void evaluateResetsRollback() {
            DecisionTree tree = new DecisionTree(ExampleTrees.bid());
            tree.evaluate();
            tree.rollback();

            tree.evaluate();

            assertThat(tree.isRolledBack()).isFalse();
        }

        @Test
        @DisplayName("Forcing a branch rebuilds the tree")
        void forceRebuilds() {
            DecisionTree tree = new DecisionTree(ExampleTrees.bid());
            tree.evaluate();

            tree.forceBranch("compbid", "medium");

            assertThat(tree.isEvaluated()).isFalse();
            assertThat(tree.getNode(1).getForcedBranch()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("Default root is the first registered variable")
        void defaultRoot() {
            DecisionTree tree = new DecisionTree(ExampleTrees.oil());

            assertThat(tree.getRootName()).isEqualTo("test_decision");
            assertThat(tree.size()).isEqualTo(26);
        }

        @Test
        @DisplayName("Later changes to the caller's registry do not reach the tree")
        void registryCopied() {
            VariableRegistry registry = ExampleTrees.bid();
            DecisionTree tree = new DecisionTree(registry);

            registry.setBranchValue("cost", "low", 0);
            tree.rebuild();
            tree.evaluate();

            assertThat(tree.rollback()).isCloseTo(65.0, within(1e-9));
        }

        @Test
        @DisplayName("Node list is read-only")
        void nodesReadOnly() {
            DecisionTree tree = new DecisionTree(ExampleTrees.bid());

            assertThatThrownBy(() -> tree.getNodes().clear()).isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    @DisplayName("Rollback views")
    class Views {

        @Test
        @DisplayName("EV view with an active utility still returns the expected value")
        void evViewWithUtility() {
            DecisionTree tree = new DecisionTree(ExampleTrees.bid());
            tree.evaluate();

            double value = tree.rollback(RollbackView.EV, UtilityFunction.EXP, 750);

            assertThat(value).isCloseTo(65.0, within(1e-9));
            assertThat(tree.getRoot().getCertaintyEquivalent()).isNotNull();
        }

        @Test
        @DisplayName("Optimal path of the bid example is root then the bid-500 chance node")
        void bidOptimalPath() {
            DecisionTree tree = new DecisionTree(ExampleTrees.bid());
            tree.evaluate();
            tree.rollback();

            assertThat(tree.getOptimalPath()).containsExactly(0, 1);
        }
    }
}
