package com.decisionengine.tree;

import com.decisionengine.domain.enums.RollbackView;
import com.decisionengine.domain.enums.UtilityFunction;
import com.decisionengine.domain.model.RiskProfileReport;
import com.decisionengine.domain.model.SensitivityTable;
import com.decisionengine.domain.model.TreeNode;
import com.decisionengine.exception.BusinessException;
import com.decisionengine.exception.TreeStateException;
import com.decisionengine.risk.RiskProfileAggregator;
import com.decisionengine.rollback.RollbackEngine;
import com.decisionengine.sensitivity.ProbabilisticSensitivity;
import com.decisionengine.sensitivity.RiskSensitivity;
import com.decisionengine.sensitivity.ValueSensitivity;
import com.decisionengine.variable.VariableRegistry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A decision tree unfolded from a private copy of a {@link VariableRegistry}.
 *
 * <p>Pipeline, each step requiring the previous one:
 * <ol>
 *   <li>{@link #rebuild()}: unfold the registry, tag branches, apply dependent tables
 *       (runs on construction and after every registry change)</li>
 *   <li>{@link #evaluate()}: accumulate path contexts and compute terminal payoffs</li>
 *   <li>{@link #rollback(RollbackView, UtilityFunction, double)}: expected values, optimal
 *       strategy, path probabilities, utilities</li>
 *   <li>{@link #riskProfile(int, boolean, boolean)}: outcome distributions</li>
 * </ol>
 * Calling a step out of order raises {@link TreeStateException}; a rebuild invalidates
 * every computed field.
 *
 * <p>The registry passed in is deep-copied, so forced branches and sensitivity sweeps on
 * this tree never affect the caller's registry. Sensitivity sweeps restore this tree's
 * own registry and computed state when they finish.
 *
 * <p><b>Thread safety:</b> none. One tree must not be used by two threads at once;
 * independent trees share nothing mutable.
 */
public class DecisionTree {

    private static final Logger log = LoggerFactory.getLogger(DecisionTree.class);

    private final TreeBuilder treeBuilder = new TreeBuilder();
    private final TagPropagator tagPropagator = new TagPropagator();
    private final DependentValueApplier dependentValueApplier = new DependentValueApplier();
    private final PayoffEvaluator payoffEvaluator = new PayoffEvaluator();
    private final RollbackEngine rollbackEngine = new RollbackEngine();
    private final RiskProfileAggregator riskProfileAggregator = new RiskProfileAggregator();

    private final String rootName;
    private VariableRegistry registry;
    private List<TreeNode> nodes = List.of();

    private boolean evaluated;
    private RollbackSettings lastRollback;

    /** Rollback arguments of the most recent rollback, replayed after a sensitivity sweep. */
    private record RollbackSettings(RollbackView view, UtilityFunction utilityFunction, double riskTolerance) {}

    /**
     * Builds a tree rooted at the first variable registered.
     */
    public DecisionTree(VariableRegistry registry) {
        this(registry, registry.getInitialVariable());
    }

    public DecisionTree(VariableRegistry registry, String rootName) {
        this.registry = registry.copy();
        this.rootName = rootName;
        rebuild();
    }

    // ==================== Pipeline ====================

    /**
     * Re-unfolds the tree from the current registry. Discards every computed field.
     */
    public void rebuild() {
        List<TreeNode> built = treeBuilder.build(registry, rootName);
        tagPropagator.propagate(built, registry);
        dependentValueApplier.apply(built, registry);
        this.nodes = built;
        this.evaluated = false;
        this.lastRollback = null;
    }

    /**
     * Computes the payoff of every terminal node.
     */
    public void evaluate() {
        payoffEvaluator.evaluate(nodes, registry);
        evaluated = true;
        lastRollback = null;
    }

    /**
     * Risk-neutral rollback returning the root expected value.
     */
    public double rollback() {
        return rollback(RollbackView.EV, UtilityFunction.NONE, 0.0);
    }

    /**
     * Backward induction over the evaluated tree.
     *
     * @param view            root quantity to return; EU and CE fall back to EV without a utility function
     * @param utilityFunction risk-attitude transform, NONE for risk-neutral
     * @param riskTolerance   the utility function's rho; ignored for NONE
     * @return the root's EV, EU or CE
     */
    public double rollback(RollbackView view, UtilityFunction utilityFunction, double riskTolerance) {
        requireEvaluated("rollback");
        UtilityFunction utility = utilityFunction != null ? utilityFunction : UtilityFunction.NONE;
        rollbackEngine.rollback(nodes, utility, riskTolerance);
        lastRollback = new RollbackSettings(view, utility, riskTolerance);

        TreeNode root = nodes.get(0);
        log.debug("Rolled back '{}' ({} nodes, utility {}): EV={}", rootName, nodes.size(), utility, root.getExpectedValue());
        if (!utility.isActive() || view == null || view == RollbackView.EV) {
            return root.getExpectedValue();
        }
        return view == RollbackView.EU ? root.getExpectedUtility() : root.getCertaintyEquivalent();
    }

    /**
     * Distribution of final payoffs from a node under the optimal strategy.
     *
     * @param nodeIndex  node to profile
     * @param cumulative return running sums instead of point probabilities
     * @param single     one series for the node, or one per successor when false
     */
    public RiskProfileReport riskProfile(int nodeIndex, boolean cumulative, boolean single) {
        requireRolledBack("risk profile");
        if (nodeIndex < 0 || nodeIndex >= nodes.size()) {
            throw new BusinessException(String.format("Node index %d out of range [0, %d)", nodeIndex, nodes.size()));
        }
        riskProfileAggregator.aggregate(nodes);
        return riskProfileAggregator.report(nodes, nodeIndex, cumulative, single);
    }

    // ==================== Forced branches ====================

    /**
     * Pins a variable to one branch in every node unfolded from it, then rebuilds.
     */
    public void forceBranch(String variable, String branchName) {
        registry.forceBranch(variable, branchName);
        rebuild();
    }

    public void clearForcedBranch(String variable) {
        registry.clearForcedBranch(variable);
        rebuild();
    }

    // ==================== Sensitivity ====================

    public SensitivityTable probabilisticSensitivity(String variable) {
        return new ProbabilisticSensitivity().run(this, variable, ProbabilisticSensitivity.DEFAULT_POINTS);
    }

    public SensitivityTable probabilisticSensitivity(String variable, int points) {
        return new ProbabilisticSensitivity().run(this, variable, points);
    }

    public SensitivityTable valueSensitivity(String variable, String branch, double minValue, double maxValue) {
        return new ValueSensitivity()
                .run(this, variable, branch, minValue, maxValue, ValueSensitivity.DEFAULT_POINTS);
    }

    public SensitivityTable valueSensitivity(
            String variable, String branch, double minValue, double maxValue, int points) {
        return new ValueSensitivity().run(this, variable, branch, minValue, maxValue, points);
    }

    public SensitivityTable riskSensitivity(UtilityFunction utilityFunction, double riskTolerance) {
        return new RiskSensitivity().run(this, utilityFunction, riskTolerance, RiskSensitivity.DEFAULT_POINTS);
    }

    public SensitivityTable riskSensitivity(UtilityFunction utilityFunction, double riskTolerance, int points) {
        return new RiskSensitivity().run(this, utilityFunction, riskTolerance, points);
    }

    /**
     * Runs a sweep against this tree's registry, then restores the registry from a snapshot
     * taken beforehand, rebuilds, and replays the evaluate/rollback steps that had been run.
     * The restore happens even when the sweep fails.
     */
    public <T> T isolated(Supplier<T> sweep) {
        VariableRegistry snapshot = registry.copy();
        boolean wasEvaluated = evaluated;
        RollbackSettings previousRollback = lastRollback;
        try {
            return sweep.get();
        } finally {
            registry = snapshot;
            rebuild();
            if (wasEvaluated) {
                evaluate();
            }
            if (previousRollback != null) {
                rollback(previousRollback.view(), previousRollback.utilityFunction(), previousRollback.riskTolerance());
            }
            log.debug("Restored registry of tree '{}' after sweep", rootName);
        }
    }

    // ==================== Accessors ====================

    /**
     * The tree's own registry copy. Changes take effect on the next {@link #rebuild()}.
     */
    public VariableRegistry getRegistry() {
        return registry;
    }

    public String getRootName() {
        return rootName;
    }

    public List<TreeNode> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    public TreeNode getNode(int index) {
        return nodes.get(index);
    }

    public TreeNode getRoot() {
        return nodes.get(0);
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEvaluated() {
        return evaluated;
    }

    public boolean isRolledBack() {
        return lastRollback != null;
    }

    /**
     * Node indices followed from the root through decision choices and forced chance
     * branches. Stops at the first unforced chance node or terminal.
     */
    public List<Integer> getOptimalPath() {
        requireRolledBack("optimal path");
        List<Integer> path = new ArrayList<>();
        TreeNode node = nodes.get(0);
        path.add(node.getIndex());
        while (node.getOptimalSuccessor() != null) {
            node = nodes.get(node.getOptimalSuccessor());
            path.add(node.getIndex());
        }
        return path;
    }

    private void requireEvaluated(String step) {
        if (!evaluated) {
            throw new TreeStateException("Cannot run " + step + " before evaluate()");
        }
    }

    private void requireRolledBack(String step) {
        if (lastRollback == null) {
            throw new TreeStateException("Cannot compute " + step + " before rollback()");
        }
    }
}
