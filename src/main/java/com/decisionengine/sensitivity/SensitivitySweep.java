package com.decisionengine.sensitivity;

import com.decisionengine.domain.model.SensitivityRow;
import com.decisionengine.domain.model.TreeNode;
import com.decisionengine.exception.BusinessException;
import com.decisionengine.tree.DecisionTree;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Shared plumbing of the sensitivity drivers: sample grids, series naming and the
 * per-sample readout of root-level values.
 */
public abstract class SensitivitySweep {

    /** Series name used when the root has no decision branches to split on. */
    public static final String EV_SERIES = "EV";

    /**
     * {@code n} evenly spaced samples from {@code start} to {@code stop}, both included.
     */
    static List<Double> linspace(double start, double stop, int n) {
        if (n < 2) {
            throw new BusinessException("A sweep needs at least 2 points, got " + n);
        }
        List<Double> samples = new ArrayList<>(n);
        double step = (stop - start) / (n - 1);
        for (int i = 0; i < n - 1; i++) {
            samples.add(start + i * step);
        }
        samples.add(stop);
        return samples;
    }

    /**
     * Root branch names for a DECISION root, otherwise the single {@value #EV_SERIES} series.
     */
    static List<String> rootSeries(DecisionTree tree) {
        TreeNode root = tree.getRoot();
        if (!root.isDecision()) {
            return List.of(EV_SERIES);
        }
        return branchSeries(tree);
    }

    /**
     * Root branch names regardless of the root's kind; {@value #EV_SERIES} for a terminal root.
     */
    static List<String> branchSeries(DecisionTree tree) {
        TreeNode root = tree.getRoot();
        if (!root.hasSuccessors()) {
            return List.of(EV_SERIES);
        }
        return root.getSuccessors().stream()
                .map(index -> tree.getNode(index).getTagBranch())
                .toList();
    }

    /**
     * Reads one value per series off the current rollback: the root itself for
     * {@value #EV_SERIES}, otherwise the root's successors in branch order.
     */
    static Map<String, Double> readSeries(
            DecisionTree tree, List<String> series, Function<TreeNode, Double> readout) {
        Map<String, Double> values = new LinkedHashMap<>();
        if (series.size() == 1 && EV_SERIES.equals(series.get(0))) {
            values.put(EV_SERIES, readout.apply(tree.getRoot()));
            return Collections.unmodifiableMap(values);
        }
        List<Integer> successors = tree.getRoot().getSuccessors();
        for (int i = 0; i < series.size(); i++) {
            values.put(series.get(i), readout.apply(tree.getNode(successors.get(i))));
        }
        return Collections.unmodifiableMap(values);
    }

    static SensitivityRow row(double input, String label, Map<String, Double> values) {
        return new SensitivityRow(input, label, values);
    }
}
