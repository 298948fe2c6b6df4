package com.decisionengine.sensitivity;

import com.decisionengine.domain.enums.RollbackView;
import com.decisionengine.domain.enums.UtilityFunction;
import com.decisionengine.domain.model.SensitivityRow;
import com.decisionengine.domain.model.SensitivityTable;
import com.decisionengine.domain.model.TreeNode;
import com.decisionengine.exception.BusinessException;
import com.decisionengine.tree.DecisionTree;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sweeps the risk-aversion coefficient {@code 1/rho} from 0 to {@code 1/rho0}.
 *
 * <p>Zero aversion is the risk-neutral case: the first row holds expected values and is
 * labelled "Infinity". Every other row rolls back with the utility function at
 * {@code rho = 1/aversion} and holds certainty equivalents, labelled with the rounded
 * risk tolerance. Values are reported per root branch.
 */
public class RiskSensitivity extends SensitivitySweep {

    private static final Logger log = LoggerFactory.getLogger(RiskSensitivity.class);

    public static final int DEFAULT_POINTS = 11;

    static final String INFINITE_TOLERANCE = "Infinity";

    public SensitivityTable run(DecisionTree tree, UtilityFunction utilityFunction, double riskTolerance, int points) {
        if (utilityFunction == null || !utilityFunction.isActive()) {
            throw new BusinessException("Risk sensitivity requires an EXP or LOG utility function");
        }
        if (!(riskTolerance > 0.0) || Double.isInfinite(riskTolerance)) {
            throw new BusinessException("Risk sensitivity requires a positive finite risk tolerance, got " + riskTolerance);
        }
        List<Double> aversions = linspace(0.0, 1.0 / riskTolerance, points);

        SensitivityTable table = tree.isolated(() -> sweep(tree, utilityFunction, aversions));
        log.info("Risk sensitivity ({}) down to risk tolerance {}: {} samples",
                utilityFunction, riskTolerance, aversions.size());
        return table;
    }

    private SensitivityTable sweep(DecisionTree tree, UtilityFunction utilityFunction, List<Double> aversions) {
        // payoffs do not depend on rho: evaluate once, roll back per sample
        tree.evaluate();
        List<String> series = branchSeries(tree);

        List<SensitivityRow> rows = new ArrayList<>(aversions.size());
        for (double aversion : aversions) {
            if (aversion == 0.0) {
                tree.rollback();
                rows.add(row(aversion, INFINITE_TOLERANCE, readSeries(tree, series, TreeNode::getExpectedValue)));
            } else {
                double rho = 1.0 / aversion;
                tree.rollback(RollbackView.CE, utilityFunction, rho);
                rows.add(row(aversion, String.valueOf(Math.round(rho)),
                        readSeries(tree, series, TreeNode::getCertaintyEquivalent)));
            }
        }
        return SensitivityTable.builder()
                .parameter("risk-aversion")
                .series(series)
                .rows(List.copyOf(rows))
                .build();
    }
}
