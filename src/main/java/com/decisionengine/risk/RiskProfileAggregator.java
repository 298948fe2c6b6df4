package com.decisionengine.risk;

import com.decisionengine.domain.model.RiskProfilePoint;
import com.decisionengine.domain.model.RiskProfileReport;
import com.decisionengine.domain.model.RiskProfileSeries;
import com.decisionengine.domain.model.TreeNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds outcome distributions ("risk profiles") along the optimal strategy.
 *
 * <p>Children are aggregated before parents:
 * <ul>
 *   <li>TERMINAL: {EV: 1.0}</li>
 *   <li>CHANCE: children's distributions weighted by branch probability, summing
 *       probabilities of identical outcomes; a forced CHANCE copies its forced child</li>
 *   <li>DECISION: copies the distribution of its optimal successor; the other branches
 *       contribute nothing</li>
 * </ul>
 *
 * <p>Requires a completed rollback (optimal successors set).
 */
public class RiskProfileAggregator {

    public void aggregate(List<TreeNode> nodes) {
        for (int i = nodes.size() - 1; i >= 0; i--) {
            TreeNode node = nodes.get(i);
            Map<Double, Double> profile = new TreeMap<>();

            if (node.isTerminal()) {
                // -0.0 and 0.0 are distinct TreeMap keys
                profile.put(node.getExpectedValue() + 0.0, 1.0);
            } else if (node.isDecision() || node.isForced()) {
                profile.putAll(nodes.get(node.getOptimalSuccessor()).getRiskProfile());
            } else {
                for (Integer successor : node.getSuccessors()) {
                    TreeNode child = nodes.get(successor);
                    double probability = child.getTagProb();
                    child.getRiskProfile().forEach((value, childProbability) ->
                            profile.merge(value, probability * childProbability, Double::sum));
                }
            }
            node.setRiskProfile(Collections.unmodifiableMap(profile));
        }
    }

    /**
     * Builds the report for {@code nodeIndex} from already aggregated profiles.
     *
     * @param single     one series for the node itself; otherwise one per successor
     * @param cumulative replace probabilities by their running sums
     */
    public RiskProfileReport report(List<TreeNode> nodes, int nodeIndex, boolean cumulative, boolean single) {
        TreeNode node = nodes.get(nodeIndex);
        List<RiskProfileSeries> series = new ArrayList<>();
        if (single || !node.hasSuccessors()) {
            series.add(toSeries(node, cumulative));
        } else {
            for (Integer successor : node.getSuccessors()) {
                series.add(toSeries(nodes.get(successor), cumulative));
            }
        }
        return RiskProfileReport.builder()
                .nodeIndex(nodeIndex)
                .cumulative(cumulative)
                .single(single)
                .series(List.copyOf(series))
                .build();
    }

    private RiskProfileSeries toSeries(TreeNode node, boolean cumulative) {
        List<RiskProfilePoint> points = new ArrayList<>();
        double running = 0.0;
        // TreeMap iteration is ascending by outcome value
        for (Map.Entry<Double, Double> entry : node.getRiskProfile().entrySet()) {
            running += entry.getValue();
            points.add(new RiskProfilePoint(entry.getKey(), cumulative ? running : entry.getValue()));
        }
        return RiskProfileSeries.builder()
                .nodeIndex(node.getIndex())
                .branch(node.getTagBranch())
                .branchValue(node.getTagValue())
                .expectedValue(node.getExpectedValue())
                .cumulative(cumulative)
                .points(List.copyOf(points))
                .build();
    }
}
