package com.decisionengine.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * Outcome distribution reachable from one node under the optimal strategy.
 */
@Getter
@Builder
public class RiskProfileSeries {

    private final int nodeIndex;

    /** Branch that leads to the node; null for the root. */
    private final String branch;

    /** Outcome value of that branch; null for the root. */
    private final Double branchValue;

    private final double expectedValue;
    private final boolean cumulative;

    /** Points sorted by ascending outcome value. */
    private final List<RiskProfilePoint> points;

    public double totalProbability() {
        if (cumulative) {
            return points.isEmpty() ? 0.0 : points.get(points.size() - 1).probability();
        }
        return points.stream().mapToDouble(RiskProfilePoint::probability).sum();
    }
}
