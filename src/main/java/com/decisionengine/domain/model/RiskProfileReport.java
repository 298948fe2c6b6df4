package com.decisionengine.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * Result of a risk-profile request: a single series for the requested node, or one series
 * per successor when the request is split by branch.
 */
@Getter
@Builder
public class RiskProfileReport {

    private final int nodeIndex;
    private final boolean cumulative;
    private final boolean single;
    private final List<RiskProfileSeries> series;
}
