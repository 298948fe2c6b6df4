package com.decisionengine.api.dto.response;

import com.decisionengine.domain.model.RiskProfilePoint;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RiskProfileSeriesResponse {

    private int nodeIndex;
    private String branch;
    private Double branchValue;
    private double expectedValue;
    private double totalProbability;
    private List<RiskProfilePoint> points;
}
