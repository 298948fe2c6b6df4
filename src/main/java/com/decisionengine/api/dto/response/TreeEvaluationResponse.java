package com.decisionengine.api.dto.response;

import com.decisionengine.domain.enums.RollbackView;
import com.decisionengine.domain.enums.UtilityFunction;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Result of {@code POST /api/decision-trees/rollback}: the root value under the requested
 * view, the optimal path and the full node table.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TreeEvaluationResponse {

    private String rootName;
    private RollbackView view;
    private UtilityFunction utilityFunction;
    private Double riskTolerance;
    private double rootValue;
    private double rootExpectedValue;
    private List<Integer> optimalPath;
    private int nodeCount;
    private List<TreeNodeResponse> nodes;
}
