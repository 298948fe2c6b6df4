package com.decisionengine.api.dto.response;

import com.decisionengine.domain.enums.VariableKind;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One row of the node table returned by the rollback endpoint.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TreeNodeResponse {

    private int index;
    private String variableName;
    private VariableKind kind;
    private List<Integer> successors;
    private boolean forced;
    private String tagName;
    private String tagBranch;
    private Double tagValue;
    private Double tagProb;
    private Double expectedValue;
    private Double expectedUtility;
    private Double certaintyEquivalent;
    private Integer optimalSuccessor;
    private boolean optimalStrategy;
    private Double pathProbability;
}
