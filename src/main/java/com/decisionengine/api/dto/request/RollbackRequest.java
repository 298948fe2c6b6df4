package com.decisionengine.api.dto.request;

import com.decisionengine.domain.enums.RollbackView;
import com.decisionengine.domain.enums.UtilityFunction;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Evaluates and rolls back a tree. Without a utility function the rollback is risk neutral
 * and the view is always EV.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RollbackRequest {

    @NotNull
    @Valid
    private TreeDefinitionRequest tree;

    private RollbackView view;

    private UtilityFunction utilityFunction;

    private Double riskTolerance;
}
