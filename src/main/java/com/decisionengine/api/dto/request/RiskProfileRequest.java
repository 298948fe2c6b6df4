package com.decisionengine.api.dto.request;

import com.decisionengine.domain.enums.UtilityFunction;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
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
public class RiskProfileRequest {

    @NotNull
    @Valid
    private TreeDefinitionRequest tree;

    // root when absent
    @Min(0)
    private Integer nodeIndex;

    private Boolean cumulative;

    // true: one series for the node; false (the default): one per successor
    private Boolean single;

    // strategy used to pick decisions; risk neutral when absent
    private UtilityFunction utilityFunction;

    private Double riskTolerance;
}
