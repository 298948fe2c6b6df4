package com.decisionengine.api.dto.request;

import com.decisionengine.domain.enums.UtilityFunction;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
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
public class RiskSensitivityRequest {

    @NotNull
    @Valid
    private TreeDefinitionRequest tree;

    @NotNull
    private UtilityFunction utilityFunction;

    @NotNull
    @Positive
    private Double riskTolerance;

    @Min(2)
    private Integer points;
}
