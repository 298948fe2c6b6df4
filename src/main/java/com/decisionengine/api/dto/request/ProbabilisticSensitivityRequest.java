package com.decisionengine.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
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
public class ProbabilisticSensitivityRequest {

    @NotNull
    @Valid
    private TreeDefinitionRequest tree;

    @NotBlank
    private String variable;

    @Min(2)
    private Integer points;
}
