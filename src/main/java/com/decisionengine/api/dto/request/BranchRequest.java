package com.decisionengine.api.dto.request;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One branch of a variable. {@code probability} is required on CHANCE variables and must
 * be absent on DECISION variables; the registry reports the mismatch.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BranchRequest {

    @NotBlank
    private String name;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double probability;

    @NotNull
    private Double value;

    @NotBlank
    private String successor;
}
