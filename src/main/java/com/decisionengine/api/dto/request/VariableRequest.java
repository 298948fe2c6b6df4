package com.decisionengine.api.dto.request;

import com.decisionengine.domain.enums.VariableKind;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A variable declaration inside a {@link TreeDefinitionRequest}.
 *
 * <p>{@code payoff} is a SpEL expression evaluated at TERMINAL variables against
 * {@code #values}, {@code #probabilities} and {@code #branches}, e.g.
 * {@code "#values['bid'] < #values['compbid'] ? #values['bid'] - #values['cost'] : 0"}.
 * Omitted, the payoff is the sum of the values along the path.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VariableRequest {

    @NotBlank
    private String name;

    @NotNull
    private VariableKind kind;

    @Valid
    private List<BranchRequest> branches;

    // DECISION only; defaults to maximize
    private Boolean maximize;

    private String forcedBranch;

    private String payoff;
}
