package com.decisionengine.api.dto.request;

import com.decisionengine.domain.enums.ProbabilityMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A complete variable registry. The tree is rooted at {@code root}, or at the first
 * variable when it is omitted.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TreeDefinitionRequest {

    @NotEmpty
    @Valid
    private List<VariableRequest> variables;

    @Valid
    private List<DependencyRequest> dependencies;

    private String root;

    // falls back to decision-engine.probability-mode
    private ProbabilityMode probabilityMode;
}
