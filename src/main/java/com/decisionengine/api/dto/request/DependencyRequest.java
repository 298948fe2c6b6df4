package com.decisionengine.api.dto.request;

import com.decisionengine.variable.DependentTable;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Makes the probabilities or outcome values of {@code variable} depend on the branches
 * taken at the {@code dependsOn} variables.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DependencyRequest {

    @NotBlank
    private String variable;

    @NotNull
    private DependentTable.Target target;

    @NotEmpty
    private List<String> dependsOn;

    @NotEmpty
    @Valid
    private List<Entry> entries;

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Entry {

        /** Branch names taken at the {@code dependsOn} variables, in the same order. */
        @NotEmpty
        private List<String> key;

        /** One probability or outcome value per branch of the variable. */
        @NotEmpty
        private List<@NotNull Double> values;
    }
}
