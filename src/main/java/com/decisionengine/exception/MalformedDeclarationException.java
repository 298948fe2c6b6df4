package com.decisionengine.exception;

import java.util.List;
import java.util.Map;
import lombok.Getter;

/**
 * Raised at registration time when a variable declaration is rejected. Every problem
 * found in the declaration is reported, not only the first one.
 */
@Getter
public class MalformedDeclarationException extends BaseException {

    private final List<String> violations;

    public MalformedDeclarationException(String variableName, List<String> violations) {
        super(
                ErrorCode.MALFORMED_DECLARATION,
                variableName,
                String.format("Variable '%s' is malformed: %s", variableName, String.join("; ", violations)),
                Map.of("violations", List.copyOf(violations)));
        this.violations = List.copyOf(violations);
    }

    public MalformedDeclarationException(String variableName, String violation) {
        this(variableName, List.of(violation));
    }
}
