package com.decisionengine.exception;

import java.util.Map;

public class UnknownVariableException extends BaseException {

    public UnknownVariableException(String variableName) {
        super(
                ErrorCode.UNKNOWN_VARIABLE,
                variableName,
                String.format("Variable not found in registry: %s", variableName),
                Map.of());
    }
}
