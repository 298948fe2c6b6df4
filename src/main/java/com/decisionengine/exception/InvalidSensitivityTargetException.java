package com.decisionengine.exception;

import java.util.Map;

public class InvalidSensitivityTargetException extends BaseException {

    public InvalidSensitivityTargetException(String variableName, String reason) {
        super(
                ErrorCode.INVALID_SENSITIVITY_TARGET,
                variableName,
                String.format("Cannot run sensitivity on '%s': %s", variableName, reason),
                Map.of("reason", reason));
    }
}
