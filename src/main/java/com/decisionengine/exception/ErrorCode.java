package com.decisionengine.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    INVALID_ARGUMENT("INVALID_ARGUMENT", 400),
    NOT_FOUND("NOT_FOUND", 404),
    INVALID_TREE_STATE("INVALID_TREE_STATE", 409),
    MALFORMED_DECLARATION("MALFORMED_DECLARATION", 422),
    UNKNOWN_VARIABLE("UNKNOWN_VARIABLE", 422),
    CYCLIC_REGISTRY("CYCLIC_REGISTRY", 422),
    INVALID_SENSITIVITY_TARGET("INVALID_SENSITIVITY_TARGET", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500);

    private final String code;
    private final int httpStatus;
}
