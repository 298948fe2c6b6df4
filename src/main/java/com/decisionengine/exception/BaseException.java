package com.decisionengine.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

/**
 * Root of the engine's failures. The {@link ErrorCode} fixes the HTTP status of an API error;
 * {@code details} becomes {@code error.details} and always carries {@code variable} when the
 * failure concerns one registry variable.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final String variableName;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        this(errorCode, null, message, Map.of(), null);
    }

    protected BaseException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, null, message, Map.of(), cause);
    }

    protected BaseException(ErrorCode errorCode, String variableName, String message, Map<String, Object> details) {
        this(errorCode, variableName, message, details, null);
    }

    protected BaseException(
            ErrorCode errorCode, String variableName, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.variableName = variableName;
        Map<String, Object> merged = new LinkedHashMap<>();
        if (variableName != null) {
            merged.put("variable", variableName);
        }
        if (details != null) {
            merged.putAll(details);
        }
        this.details = Collections.unmodifiableMap(merged);
    }

    public boolean concernsVariable() {
        return variableName != null;
    }
}
