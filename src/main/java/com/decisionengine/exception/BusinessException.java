package com.decisionengine.exception;

/**
 * Rejected engine call that has no dedicated exception type: bad arguments, failing payoff
 * expressions, unknown branches.
 */
public class BusinessException extends BaseException {

    public BusinessException(String message) {
        super(ErrorCode.INVALID_ARGUMENT, message);
    }

    public BusinessException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public BusinessException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
