package com.decisionengine.exception;

/**
 * Raised when a pipeline step is invoked before the step it depends on, e.g. a rollback
 * on a tree whose terminal payoffs have not been evaluated.
 */
public class TreeStateException extends BaseException {

    public TreeStateException(String message) {
        super(ErrorCode.INVALID_TREE_STATE, message);
    }
}
