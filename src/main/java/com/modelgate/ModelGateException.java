package com.modelgate;

/**
 * Base type for failures that abort a promotion run before it can reach a decision or finish its mutation.
 * Rejection of a candidate is an outcome, not one of these.
 */
public class ModelGateException extends RuntimeException {
    public ModelGateException(String message) {
        super(message);
    }

    public ModelGateException(String message, Throwable cause) {
        super(message, cause);
    }
}
