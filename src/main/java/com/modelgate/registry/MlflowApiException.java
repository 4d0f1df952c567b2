package com.modelgate.registry;

import com.modelgate.ModelGateException;

/**
 * MLflow answered, but refused the request.
 */
public class MlflowApiException extends ModelGateException {
    private final int statusCode;
    private final String errorCode;

    public MlflowApiException(int statusCode, String errorCode, String message) {
        super("MLflow request failed status=" + statusCode + " error=" + errorCode + ": " + message);
        this.statusCode = statusCode;
        this.errorCode = errorCode;
    }

    public int statusCode() {
        return statusCode;
    }

    public String errorCode() {
        return errorCode;
    }
}
