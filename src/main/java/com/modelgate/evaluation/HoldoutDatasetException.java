package com.modelgate.evaluation;

import com.modelgate.ModelGateException;

public class HoldoutDatasetException extends ModelGateException {
    public HoldoutDatasetException(String message) {
        super(message);
    }

    public HoldoutDatasetException(String message, Throwable cause) {
        super(message, cause);
    }
}
