package com.modelgate.evaluation;

import com.modelgate.ModelGateException;

public class EvaluationException extends ModelGateException {
    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
