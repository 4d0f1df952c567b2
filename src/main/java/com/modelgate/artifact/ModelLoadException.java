package com.modelgate.artifact;

import com.modelgate.ModelGateException;

public class ModelLoadException extends ModelGateException {
    public ModelLoadException(String message) {
        super(message);
    }

    public ModelLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
