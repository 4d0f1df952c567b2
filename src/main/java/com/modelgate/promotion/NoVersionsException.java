package com.modelgate.promotion;

import com.modelgate.ModelGateException;

public class NoVersionsException extends ModelGateException {
    public NoVersionsException(String modelName) {
        super("No versions found for '" + modelName + "'. Run the training stage first.");
    }
}
