package com.modelgate.promotion;

import com.modelgate.ModelGateException;

/**
 * The registry accepted a promotion but does not report the promoted version as production afterwards.
 */
public class RegistryConsistencyException extends ModelGateException {
    public RegistryConsistencyException(String message) {
        super(message);
    }
}
