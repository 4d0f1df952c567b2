package com.modelgate.registry;

import com.modelgate.ModelGateException;

public class RegistryUnavailableException extends ModelGateException {
    public RegistryUnavailableException(String message) {
        super(message);
    }

    public RegistryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
