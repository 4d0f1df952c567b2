package com.modelgate.audit;

import com.modelgate.ModelGateException;

public class AuditException extends ModelGateException {
    public AuditException(String message, Throwable cause) {
        super(message, cause);
    }
}
