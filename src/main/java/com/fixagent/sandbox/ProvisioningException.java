package com.fixagent.sandbox;

import com.fixagent.core.model.ClassifiedFailure;
import com.fixagent.core.model.FailureKind;

/**
 * Thrown when a sandbox cannot be created or started.
 */
public class ProvisioningException extends RuntimeException implements ClassifiedFailure {
    public ProvisioningException(String message) {
        super(message);
    }

    public ProvisioningException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind failureKind() {
        return FailureKind.PROVISIONING;
    }
}
