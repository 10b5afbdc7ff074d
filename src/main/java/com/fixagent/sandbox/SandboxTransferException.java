package com.fixagent.sandbox;

/**
 * Thrown when a file cannot be copied across the sandbox boundary.
 */
public class SandboxTransferException extends RuntimeException {
    public SandboxTransferException(String message, Throwable cause) {
        super(message, cause);
    }
}
