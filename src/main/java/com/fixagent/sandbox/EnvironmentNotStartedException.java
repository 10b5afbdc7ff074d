package com.fixagent.sandbox;

/**
 * Thrown when a sandbox operation is attempted before {@code start} or after {@code stop}.
 */
public class EnvironmentNotStartedException extends IllegalStateException {
    public EnvironmentNotStartedException(String sandboxName) {
        super("Sandbox " + sandboxName + " not started");
    }
}
