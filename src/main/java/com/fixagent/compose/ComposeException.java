package com.fixagent.compose;

/**
 * Thrown when a compose task cannot be located or {@code docker compose} cannot be launched.
 */
public class ComposeException extends RuntimeException {

    public ComposeException(String message) {
        super(message);
    }

    public ComposeException(String message, Throwable cause) {
        super(message, cause);
    }
}
