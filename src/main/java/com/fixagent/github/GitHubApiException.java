package com.fixagent.github;

/**
 * Thrown when a GitHub REST call fails at the transport level or returns an error status.
 */
public class GitHubApiException extends RuntimeException {

    private final int statusCode;

    public GitHubApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public GitHubApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status, or -1 when the request never got a response. */
    public int getStatusCode() {
        return statusCode;
    }
}
