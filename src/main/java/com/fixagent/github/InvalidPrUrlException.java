package com.fixagent.github;

/**
 * Thrown when a URL is not of the form {@code github.com/<owner>/<repo>/pull/<n>}.
 */
public class InvalidPrUrlException extends IllegalArgumentException {

    public InvalidPrUrlException(String prUrl) {
        super("Invalid GitHub PR URL: " + prUrl);
    }
}
