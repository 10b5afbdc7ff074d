package com.fixagent.compose;

/**
 * Verification state of a compose task, as recorded in {@code logs/verifier/result.txt}.
 */
public enum ComposeTaskStatus {
    /** {@code result.txt} contains exactly {@code 1}. */
    VERIFIED,
    /** {@code result.txt} exists with any other content. */
    FAILED,
    /** No {@code result.txt} yet. */
    NOT_RUN
}
