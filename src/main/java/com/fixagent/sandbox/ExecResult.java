package com.fixagent.sandbox;

/**
 * Outcome of a command run inside an {@link ExecutionEnvironment}.
 *
 * @param stdout      captured standard output
 * @param stderr      captured standard error, or the failure description for synthetic results
 * @param exitCode    process exit code (0 = success)
 * @param durationSec wall-clock time of the call
 */
public record ExecResult(
    String stdout,
    String stderr,
    int exitCode,
    double durationSec
) {

    /** Exit code reported when a command exceeds its timeout, as coreutils {@code timeout} does. */
    public static final int TIMEOUT_EXIT_CODE = 124;

    public ExecResult {
        if (stdout == null) stdout = "";
        if (stderr == null) stderr = "";
    }

    public boolean succeeded() {
        return exitCode == 0;
    }

    /** Result standing in for a command the backend could not run at all. */
    public static ExecResult transportFailure(String description, double durationSec) {
        return new ExecResult("", description, 1, durationSec);
    }
}
