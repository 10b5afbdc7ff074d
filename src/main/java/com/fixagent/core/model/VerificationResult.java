package com.fixagent.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Normalized outcome of a build/verify command.
 *
 * @param success           true iff the build command exited with code 0
 * @param compilationOutput stdout followed by stderr, never truncated
 * @param durationSec       wall-clock time spent verifying
 * @param errorMessage      short reason when unsuccessful (nullable)
 * @param tasksRun          logical build tasks attempted, in order
 */
public record VerificationResult(
    boolean success,
    String compilationOutput,
    double durationSec,
    String errorMessage,
    List<String> tasksRun
) implements Serializable {

    public VerificationResult {
        if (compilationOutput == null) compilationOutput = "";
        tasksRun = tasksRun == null ? List.of() : List.copyOf(tasksRun);
    }
}
