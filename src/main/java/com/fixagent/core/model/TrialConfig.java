package com.fixagent.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;

import java.io.Serializable;
import java.nio.file.Path;
import java.util.UUID;

/**
 * The unit of work handed to the trial orchestrator. Never mutated once created.
 *
 * @param trialId       unique id; also determines the sandbox name and output subdirectory
 * @param trialName     human-readable name, e.g. {@code pr-42__trial-1a2b3c4d}
 * @param task          the verification intent
 * @param prInfo        pull request metadata
 * @param environment   sandbox resources
 * @param verifier      verifier settings
 * @param outputDir     root directory for trial artifacts
 * @param retryAttempts how many times the batch scheduler may re-run this trial
 *                      after an infrastructure failure
 */
public record TrialConfig(
    UUID trialId,
    String trialName,
    TaskConfig task,
    PrInfo prInfo,
    EnvironmentConfig environment,
    VerifierConfig verifier,
    @JsonSerialize(using = ToStringSerializer.class) Path outputDir,
    int retryAttempts
) implements Serializable {

    public static final int DEFAULT_RETRY_ATTEMPTS = 2;

    public TrialConfig {
        if (trialId == null) trialId = UUID.randomUUID();
        if (outputDir == null) outputDir = Path.of("results");
        if (retryAttempts < 0) {
            throw new IllegalArgumentException("retryAttempts must be >= 0, got " + retryAttempts);
        }
    }

    /** Directory holding this trial's artifacts. */
    @JsonIgnore
    public Path trialDir() {
        return outputDir.resolve(trialId.toString());
    }

    /**
     * Copy for retry number {@code attempt} (1-based): fresh trial id (and
     * therefore a fresh sandbox and directory), suffixed name, and
     * {@code retryAttempts - attempt} retries left.
     */
    public TrialConfig forRetry(int attempt) {
        if (attempt < 1 || attempt > retryAttempts) {
            throw new IllegalStateException("Retry " + attempt + " exceeds the " + retryAttempts
                    + " attempt(s) allowed for " + trialName);
        }
        return new TrialConfig(UUID.randomUUID(), trialName + "__retry-" + attempt, task, prInfo,
                environment, verifier, outputDir, retryAttempts - attempt);
    }
}
