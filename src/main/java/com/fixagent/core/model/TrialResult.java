package com.fixagent.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Outcome of one trial. Owned by the orchestrator while the trial runs:
 * created with {@code startedAt}, then given either a verification result or
 * an exception, then {@code finishedAt}. Treated as immutable once persisted.
 */
public class TrialResult {

    private UUID trialId;
    private String trialName;
    private String taskId;
    private String prUrl;
    private int prNumber;
    private VerificationResult verificationResult;
    private ExceptionInfo exceptionInfo;
    private Instant startedAt;
    private Instant finishedAt;
    @JsonSerialize(using = ToStringSerializer.class)
    private Path trialDir;

    public TrialResult() {
    }

    public static TrialResult start(TrialConfig config, Instant startedAt) {
        var result = new TrialResult();
        result.trialId = config.trialId();
        result.trialName = config.trialName();
        result.taskId = config.task().taskId();
        result.prUrl = config.prInfo().prUrl();
        result.prNumber = config.prInfo().prNumber();
        result.trialDir = config.trialDir();
        result.startedAt = startedAt;
        return result;
    }

    /** Seconds between start and finish, or null until both are set. */
    @JsonProperty(value = "durationSec", access = JsonProperty.Access.READ_ONLY)
    public Double getDurationSec() {
        if (startedAt == null || finishedAt == null) {
            return null;
        }
        return Duration.between(startedAt, finishedAt).toMillis() / 1000.0;
    }

    @JsonProperty(value = "success", access = JsonProperty.Access.READ_ONLY)
    public boolean isSuccess() {
        return exceptionInfo == null
                && verificationResult != null
                && verificationResult.success();
    }

    public UUID getTrialId() { return trialId; }
    public void setTrialId(UUID trialId) { this.trialId = trialId; }
    public String getTrialName() { return trialName; }
    public void setTrialName(String trialName) { this.trialName = trialName; }
    public String getTaskId() { return taskId; }
    public void setTaskId(String taskId) { this.taskId = taskId; }
    public String getPrUrl() { return prUrl; }
    public void setPrUrl(String prUrl) { this.prUrl = prUrl; }
    public int getPrNumber() { return prNumber; }
    public void setPrNumber(int prNumber) { this.prNumber = prNumber; }
    public VerificationResult getVerificationResult() { return verificationResult; }
    public void setVerificationResult(VerificationResult verificationResult) { this.verificationResult = verificationResult; }
    public ExceptionInfo getExceptionInfo() { return exceptionInfo; }
    public void setExceptionInfo(ExceptionInfo exceptionInfo) { this.exceptionInfo = exceptionInfo; }
    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }
    public Instant getFinishedAt() { return finishedAt; }
    public void setFinishedAt(Instant finishedAt) { this.finishedAt = finishedAt; }
    public Path getTrialDir() { return trialDir; }
    public void setTrialDir(Path trialDir) { this.trialDir = trialDir; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TrialResult that)) return false;
        return prNumber == that.prNumber
                && Objects.equals(trialId, that.trialId)
                && Objects.equals(trialName, that.trialName)
                && Objects.equals(taskId, that.taskId)
                && Objects.equals(prUrl, that.prUrl)
                && Objects.equals(verificationResult, that.verificationResult)
                && Objects.equals(exceptionInfo, that.exceptionInfo)
                && Objects.equals(startedAt, that.startedAt)
                && Objects.equals(finishedAt, that.finishedAt)
                && Objects.equals(trialDir, that.trialDir);
    }

    @Override
    public int hashCode() {
        return Objects.hash(trialId, trialName, taskId, prUrl, prNumber, verificationResult,
                exceptionInfo, startedAt, finishedAt, trialDir);
    }

    @Override
    public String toString() {
        return "TrialResult{trialName=" + trialName + ", success=" + isSuccess()
                + ", durationSec=" + getDurationSec() + "}";
    }
}
