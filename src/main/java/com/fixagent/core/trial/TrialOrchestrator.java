package com.fixagent.core.trial;

import com.fixagent.core.events.EventBus;
import com.fixagent.core.events.TrialEvent;
import com.fixagent.core.logging.MdcContext;
import com.fixagent.core.metrics.VerifierMetrics;
import com.fixagent.core.model.ExceptionInfo;
import com.fixagent.core.model.FailureKind;
import com.fixagent.core.model.TrialConfig;
import com.fixagent.core.model.TrialResult;
import com.fixagent.core.model.VerificationResult;
import com.fixagent.sandbox.EnvironmentFactory;
import com.fixagent.sandbox.ExecutionEnvironment;
import com.fixagent.sandbox.SandboxProperties;
import com.fixagent.sandbox.WorkspaceSetup;
import com.fixagent.verifier.Verifier;
import com.fixagent.verifier.VerifierFactory;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs one trial end to end: provision the sandbox, materialize the merged
 * PR workspace, verify, persist, tear down.
 *
 * <p>{@link #runTrial} never throws once the trial directory exists. Every
 * failure ends up on the returned {@link TrialResult}; the sandbox is released
 * and {@code result.json} written exactly once regardless of where the trial stopped.
 */
@Service
public class TrialOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TrialOrchestrator.class);

    private final EnvironmentFactory environmentFactory;
    private final VerifierFactory verifierFactory;
    private final WorkspaceSetup workspaceSetup;
    private final TrialArtifactStore artifactStore;
    private final EventBus eventBus;
    private final VerifierMetrics metrics;
    private final int setupBudgetSeconds;

    private final Map<UUID, CancellationToken> activeTrials = new ConcurrentHashMap<>();
    private final ScheduledExecutorService watchdog = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "trial-watchdog");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public TrialOrchestrator(EnvironmentFactory environmentFactory,
                             VerifierFactory verifierFactory,
                             WorkspaceSetup workspaceSetup,
                             TrialArtifactStore artifactStore,
                             EventBus eventBus,
                             @Autowired(required = false) VerifierMetrics metrics,
                             SandboxProperties properties) {
        this(environmentFactory, verifierFactory, workspaceSetup, artifactStore, eventBus, metrics,
                properties.getSetupBudgetSeconds());
    }

    public TrialOrchestrator(EnvironmentFactory environmentFactory,
                             VerifierFactory verifierFactory,
                             WorkspaceSetup workspaceSetup,
                             TrialArtifactStore artifactStore,
                             EventBus eventBus,
                             @Nullable VerifierMetrics metrics,
                             int setupBudgetSeconds) {
        this.environmentFactory = environmentFactory;
        this.verifierFactory = verifierFactory;
        this.workspaceSetup = workspaceSetup;
        this.artifactStore = artifactStore;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.setupBudgetSeconds = setupBudgetSeconds;
    }

    public TrialResult runTrial(TrialConfig config) {
        return runTrial(config, new CancellationToken());
    }

    /**
     * Runs the trial under the given token. The watchdog fires the token with
     * {@link FailureKind#TIMED_OUT} once {@link #budgetSeconds(TrialConfig)} elapses.
     */
    public TrialResult runTrial(TrialConfig config, CancellationToken token) {
        Path trialDir = artifactStore.prepare(config);
        TrialResult result = TrialResult.start(config, Instant.now());
        UUID trialId = config.trialId();

        MdcContext.setTrial(trialId.toString(), config.task().taskId());
        activeTrials.put(trialId, token);
        ScheduledFuture<?> deadline = watchdog.schedule(
                () -> {
                    if (token.cancel(FailureKind.TIMED_OUT)) {
                        log.warn("Trial {} exceeded its {}s budget", config.trialName(), budgetSeconds(config));
                    }
                },
                budgetSeconds(config), TimeUnit.SECONDS);

        log.info("Starting trial {} for {}", config.trialName(), config.prInfo().prUrl());
        publish(config, TrialState.CREATED, Map.of("trialDir", trialDir.toString()));

        ExecutionEnvironment environment = null;
        try {
            environment = environmentFactory.create(config);
            ExecutionEnvironment created = environment;
            token.onCancel(() -> {
                log.info("Stopping sandbox of cancelled trial {}", config.trialName());
                created.stop(true);
            });
            token.throwIfCancelled();

            publish(config, TrialState.ENVIRONMENT_STARTING, Map.of());
            environment.start(false);
            token.throwIfCancelled();

            publish(config, TrialState.WORKSPACE_SETUP, Map.of());
            workspaceSetup.prepare(environment, config.prInfo());
            token.throwIfCancelled();

            Verifier verifier = verifierFactory.forConfig(config.verifier());
            publish(config, TrialState.VERIFYING, Map.of("verifier", verifier.name()));
            VerificationResult verification = verifier.verify(environment, config.verifier().timeoutSeconds());
            token.throwIfCancelled();

            result.setVerificationResult(verification);
            if (metrics != null) {
                metrics.recordVerification(verifier.name(), verification.durationSec());
            }
            log.info("Trial {} verification {} in {}s", config.trialName(),
                    verification.success() ? "passed" : "failed",
                    String.format("%.1f", verification.durationSec()));
        } catch (Exception e) {
            ExceptionInfo info = ExceptionInfo.from(e);
            result.setExceptionInfo(info);
            if (e instanceof TrialCancelledException) {
                log.warn("Trial {} ended: {}", config.trialName(), e.getMessage());
            } else {
                log.error("Trial {} failed with {}: {}", config.trialName(),
                        info.exceptionType(), info.exceptionMessage(), e);
            }
            try {
                artifactStore.writeException(trialDir, e);
            } catch (RuntimeException writeError) {
                log.error("Could not write exception artifact for {}: {}",
                        config.trialName(), writeError.getMessage());
            }
        } finally {
            deadline.cancel(false);
            activeTrials.remove(trialId);
            releaseEnvironment(config, environment);
            result.setFinishedAt(Instant.now());
            try {
                artifactStore.writeResult(result);
            } catch (RuntimeException writeError) {
                log.error("Could not write result artifact for {}: {}",
                        config.trialName(), writeError.getMessage());
            }
            finish(config, result);
            MdcContext.clearTrial();
        }
        return result;
    }

    /**
     * Cancels a running trial. Its sandbox is stopped immediately and the
     * trial finishes as a {@link FailureKind#CANCELLED} failure.
     *
     * @return false if no trial with that id is running
     */
    public boolean cancel(UUID trialId) {
        CancellationToken token = activeTrials.get(trialId);
        if (token == null) {
            return false;
        }
        log.info("Cancelling trial {}", trialId);
        return token.cancel(FailureKind.CANCELLED);
    }

    /** Cancels every running trial; returns how many were signalled. */
    public int cancelAll() {
        int cancelled = 0;
        for (CancellationToken token : activeTrials.values()) {
            if (token.cancel(FailureKind.CANCELLED)) {
                cancelled++;
            }
        }
        if (cancelled > 0) {
            log.info("Cancelled {} running trial(s)", cancelled);
        }
        return cancelled;
    }

    public int activeTrialCount() {
        return activeTrials.size();
    }

    long budgetSeconds(TrialConfig config) {
        return (long) Math.max(config.task().timeoutSeconds(), config.verifier().timeoutSeconds())
                + setupBudgetSeconds;
    }

    /**
     * Stops and deletes the sandbox. Failures are logged and counted, never propagated.
     */
    void releaseEnvironment(TrialConfig config, ExecutionEnvironment environment) {
        if (environment == null) {
            return;
        }
        try {
            environment.stop(true);
        } catch (Exception e) {
            log.warn("Failed to tear down sandbox {}: {}",
                    EnvironmentFactory.sandboxName(config), e.getMessage());
            if (metrics != null) {
                metrics.incrementTeardownFailures();
            }
        }
    }

    @PreDestroy
    void shutdown() {
        cancelAll();
        watchdog.shutdownNow();
    }

    private void finish(TrialConfig config, TrialResult result) {
        ExceptionInfo info = result.getExceptionInfo();
        String outcome = info != null ? "exception" : result.isSuccess() ? "success" : "failure";
        String kind = info != null ? info.kind().name() : "none";

        var data = new LinkedHashMap<String, Object>();
        data.put("success", result.isSuccess());
        data.put("outcome", outcome);
        if (info != null) {
            data.put("kind", kind);
        }
        publish(config, TrialState.FINALIZED, data);

        if (metrics != null) {
            long durationMs = Duration.between(result.getStartedAt(), result.getFinishedAt()).toMillis();
            metrics.recordTrial(outcome, kind, durationMs);
        }
        log.info("Trial {} finished: {} ({}s)", config.trialName(), outcome, result.getDurationSec());
    }

    private void publish(TrialConfig config, TrialState state, Map<String, Object> data) {
        String eventType = state == TrialState.FINALIZED ? "trial.finished" : "trial.state";
        eventBus.publish(new TrialEvent(eventType, config.trialId().toString(), config.trialName(),
                state, data, Instant.now()));
    }
}
