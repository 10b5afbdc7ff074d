package com.fixagent.core.scheduler;

import com.fixagent.core.model.ExceptionInfo;
import com.fixagent.core.model.FailureKind;
import com.fixagent.core.model.ProjectType;
import com.fixagent.core.model.TestFixtures;
import com.fixagent.core.model.TrialConfig;
import com.fixagent.core.model.TrialResult;
import com.fixagent.core.model.VerificationResult;
import com.fixagent.core.trial.TrialCancelledException;
import com.fixagent.core.trial.TrialOrchestrator;
import com.fixagent.sandbox.ProvisioningException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class BatchSchedulerTest {

    @TempDir
    Path outputDir;

    private TrialOrchestrator orchestrator;
    private BatchScheduler scheduler;

    @BeforeEach
    void setUp() {
        orchestrator = mock(TrialOrchestrator.class);
        scheduler = new BatchScheduler(orchestrator);
    }

    private static TrialResult verified(TrialConfig config, boolean success) {
        TrialResult result = TrialResult.start(config, Instant.now());
        result.setVerificationResult(new VerificationResult(success, "", 1.0,
                success ? null : "Compilation failed - see output", List.of("clean", "build")));
        result.setFinishedAt(Instant.now());
        return result;
    }

    private static TrialResult crashed(TrialConfig config, RuntimeException e) {
        TrialResult result = TrialResult.start(config, Instant.now());
        result.setExceptionInfo(ExceptionInfo.from(e));
        result.setFinishedAt(Instant.now());
        return result;
    }

    @Test
    void mixedBatchReportsEveryOutcome() {
        var trials = List.of(
                TestFixtures.trialConfig(outputDir, ProjectType.JAVA_GRADLE, 1, 600),
                TestFixtures.trialConfig(outputDir, ProjectType.JAVA_GRADLE, 2, 600),
                TestFixtures.trialConfig(outputDir, ProjectType.JAVA_GRADLE, 3, 600),
                TestFixtures.trialConfig(outputDir, ProjectType.JAVA_GRADLE, 4, 600));
        when(orchestrator.runTrial(any(TrialConfig.class))).thenAnswer(inv -> {
            TrialConfig config = inv.getArgument(0);
            return verified(config, config.prInfo().prNumber() % 2 == 1);
        });

        BatchSummary summary = scheduler.runTrials(trials, 2);

        assertEquals(4, summary.total());
        assertEquals(2, summary.succeeded());
        assertEquals(2, summary.failed());
        assertEquals(List.of(trials.get(1).trialName(), trials.get(3).trialName()).stream().sorted().toList(),
                summary.failedKeys());
        assertEquals(4, summary.trialResults().size());
        assertFalse(summary.allSucceeded());
        verify(orchestrator, times(4)).runTrial(any(TrialConfig.class));
    }

    @Test
    void neverExceedsConcurrency() {
        var running = new AtomicInteger();
        var peak = new AtomicInteger();
        var tasks = new LinkedHashMap<String, Callable<Boolean>>();
        for (int i = 0; i < 8; i++) {
            tasks.put("unit-" + i, () -> {
                int now = running.incrementAndGet();
                peak.accumulateAndGet(now, Math::max);
                Thread.sleep(50);
                running.decrementAndGet();
                return true;
            });
        }

        BatchSummary summary = scheduler.runTasks(tasks, 3);

        assertEquals(8, summary.succeeded());
        assertTrue(peak.get() <= 3, "peak concurrency was " + peak.get());
    }

    @Test
    void throwingUnitIsRecordedAsFailed() {
        Map<String, Callable<Boolean>> tasks = new LinkedHashMap<>();
        tasks.put("ok", () -> true);
        tasks.put("boom", () -> { throw new IllegalStateException("boom"); });
        tasks.put("no", () -> false);

        BatchSummary summary = scheduler.runTasks(tasks, 2);

        assertEquals(3, summary.total());
        assertEquals(1, summary.succeeded());
        assertEquals(List.of("boom", "no"), summary.failedKeys());
        assertTrue(summary.outcomes().get("ok"));
    }

    @Test
    void emptyBatchIsEmptySummary() {
        BatchSummary summary = scheduler.runTasks(Map.of(), 4);

        assertEquals(0, summary.total());
        assertTrue(summary.allSucceeded());
    }

    @Test
    void rejectsNonPositiveConcurrency() {
        assertThrows(IllegalArgumentException.class, () -> scheduler.runTasks(Map.of("a", () -> true), 0));
    }

    @Test
    void infrastructureFailureIsRetriedWithFreshConfig() {
        TrialConfig config = TestFixtures.trialConfig(outputDir, ProjectType.JAVA_GRADLE);
        when(orchestrator.runTrial(any(TrialConfig.class)))
                .thenAnswer(inv -> crashed(inv.getArgument(0), new ProvisioningException("no daemon")))
                .thenAnswer(inv -> verified(inv.getArgument(0), true));

        TrialResult result = scheduler.runWithRetries(config);

        assertTrue(result.isSuccess());
        var captor = ArgumentCaptor.forClass(TrialConfig.class);
        verify(orchestrator, times(2)).runTrial(captor.capture());
        TrialConfig retry = captor.getAllValues().get(1);
        assertNotEquals(config.trialId(), retry.trialId());
        assertEquals(config.trialName() + "__retry-1", retry.trialName());
    }

    @Test
    void retriesStopAfterConfiguredAttempts() {
        TrialConfig config = TestFixtures.trialConfig(outputDir, ProjectType.JAVA_GRADLE);
        when(orchestrator.runTrial(any(TrialConfig.class)))
                .thenAnswer(inv -> crashed(inv.getArgument(0), new ProvisioningException("no daemon")));

        TrialResult result = scheduler.runWithRetries(config);

        assertEquals(FailureKind.PROVISIONING, result.getExceptionInfo().kind());
        verify(orchestrator, times(1 + config.retryAttempts())).runTrial(any(TrialConfig.class));
    }

    @Test
    void buildFailureIsNotRetried() {
        TrialConfig config = TestFixtures.trialConfig(outputDir, ProjectType.JAVA_GRADLE);
        when(orchestrator.runTrial(any(TrialConfig.class))).thenAnswer(inv -> verified(inv.getArgument(0), false));

        scheduler.runWithRetries(config);

        verify(orchestrator, times(1)).runTrial(any(TrialConfig.class));
    }

    @Test
    void cancelledTrialIsNotRetried() {
        TrialConfig config = TestFixtures.trialConfig(outputDir, ProjectType.JAVA_GRADLE);
        when(orchestrator.runTrial(any(TrialConfig.class))).thenAnswer(inv ->
                crashed(inv.getArgument(0), new TrialCancelledException(FailureKind.CANCELLED)));

        TrialResult result = scheduler.runWithRetries(config);

        assertEquals(FailureKind.CANCELLED, result.getExceptionInfo().kind());
        verify(orchestrator, times(1)).runTrial(any(TrialConfig.class));
    }

    @Test
    void cancelSkipsPendingUnitsAndCancelsRunningTrials() {
        scheduler.cancel();

        BatchSummary summary = scheduler.runTasks(Map.of("a", () -> true, "b", () -> true), 1);

        assertTrue(scheduler.isCancelled());
        assertEquals(2, summary.failed());
        verify(orchestrator).cancelAll();
    }
}
