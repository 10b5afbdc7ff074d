package com.fixagent.core.scheduler;

import com.fixagent.core.logging.MdcContext;
import com.fixagent.core.metrics.VerifierMetrics;
import com.fixagent.core.model.ExceptionInfo;
import com.fixagent.core.model.FailureKind;
import com.fixagent.core.model.TrialConfig;
import com.fixagent.core.model.TrialResult;
import com.fixagent.core.trial.TrialOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs many independent units of work on a fixed pool of worker threads,
 * with at most {@code concurrency} in flight. One unit failing never affects
 * the others: anything a unit throws is caught here and recorded as a
 * failure for its key.
 *
 * <p>Trials whose result carries an infrastructure exception are re-run
 * (fresh sandbox, fresh id) up to {@link TrialConfig#retryAttempts()} times.
 * Verified build failures and cancellations are final.
 */
@Service
public class BatchScheduler {

    private static final Logger log = LoggerFactory.getLogger(BatchScheduler.class);

    private final TrialOrchestrator orchestrator;
    private final VerifierMetrics metrics;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    @Autowired
    public BatchScheduler(TrialOrchestrator orchestrator, @Autowired(required = false) VerifierMetrics metrics) {
        this.orchestrator = orchestrator;
        this.metrics = metrics;
    }

    BatchScheduler(TrialOrchestrator orchestrator) {
        this(orchestrator, null);
    }

    /**
     * Runs every trial, keyed by trial name, and waits for all of them.
     */
    public BatchSummary runTrials(List<TrialConfig> trials, int concurrency) {
        var results = new ConcurrentHashMap<String, TrialResult>();
        var tasks = new LinkedHashMap<String, Callable<Boolean>>();
        for (TrialConfig trial : trials) {
            String key = uniqueKey(tasks, trial);
            tasks.put(key, () -> {
                TrialResult result = runWithRetries(trial);
                results.put(key, result);
                return result.isSuccess();
            });
        }
        if (metrics != null) {
            metrics.recordBatchSize(tasks.size());
        }
        return fanOut(tasks, concurrency, results);
    }

    /**
     * Runs arbitrary keyed units of work; a unit succeeds iff it returns true.
     */
    public BatchSummary runTasks(Map<String, Callable<Boolean>> tasks, int concurrency) {
        return fanOut(tasks, concurrency, Map.of());
    }

    /**
     * Skips every unit not yet started and cancels the trials in flight.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.warn("Batch cancelled; stopping running trials");
        }
        orchestrator.cancelAll();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    TrialResult runWithRetries(TrialConfig config) {
        TrialResult result = orchestrator.runTrial(config);
        for (int attempt = 1; attempt <= config.retryAttempts() && shouldRetry(result); attempt++) {
            if (cancelled.get()) {
                break;
            }
            TrialConfig retry = config.forRetry(attempt);
            log.warn("Trial {} failed with {} ({}); retrying as {}", config.trialName(),
                    result.getExceptionInfo().exceptionType(), result.getExceptionInfo().kind(),
                    retry.trialName());
            result = orchestrator.runTrial(retry);
        }
        return result;
    }

    static boolean shouldRetry(TrialResult result) {
        ExceptionInfo info = result.getExceptionInfo();
        return info != null && info.kind() != FailureKind.CANCELLED;
    }

    private BatchSummary fanOut(Map<String, Callable<Boolean>> tasks, int concurrency,
                                Map<String, TrialResult> trialResults) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1, got " + concurrency);
        }
        if (tasks.isEmpty()) {
            return BatchSummary.empty();
        }

        int poolSize = Math.min(concurrency, tasks.size());
        log.info("Running {} unit(s) with concurrency {}", tasks.size(), poolSize);

        var outcomes = new ConcurrentHashMap<String, Boolean>();
        var completed = new AtomicInteger();
        var threadIds = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(poolSize, r -> {
            Thread t = new Thread(r, "batch-worker-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        try {
            var futures = new ArrayList<CompletableFuture<Void>>();
            for (var entry : tasks.entrySet()) {
                String key = entry.getKey();
                Callable<Boolean> task = entry.getValue();
                futures.add(CompletableFuture.runAsync(() -> {
                    boolean ok = runIsolated(key, task);
                    outcomes.put(key, ok);
                    log.info("[{}/{}] {} {}", completed.incrementAndGet(), tasks.size(), key,
                            ok ? "succeeded" : "failed");
                }, executor));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } finally {
            executor.shutdownNow();
        }

        BatchSummary summary = BatchSummary.of(outcomes, trialResults);
        log.info("Batch finished: {}/{} succeeded", summary.succeeded(), summary.total());
        return summary;
    }

    private boolean runIsolated(String key, Callable<Boolean> task) {
        MdcContext.setBatchKey(key);
        try {
            if (cancelled.get()) {
                log.info("Skipping {}: batch cancelled", key);
                return false;
            }
            return Boolean.TRUE.equals(task.call());
        } catch (Exception e) {
            log.error("Unit {} failed with {}: {}", key, e.getClass().getSimpleName(), e.getMessage(), e);
            return false;
        } finally {
            MdcContext.clear();
        }
    }

    private static String uniqueKey(Map<String, ?> existing, TrialConfig trial) {
        String key = trial.trialName();
        return existing.containsKey(key) ? key + "#" + trial.trialId() : key;
    }
}
