package com.fixagent.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for trial execution.
 */
@Service
public class VerifierMetrics {

    private final MeterRegistry registry;

    public VerifierMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param outcome {@code success}, {@code failure} or {@code exception}
     * @param kind    failure kind for exceptions, {@code none} otherwise
     */
    public void recordTrial(String outcome, String kind, long durationMs) {
        Timer.builder("fixagent.trial.duration")
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(durationMs));
        Counter.builder("fixagent.trials.total")
                .tag("outcome", outcome)
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordVerification(String verifier, double durationSec) {
        Timer.builder("fixagent.verification.duration")
                .tag("verifier", verifier)
                .register(registry)
                .record(Duration.ofMillis((long) (durationSec * 1000)));
    }

    public void incrementTeardownFailures() {
        Counter.builder("fixagent.teardown.failures")
                .description("Sandboxes whose teardown raised an error")
                .register(registry)
                .increment();
    }

    public void recordBatchSize(int size) {
        DistributionSummary.builder("fixagent.batch.size")
                .register(registry)
                .record(size);
    }
}
