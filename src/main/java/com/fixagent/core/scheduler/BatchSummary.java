package com.fixagent.core.scheduler;

import com.fixagent.core.model.TrialResult;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregate outcome of a batch run.
 *
 * @param total        units of work submitted
 * @param succeeded    units that reported success
 * @param failed       units that failed, threw, or were skipped
 * @param failedKeys   keys of the failed units, sorted
 * @param outcomes     success flag per key
 * @param trialResults final trial result per key (empty for non-trial batches)
 */
public record BatchSummary(
    int total,
    int succeeded,
    int failed,
    List<String> failedKeys,
    Map<String, Boolean> outcomes,
    Map<String, TrialResult> trialResults
) {

    public BatchSummary {
        failedKeys = List.copyOf(failedKeys);
        outcomes = Collections.unmodifiableSortedMap(new TreeMap<>(outcomes));
        trialResults = Collections.unmodifiableSortedMap(new TreeMap<>(trialResults));
    }

    static BatchSummary of(Map<String, Boolean> outcomes, Map<String, TrialResult> trialResults) {
        List<String> failedKeys = new TreeMap<>(outcomes).entrySet().stream()
                .filter(e -> !e.getValue())
                .map(Map.Entry::getKey)
                .toList();
        return new BatchSummary(outcomes.size(), outcomes.size() - failedKeys.size(), failedKeys.size(),
                failedKeys, outcomes, trialResults);
    }

    public static BatchSummary empty() {
        return new BatchSummary(0, 0, 0, List.of(), Map.of(), Map.of());
    }

    public boolean allSucceeded() {
        return failed == 0;
    }
}
