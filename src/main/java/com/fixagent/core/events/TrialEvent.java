package com.fixagent.core.events;

import com.fixagent.core.trial.TrialState;

import java.time.Instant;
import java.util.Map;

/**
 * A lifecycle event published while a trial runs.
 *
 * @param eventType e.g. {@code trial.state}, {@code trial.finished}
 * @param trialId   the trial this event belongs to
 * @param trialName human-readable trial name
 * @param state     state the trial entered
 * @param data      extra event attributes
 * @param timestamp when the event was published
 */
public record TrialEvent(
    String eventType,
    String trialId,
    String trialName,
    TrialState state,
    Map<String, Object> data,
    Instant timestamp
) {}
