package com.fixagent.core.trial;

/**
 * Lifecycle of a single trial. Transitions are strictly forward:
 * {@code CREATED -> ENVIRONMENT_STARTING -> WORKSPACE_SETUP -> VERIFYING -> FINALIZED};
 * any state may jump straight to {@code FINALIZED} on failure.
 */
public enum TrialState {
    CREATED,
    ENVIRONMENT_STARTING,
    WORKSPACE_SETUP,
    VERIFYING,
    FINALIZED
}
