package com.fixagent.core.model;

/**
 * Why a trial ended with an exception instead of a verification result.
 */
public enum FailureKind {
    /** The sandbox could not be created or started. */
    PROVISIONING,
    /** Clone, fetch, checkout or branch creation failed. */
    WORKSPACE,
    /** The trial was cancelled on request. */
    CANCELLED,
    /** The trial exceeded its wall-clock budget. */
    TIMED_OUT,
    UNEXPECTED
}
