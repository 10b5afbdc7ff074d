package com.fixagent.core.model;

/**
 * Implemented by exceptions that know which {@link FailureKind} they represent.
 */
public interface ClassifiedFailure {

    FailureKind failureKind();
}
