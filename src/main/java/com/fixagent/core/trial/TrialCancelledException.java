package com.fixagent.core.trial;

import com.fixagent.core.model.ClassifiedFailure;
import com.fixagent.core.model.FailureKind;

/**
 * Thrown inside a trial once its {@link CancellationToken} has fired.
 */
public class TrialCancelledException extends RuntimeException implements ClassifiedFailure {

    private final FailureKind kind;

    public TrialCancelledException(FailureKind kind) {
        super(kind == FailureKind.TIMED_OUT ? "Trial exceeded its time budget" : "Trial was cancelled");
        this.kind = kind;
    }

    public FailureKind kind() {
        return kind;
    }

    @Override
    public FailureKind failureKind() {
        return kind;
    }
}
