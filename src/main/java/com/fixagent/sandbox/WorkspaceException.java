package com.fixagent.sandbox;

import com.fixagent.core.model.ClassifiedFailure;
import com.fixagent.core.model.FailureKind;

/**
 * Thrown when the PR workspace cannot be cloned, fetched or checked out.
 * Merge conflicts are not reported this way.
 */
public class WorkspaceException extends RuntimeException implements ClassifiedFailure {
    public WorkspaceException(String message) {
        super(message);
    }

    @Override
    public FailureKind failureKind() {
        return FailureKind.WORKSPACE;
    }
}
