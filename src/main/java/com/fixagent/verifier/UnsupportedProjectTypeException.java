package com.fixagent.verifier;

import com.fixagent.core.model.ProjectType;

/**
 * Thrown when no verifier exists for a project type.
 */
public class UnsupportedProjectTypeException extends RuntimeException {
    public UnsupportedProjectTypeException(ProjectType type) {
        super("No verifier available for project type " + type.id());
    }
}
