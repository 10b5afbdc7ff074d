package com.fixagent.core.model;

import java.io.Serializable;

/**
 * Verifier settings for one trial.
 *
 * @param customScript optional local path of a verification script (nullable)
 */
public record VerifierConfig(
    int timeoutSeconds,
    ProjectType projectType,
    String customScript
) implements Serializable {

    public VerifierConfig {
        if (projectType == null) projectType = ProjectType.JAVA_GRADLE;
    }

    public static VerifierConfig from(TaskConfig task) {
        return new VerifierConfig(task.timeoutSeconds(), task.projectType(), task.customVerifyScript());
    }
}
