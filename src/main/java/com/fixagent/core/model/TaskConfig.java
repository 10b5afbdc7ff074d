package com.fixagent.core.model;

import java.io.Serializable;

/**
 * One verification intent: which PR to verify and under what budget.
 *
 * @param taskId             unique task identifier, e.g. {@code pr-123}
 * @param prUrl              pull request URL
 * @param projectType        build ecosystem used to pick a verifier
 * @param timeoutSeconds     verification timeout
 * @param cpus               CPU cores for the sandbox
 * @param memoryMb           memory ceiling in MB
 * @param allowInternet      bridged network when true, isolated otherwise
 * @param customVerifyScript optional local path of a verification script (nullable)
 * @param priority           scheduling hint, not used for ordering
 */
public record TaskConfig(
    String taskId,
    String prUrl,
    ProjectType projectType,
    int timeoutSeconds,
    int cpus,
    int memoryMb,
    boolean allowInternet,
    String customVerifyScript,
    Priority priority
) implements Serializable {

    public static final int DEFAULT_TIMEOUT_SECONDS = 1800;
    public static final int DEFAULT_CPUS = 2;
    public static final int DEFAULT_MEMORY_MB = 4096;

    public TaskConfig {
        if (projectType == null) projectType = ProjectType.JAVA_GRADLE;
        if (priority == null) priority = Priority.MEDIUM;
    }

    /** Task with default resources and timeout. */
    public static TaskConfig of(String taskId, String prUrl, ProjectType projectType) {
        return new TaskConfig(taskId, prUrl, projectType, DEFAULT_TIMEOUT_SECONDS,
                DEFAULT_CPUS, DEFAULT_MEMORY_MB, true, null, Priority.MEDIUM);
    }
}
