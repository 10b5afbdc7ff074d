package com.fixagent.core.model;


import java.io.Serializable;

/**
 * Sandbox resources for one trial.
 *
 * @param image optional image override; when null the image is derived from the project type
 */
public record EnvironmentConfig(
    EnvironmentBackend backend,
    int cpus,
    int memoryMb,
    boolean allowInternet,
    String image
) implements Serializable {

    public EnvironmentConfig {
        if (backend == null) backend = EnvironmentBackend.DOCKER;
    }

    public static EnvironmentConfig from(TaskConfig task) {
        return new EnvironmentConfig(EnvironmentBackend.DOCKER, task.cpus(), task.memoryMb(),
                task.allowInternet(), null);
    }
}
