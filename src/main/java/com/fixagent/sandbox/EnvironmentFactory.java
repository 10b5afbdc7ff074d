package com.fixagent.sandbox;

import com.fixagent.core.model.EnvironmentConfig;
import com.fixagent.core.model.TrialConfig;
import com.github.dockerjava.api.DockerClient;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Creates the sandbox for a single trial. The sandbox identity is derived
 * from the trial id so concurrent trials never collide on names.
 */
@Component
public class EnvironmentFactory {

    static final String NAME_PREFIX = "fixagent-";

    private final DockerClient dockerClient;
    private final SandboxProperties properties;

    public EnvironmentFactory(DockerClient dockerClient, SandboxProperties properties) {
        this.dockerClient = dockerClient;
        this.properties = properties;
    }

    public ExecutionEnvironment create(TrialConfig config) {
        EnvironmentConfig env = config.environment();
        return switch (env.backend()) {
            case DOCKER -> new DockerEnvironment(
                    dockerClient,
                    sandboxName(config),
                    imageFor(config),
                    env.cpus(),
                    env.memoryMb(),
                    env.allowInternet(),
                    properties.getWorkingDir(),
                    properties.getStopTimeoutSeconds(),
                    dockerfileDirFor(config));
        };
    }

    public static String sandboxName(TrialConfig config) {
        return NAME_PREFIX + config.trialId();
    }

    /** Explicit image override, otherwise {@code <prefix>:<project-type>}. */
    String imageFor(TrialConfig config) {
        String override = config.environment().image();
        if (override != null && !override.isBlank()) {
            return override;
        }
        return properties.getImagePrefix() + ":" + config.verifier().projectType().id();
    }

    private Path dockerfileDirFor(TrialConfig config) {
        String root = properties.getDockerfileDir();
        if (root == null || root.isBlank()) {
            return null;
        }
        return Path.of(root).resolve(config.verifier().projectType().id());
    }
}
