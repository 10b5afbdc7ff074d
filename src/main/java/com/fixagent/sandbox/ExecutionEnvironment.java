package com.fixagent.sandbox;

import java.nio.file.Path;
import java.util.Map;

/**
 * An isolated, resource-limited sandbox owned by exactly one trial.
 * Implementations: {@link DockerEnvironment}.
 */
public interface ExecutionEnvironment {

    /**
     * Provisions the sandbox. A leftover sandbox with the same identity is
     * stopped and removed first.
     *
     * @param forceRebuild rebuild the sandbox image even if it exists
     * @throws ProvisioningException if the backend cannot create or start the sandbox
     */
    void start(boolean forceRebuild);

    /**
     * Stops the sandbox within a bounded grace period. A sandbox that is
     * already gone counts as stopped; calling this more than once is safe.
     *
     * @param delete also remove the sandbox and its backing storage
     */
    void stop(boolean delete);

    /**
     * Runs a shell command inside the sandbox. Backend failures are returned
     * as a synthetic result with exit code 1 and the description in stderr.
     *
     * @param command    shell command line
     * @param workingDir working directory, or null for the sandbox default
     * @param env        extra environment variables, or null
     * @param timeoutSec timeout in seconds, or null for none
     * @throws EnvironmentNotStartedException if called before {@link #start}
     */
    ExecResult execute(String command, String workingDir, Map<String, String> env, Integer timeoutSec);

    default ExecResult execute(String command) {
        return execute(command, null, null, null);
    }

    default ExecResult execute(String command, int timeoutSec) {
        return execute(command, null, null, timeoutSec);
    }

    /**
     * Copies a local file into the sandbox.
     */
    void uploadFile(Path localPath, String remotePath);

    /**
     * Copies a file out of the sandbox, creating missing local parent directories.
     */
    void downloadFile(String remotePath, Path localPath);
}
