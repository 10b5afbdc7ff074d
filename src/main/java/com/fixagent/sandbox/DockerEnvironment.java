package com.fixagent.sandbox;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.BuildImageResultCallback;
import com.github.dockerjava.api.command.PullImageResultCallback;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.exception.NotModifiedException;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.StreamType;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Docker-backed {@link ExecutionEnvironment}. One long-lived container per trial
 * ({@code sleep infinity}); commands run through Docker exec.
 *
 * <p>Each container is configured with:
 * <ul>
 *   <li>CPU count and memory ceiling from the trial's environment config</li>
 *   <li>Network mode {@code bridge} when internet access is allowed, {@code none} otherwise</li>
 *   <li>Working directory {@code /workspace}, where the PR is checked out</li>
 * </ul>
 */
public class DockerEnvironment implements ExecutionEnvironment {

    private static final Logger log = LoggerFactory.getLogger(DockerEnvironment.class);

    private static final long IMAGE_PULL_TIMEOUT_MINUTES = 30;

    private final DockerClient dockerClient;
    private final String containerName;
    private final String imageName;
    private final int cpus;
    private final int memoryMb;
    private final boolean allowInternet;
    private final String workingDir;
    private final int stopTimeoutSeconds;
    private final Path dockerfileDir;

    private final AtomicReference<String> containerId = new AtomicReference<>();

    /**
     * @param dockerfileDir build context used when the image is missing or a rebuild is forced;
     *                      null means pull the image instead
     */
    public DockerEnvironment(DockerClient dockerClient, String containerName, String imageName,
                             int cpus, int memoryMb, boolean allowInternet, String workingDir,
                             int stopTimeoutSeconds, Path dockerfileDir) {
        this.dockerClient = dockerClient;
        this.containerName = containerName;
        this.imageName = imageName;
        this.cpus = cpus;
        this.memoryMb = memoryMb;
        this.allowInternet = allowInternet;
        this.workingDir = workingDir != null ? workingDir : "/workspace";
        this.stopTimeoutSeconds = stopTimeoutSeconds;
        this.dockerfileDir = dockerfileDir;
    }

    public String containerName() {
        return containerName;
    }

    public String imageName() {
        return imageName;
    }

    public boolean isStarted() {
        return containerId.get() != null;
    }

    @Override
    public void start(boolean forceRebuild) {
        log.info("Starting sandbox {} (image: {}, {} CPUs, {}MB, network: {})",
                containerName, imageName, cpus, memoryMb, networkMode());
        String id = null;
        try {
            ensureImage(forceRebuild);
            removeStaleContainer();

            var hostConfig = HostConfig.newHostConfig()
                    .withCpuCount((long) cpus)
                    .withMemory((long) memoryMb * 1024 * 1024)
                    .withNetworkMode(networkMode());

            var response = dockerClient.createContainerCmd(imageName)
                    .withName(containerName)
                    .withHostConfig(hostConfig)
                    .withCmd("sleep", "infinity")
                    .withWorkingDir(workingDir)
                    .exec();

            id = response.getId();
            dockerClient.startContainerCmd(id).exec();

            var state = dockerClient.inspectContainerCmd(id).exec().getState();
            if (state == null || !Boolean.TRUE.equals(state.getRunning())) {
                throw new ProvisioningException("Sandbox " + containerName + " is not running after start");
            }
            containerId.set(id);
            log.info("Sandbox {} started (container {})", containerName, id);
        } catch (ProvisioningException e) {
            discard(id);
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProvisioningException("Interrupted while provisioning sandbox " + containerName, e);
        } catch (RuntimeException e) {
            discard(id);
            throw new ProvisioningException(
                    "Failed to start sandbox " + containerName + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void stop(boolean delete) {
        String id = containerId.getAndSet(null);
        if (id == null) {
            return;
        }
        try {
            dockerClient.stopContainerCmd(id).withTimeout(stopTimeoutSeconds).exec();
        } catch (NotFoundException | NotModifiedException e) {
            log.debug("Container {} already stopped or gone: {}", id, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Graceful stop of {} failed, forcing removal: {}", containerName, e.getMessage());
        }
        if (delete) {
            try {
                dockerClient.removeContainerCmd(id).withForce(true).withRemoveVolumes(true).exec();
                log.info("Sandbox {} torn down", containerName);
            } catch (NotFoundException e) {
                log.debug("Container {} already removed", id);
            }
        } else {
            log.info("Sandbox {} stopped", containerName);
        }
    }

    @Override
    public ExecResult execute(String command, String cwd, Map<String, String> env, Integer timeoutSec) {
        String id = requireStarted();
        long startNanos = System.nanoTime();

        try {
            var envList = new ArrayList<String>();
            if (env != null) {
                env.forEach((k, v) -> envList.add(k + "=" + v));
            }

            var exec = dockerClient.execCreateCmd(id)
                    .withCmd("bash", "-c", command)
                    .withWorkingDir(cwd != null ? cwd : workingDir)
                    .withEnv(envList)
                    .withAttachStdout(true)
                    .withAttachStderr(true)
                    .exec();

            var stdout = new ByteArrayOutputStream();
            var stderr = new ByteArrayOutputStream();
            var callback = dockerClient.execStartCmd(exec.getId())
                    .exec(new ResultCallback.Adapter<Frame>() {
                        @Override
                        public void onNext(Frame frame) {
                            var target = frame.getStreamType() == StreamType.STDERR ? stderr : stdout;
                            synchronized (target) {
                                target.writeBytes(frame.getPayload());
                            }
                        }
                    });

            if (timeoutSec != null) {
                if (!callback.awaitCompletion(timeoutSec, TimeUnit.SECONDS)) {
                    closeQuietly(callback);
                    log.warn("Command in {} timed out after {}s: {}", containerName, timeoutSec, command);
                    String err = decode(stderr) + "\nCommand timed out after " + timeoutSec + "s";
                    return new ExecResult(decode(stdout), err, ExecResult.TIMEOUT_EXIT_CODE, elapsed(startNanos));
                }
            } else {
                callback.awaitCompletion();
            }

            Long exitCode = dockerClient.inspectExecCmd(exec.getId()).exec().getExitCodeLong();
            return new ExecResult(decode(stdout), decode(stderr),
                    exitCode != null ? exitCode.intValue() : 1, elapsed(startNanos));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ExecResult.transportFailure("Interrupted while executing command", elapsed(startNanos));
        } catch (RuntimeException e) {
            log.warn("Exec in {} failed: {}", containerName, e.getMessage());
            return ExecResult.transportFailure(String.valueOf(e.getMessage() != null ? e.getMessage() : e),
                    elapsed(startNanos));
        }
    }

    @Override
    public void uploadFile(Path localPath, String remotePath) {
        String id = requireStarted();
        Path remote = Path.of(remotePath);
        String remoteDir = remote.getParent() != null ? remote.getParent().toString() : "/";

        try {
            byte[] content = Files.readAllBytes(localPath);
            var tarBytes = new ByteArrayOutputStream();
            try (var tar = new TarArchiveOutputStream(tarBytes)) {
                var entry = new TarArchiveEntry(remote.getFileName().toString());
                entry.setSize(content.length);
                entry.setMode(Files.isExecutable(localPath) ? 0755 : 0644);
                tar.putArchiveEntry(entry);
                tar.write(content);
                tar.closeArchiveEntry();
            }
            dockerClient.copyArchiveToContainerCmd(id)
                    .withTarInputStream(new ByteArrayInputStream(tarBytes.toByteArray()))
                    .withRemotePath(remoteDir)
                    .exec();
            log.debug("Uploaded {} to {}:{}", localPath, containerName, remotePath);
        } catch (IOException e) {
            throw new SandboxTransferException("Failed to upload " + localPath + " to " + remotePath, e);
        }
    }

    @Override
    public void downloadFile(String remotePath, Path localPath) {
        String id = requireStarted();
        try {
            Path parent = localPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (InputStream archive = dockerClient.copyArchiveFromContainerCmd(id, remotePath).exec();
                 var tar = new TarArchiveInputStream(archive)) {
                TarArchiveEntry entry;
                while ((entry = tar.getNextEntry()) != null) {
                    if (entry.isFile()) {
                        Files.copy(tar, localPath, StandardCopyOption.REPLACE_EXISTING);
                        log.debug("Downloaded {}:{} to {}", containerName, remotePath, localPath);
                        return;
                    }
                }
            }
            throw new SandboxTransferException("No file found at " + remotePath + " in " + containerName, null);
        } catch (IOException e) {
            throw new SandboxTransferException("Failed to download " + remotePath + " to " + localPath, e);
        }
    }

    String networkMode() {
        return allowInternet ? "bridge" : "none";
    }

    private void ensureImage(boolean forceRebuild) throws InterruptedException {
        boolean present;
        try {
            dockerClient.inspectImageCmd(imageName).exec();
            present = true;
        } catch (NotFoundException e) {
            present = false;
        }
        if (present && !forceRebuild) {
            return;
        }

        if (dockerfileDir != null && Files.isDirectory(dockerfileDir)) {
            log.info("Building image {} from {}", imageName, dockerfileDir);
            dockerClient.buildImageCmd(dockerfileDir.toFile())
                    .withTags(Set.of(imageName))
                    .exec(new BuildImageResultCallback())
                    .awaitImageId();
        } else if (!present) {
            log.info("Image {} not found locally, pulling", imageName);
            int tagSeparator = imageName.lastIndexOf(':');
            boolean hasTag = tagSeparator > imageName.lastIndexOf('/');
            var pull = hasTag
                    ? dockerClient.pullImageCmd(imageName.substring(0, tagSeparator))
                            .withTag(imageName.substring(tagSeparator + 1))
                    : dockerClient.pullImageCmd(imageName).withTag("latest");
            pull.exec(new PullImageResultCallback())
                    .awaitCompletion(IMAGE_PULL_TIMEOUT_MINUTES, TimeUnit.MINUTES);
        } else {
            log.warn("Rebuild of {} requested but no Dockerfile directory is configured; using existing image",
                    imageName);
        }
    }

    /** Removes a container created by a start attempt that did not complete. */
    private void discard(String id) {
        if (id == null) {
            return;
        }
        try {
            dockerClient.removeContainerCmd(id).withForce(true).withRemoveVolumes(true).exec();
            log.info("Removed container {} after failed start of {}", id, containerName);
        } catch (NotFoundException e) {
            log.debug("Container {} already removed", id);
        } catch (RuntimeException e) {
            log.warn("Failed to remove container {} after failed start: {}", id, e.getMessage());
        }
    }

    private void removeStaleContainer() {
        try {
            dockerClient.removeContainerCmd(containerName).withForce(true).exec();
            log.debug("Removed stale container {}", containerName);
        } catch (NotFoundException e) {
            // no leftover from an earlier run
        }
    }

    private String requireStarted() {
        String id = containerId.get();
        if (id == null) {
            throw new EnvironmentNotStartedException(containerName);
        }
        return id;
    }

    private static String decode(ByteArrayOutputStream buffer) {
        synchronized (buffer) {
            return buffer.toString(StandardCharsets.UTF_8);
        }
    }

    private static double elapsed(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    private static void closeQuietly(ResultCallback.Adapter<Frame> callback) {
        try {
            callback.close();
        } catch (IOException e) {
            log.debug("Failed to close exec stream: {}", e.getMessage());
        }
    }
}
