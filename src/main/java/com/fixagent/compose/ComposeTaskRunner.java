package com.fixagent.compose;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Runs pre-generated Docker Compose tasks. A task is a directory holding a
 * {@code docker-compose.yaml} whose verifier service writes its verdict to
 * {@code logs/verifier/result.txt}.
 *
 * <p>Shells out to the {@code docker compose} CLI via {@link ProcessBuilder}.
 */
@Component
public class ComposeTaskRunner {

    private static final Logger log = LoggerFactory.getLogger(ComposeTaskRunner.class);

    public static final String COMPOSE_FILE = "docker-compose.yaml";
    static final String COMPOSE_LOG = "compose.log";

    /** Task directories directly under {@code tasksDir}, sorted by name. */
    public List<Path> listTasks(Path tasksDir) {
        return findTasks(tasksDir, "*", false);
    }

    /**
     * Task directories whose name matches {@code globPattern}, sorted by name.
     *
     * @param skipVerified leave out tasks whose last run verified
     */
    public List<Path> findTasks(Path tasksDir, String globPattern, boolean skipVerified) {
        if (!Files.isDirectory(tasksDir)) {
            return List.of();
        }
        PathMatcher matcher = FileSystems.getDefault()
                .getPathMatcher("glob:" + (globPattern == null || globPattern.isBlank() ? "*" : globPattern));
        try (Stream<Path> children = Files.list(tasksDir)) {
            return children
                    .filter(Files::isDirectory)
                    .filter(dir -> matcher.matches(dir.getFileName()))
                    .filter(dir -> Files.isRegularFile(dir.resolve(COMPOSE_FILE)))
                    .filter(dir -> !skipVerified || ComposeResultReader.status(dir) != ComposeTaskStatus.VERIFIED)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list tasks in " + tasksDir, e);
        }
    }

    /**
     * Runs {@code docker compose up --abort-on-container-exit} in the task directory,
     * then reads the verdict.
     *
     * @param followLogs stream compose output to this process; otherwise it goes to {@code compose.log}
     * @param cleanup    run {@code docker compose down} afterwards, whatever happened
     */
    public ComposeTaskResult runTask(Path taskDir, boolean followLogs, boolean cleanup) {
        if (!Files.isRegularFile(taskDir.resolve(COMPOSE_FILE))) {
            throw new ComposeException("No " + COMPOSE_FILE + " found in " + taskDir);
        }
        String taskName = taskDir.getFileName().toString();
        log.info("Running compose task {}", taskName);
        try {
            int exitCode = runProcess(List.of("docker", "compose", "up", "--abort-on-container-exit"),
                    taskDir, followLogs);
            ComposeTaskResult result = ComposeResultReader.read(taskDir);
            log.info("Compose task {} exited with {}: {}", taskName, exitCode, result.status());
            return result;
        } finally {
            if (cleanup) {
                cleanUp(taskDir);
            }
        }
    }

    /** Task name {@code <repo>_<pr>} yields the PR number, or {@code ?}. */
    public static String prNumber(String taskName) {
        int separator = taskName.lastIndexOf('_');
        return separator > 0 && separator < taskName.length() - 1 ? taskName.substring(separator + 1) : "?";
    }

    /**
     * Runs a command in {@code dir} and returns its exit code.
     */
    protected int runProcess(List<String> command, Path dir, boolean inheritOutput) {
        try {
            var builder = new ProcessBuilder(new ArrayList<>(command))
                    .directory(dir.toFile())
                    .redirectErrorStream(true);
            if (inheritOutput) {
                builder.inheritIO();
            } else {
                builder.redirectOutput(ProcessBuilder.Redirect.appendTo(dir.resolve(COMPOSE_LOG).toFile()));
            }
            return builder.start().waitFor();
        } catch (IOException e) {
            throw new ComposeException("Failed to run " + String.join(" ", command) + " in " + dir, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ComposeException("Interrupted while running " + String.join(" ", command), e);
        }
    }

    private void cleanUp(Path taskDir) {
        try {
            int exit = runProcess(List.of("docker", "compose", "down"), taskDir, false);
            if (exit != 0) {
                log.warn("docker compose down in {} exited with {}", taskDir, exit);
            }
        } catch (ComposeException e) {
            log.warn("Cleanup of {} failed: {}", taskDir, e.getMessage());
        }
    }
}
