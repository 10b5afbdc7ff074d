package com.fixagent.compose;

import java.nio.file.Path;

/**
 * What a compose task left behind in its {@code logs/verifier} directory.
 *
 * @param taskName  directory name of the task, e.g. {@code springboot-demo_42}
 * @param status    verification state
 * @param exitCode  content of {@code exit_code.txt}, or null when absent or not a number
 * @param timestamp content of {@code timestamp.txt}, or null
 * @param resultDir the {@code logs/verifier} directory
 */
public record ComposeTaskResult(
    String taskName,
    ComposeTaskStatus status,
    Integer exitCode,
    String timestamp,
    Path resultDir
) {

    public boolean verified() {
        return status == ComposeTaskStatus.VERIFIED;
    }
}
