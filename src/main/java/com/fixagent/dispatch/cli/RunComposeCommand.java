package com.fixagent.dispatch.cli;

import com.fixagent.compose.ComposeException;
import com.fixagent.compose.ComposeTaskResult;
import com.fixagent.compose.ComposeTaskRunner;
import com.fixagent.compose.ComposeTaskStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: fixagent-verifier run-compose --task &lt;name&gt;
 * <p>
 * Runs one pre-generated compose task and reports its verdict.
 */
@Command(name = "run-compose", mixinStandardHelpOptions = true, description = "Run a docker-compose based task")
@Component
public class RunComposeCommand implements Callable<Integer> {

    @Option(names = "--task", required = true, description = "Task name, e.g. springboot-demo_42")
    private String task;

    @Option(names = "--tasks-dir", defaultValue = "tasks", description = "Tasks directory (default: ${DEFAULT-VALUE})")
    private Path tasksDir;

    @Option(names = "--no-follow", description = "Write compose output to compose.log instead of the terminal")
    private boolean noFollow;

    @Option(names = "--no-cleanup", description = "Keep containers after the run")
    private boolean noCleanup;

    private final ComposeTaskRunner runner;

    public RunComposeCommand(ComposeTaskRunner runner) {
        this.runner = runner;
    }

    @Override
    public Integer call() {
        Path taskDir = tasksDir.resolve(task);
        ConsoleOutput.info("Running task: " + task);
        ComposeTaskResult result;
        try {
            result = runner.runTask(taskDir, !noFollow, !noCleanup);
        } catch (ComposeException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        System.out.println();
        if (result.status() == ComposeTaskStatus.NOT_RUN) {
            ConsoleOutput.warn("No result file found");
            return 1;
        }
        if (result.verified()) {
            ConsoleOutput.success("Verification PASSED");
        } else {
            ConsoleOutput.error("Verification FAILED");
        }
        if (result.exitCode() != null) {
            ConsoleOutput.detail("Exit code: " + result.exitCode());
        }
        ConsoleOutput.detail("Results: " + result.resultDir());
        return result.verified() ? 0 : 1;
    }
}
