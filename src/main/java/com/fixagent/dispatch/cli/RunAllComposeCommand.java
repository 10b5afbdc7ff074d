package com.fixagent.dispatch.cli;

import com.fixagent.compose.ComposeTaskRunner;
import com.fixagent.core.scheduler.BatchScheduler;
import com.fixagent.core.scheduler.BatchSummary;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: fixagent-verifier run-all-compose
 * <p>
 * Runs every matching compose task in parallel. Output of each task goes
 * to its {@code compose.log}; containers are always cleaned up.
 */
@Command(name = "run-all-compose", mixinStandardHelpOptions = true,
        description = "Run all docker-compose tasks in parallel")
@Component
public class RunAllComposeCommand implements Callable<Integer> {

    @Option(names = "--tasks-dir", defaultValue = "tasks", description = "Tasks directory (default: ${DEFAULT-VALUE})")
    private Path tasksDir;

    @Option(names = {"--concurrent", "-c"}, defaultValue = "4", description = "Concurrent tasks (default: ${DEFAULT-VALUE})")
    private int concurrency;

    @Option(names = "--pattern", defaultValue = "*", description = "Task name glob (default: ${DEFAULT-VALUE})")
    private String pattern;

    @Option(names = "--skip-verified", description = "Skip tasks that already verified")
    private boolean skipVerified;

    private final ComposeTaskRunner runner;
    private final BatchScheduler scheduler;

    public RunAllComposeCommand(ComposeTaskRunner runner, BatchScheduler scheduler) {
        this.runner = runner;
        this.scheduler = scheduler;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner("Batch Docker Compose Execution");

        List<Path> taskDirs = runner.findTasks(tasksDir, pattern, skipVerified);
        if (taskDirs.isEmpty()) {
            ConsoleOutput.warn("No tasks found matching criteria");
            return 0;
        }
        ConsoleOutput.info("Found " + taskDirs.size() + " tasks to run");
        ConsoleOutput.detail("Concurrency: " + concurrency);
        ConsoleOutput.detail("Pattern: " + pattern);

        var tasks = new LinkedHashMap<String, Callable<Boolean>>();
        for (Path taskDir : taskDirs) {
            tasks.put(taskDir.getFileName().toString(), () -> {
                boolean verified = runner.runTask(taskDir, false, true).verified();
                ConsoleOutput.unitOutcome(taskDir.getFileName().toString(), verified);
                return verified;
            });
        }

        BatchSummary summary = scheduler.runTasks(tasks, concurrency);
        ConsoleOutput.batchSummary(summary);
        return summary.allSucceeded() ? 0 : 1;
    }
}
