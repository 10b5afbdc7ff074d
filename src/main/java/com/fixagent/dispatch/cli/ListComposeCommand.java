package com.fixagent.dispatch.cli;

import com.fixagent.compose.ComposeResultReader;
import com.fixagent.compose.ComposeTaskRunner;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.List;

/**
 * CLI command: fixagent-verifier list-compose
 */
@Command(name = "list-compose", mixinStandardHelpOptions = true, description = "List docker-compose tasks")
@Component
public class ListComposeCommand implements Runnable {

    @Option(names = "--tasks-dir", defaultValue = "tasks", description = "Tasks directory (default: ${DEFAULT-VALUE})")
    private Path tasksDir;

    @Option(names = "--no-status", description = "Hide verification status")
    private boolean noStatus;

    private final ComposeTaskRunner runner;

    public ListComposeCommand(ComposeTaskRunner runner) {
        this.runner = runner;
    }

    @Override
    public void run() {
        List<Path> taskDirs = runner.listTasks(tasksDir);
        if (taskDirs.isEmpty()) {
            ConsoleOutput.warn("No tasks found");
            return;
        }

        System.out.println("Docker Compose Tasks (" + taskDirs.size() + ")");
        System.out.println();
        System.out.printf("  %-40s %-8s %s%n", "TASK", "PR", noStatus ? "" : "STATUS");
        for (Path taskDir : taskDirs) {
            String name = taskDir.getFileName().toString();
            String status = noStatus ? "" : ConsoleOutput.statusLabel(ComposeResultReader.status(taskDir));
            System.out.printf("  %-40s %-8s %s%n", name, "#" + ComposeTaskRunner.prNumber(name), status);
        }
    }
}
