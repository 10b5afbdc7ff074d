package com.fixagent.dispatch.cli;

import com.fixagent.compose.ComposeException;
import com.fixagent.compose.ComposeTaskResult;
import com.fixagent.compose.ComposeTaskRunner;
import com.fixagent.compose.ComposeTaskStatus;
import com.fixagent.core.scheduler.BatchScheduler;
import com.fixagent.core.trial.TrialOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ComposeCommandsTest {

    private static final Path TASKS = Path.of("tasks");

    private ComposeTaskRunner runner;

    @BeforeEach
    void setUp() {
        runner = mock(ComposeTaskRunner.class);
    }

    private static ComposeTaskResult result(String name, ComposeTaskStatus status) {
        return new ComposeTaskResult(name, status, status == ComposeTaskStatus.VERIFIED ? 0 : 1,
                "2024-05-01T10:00:00Z", TASKS.resolve(name).resolve("logs/verifier"));
    }

    @Test
    void runComposePassesFlagsAndMapsVerdict() {
        Path taskDir = TASKS.resolve("widgets_42");
        when(runner.runTask(taskDir, false, false)).thenReturn(result("widgets_42", ComposeTaskStatus.VERIFIED));

        int exit = new CommandLine(new RunComposeCommand(runner))
                .execute("--task", "widgets_42", "--no-follow", "--no-cleanup");

        assertEquals(0, exit);
        verify(runner).runTask(taskDir, false, false);
    }

    @Test
    void runComposeWithoutResultFails() {
        when(runner.runTask(TASKS.resolve("widgets_42"), true, true))
                .thenReturn(result("widgets_42", ComposeTaskStatus.NOT_RUN));

        assertEquals(1, new CommandLine(new RunComposeCommand(runner)).execute("--task", "widgets_42"));
    }

    @Test
    void runComposeMissingTaskFails() {
        when(runner.runTask(TASKS.resolve("absent_1"), true, true))
                .thenThrow(new ComposeException("No docker-compose.yaml found in tasks/absent_1"));

        assertEquals(1, new CommandLine(new RunComposeCommand(runner)).execute("--task", "absent_1"));
    }

    @Test
    void runAllComposeRunsEveryTaskAndFailsOnAnyFailure() {
        Path a = TASKS.resolve("widgets_1");
        Path b = TASKS.resolve("widgets_2");
        when(runner.findTasks(TASKS, "widgets_*", true)).thenReturn(List.of(a, b));
        when(runner.runTask(a, false, true)).thenReturn(result("widgets_1", ComposeTaskStatus.VERIFIED));
        when(runner.runTask(b, false, true)).thenReturn(result("widgets_2", ComposeTaskStatus.FAILED));
        var scheduler = new BatchScheduler(mock(TrialOrchestrator.class), null);

        int exit = new CommandLine(new RunAllComposeCommand(runner, scheduler))
                .execute("--pattern", "widgets_*", "--skip-verified", "-c", "2");

        assertEquals(1, exit);
        verify(runner).runTask(a, false, true);
        verify(runner).runTask(b, false, true);
    }

    @Test
    void runAllComposeWithNothingToDoSucceeds() {
        when(runner.findTasks(TASKS, "*", false)).thenReturn(List.of());

        assertEquals(0, new CommandLine(new RunAllComposeCommand(runner, mock(BatchScheduler.class))).execute());
    }
}
