package com.fixagent.dispatch.cli;

import com.fixagent.core.events.EventBus;
import com.fixagent.core.model.PrInfo;
import com.fixagent.core.model.ProjectType;
import com.fixagent.core.model.TestFixtures;
import com.fixagent.core.model.TrialConfig;
import com.fixagent.core.scheduler.BatchScheduler;
import com.fixagent.core.scheduler.BatchSummary;
import com.fixagent.github.InvalidPrUrlException;
import com.fixagent.sandbox.SandboxProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class RunBatchCommandTest {

    @TempDir
    Path workDir;

    private TrialConfigFactory factory;
    private BatchScheduler scheduler;
    private RunBatchCommand command;

    @BeforeEach
    void setUp() {
        factory = mock(TrialConfigFactory.class);
        scheduler = mock(BatchScheduler.class);
        command = new RunBatchCommand(factory, scheduler, new SandboxProperties(), new EventBus());
        when(factory.fetchPrInfo(anyString())).thenAnswer(inv -> {
            String url = inv.getArgument(0);
            return TestFixtures.prInfo(Integer.parseInt(url.substring(url.lastIndexOf('/') + 1)));
        });
        when(factory.create(any(PrInfo.class), any())).thenAnswer(inv -> {
            PrInfo pr = inv.getArgument(0);
            return TestFixtures.trialConfig(workDir, ProjectType.JAVA_GRADLE, pr.prNumber(), 600);
        });
    }

    @Test
    void readsUrlFileSkippingCommentsAndDuplicates() throws Exception {
        Path file = workDir.resolve("prs.txt");
        Files.writeString(file, """
                # nightly batch
                https://github.com/acme/widgets/pull/1

                https://github.com/acme/widgets/pull/2
                https://github.com/acme/widgets/pull/1
                """);
        new CommandLine(command).parseArgs("--file", file.toString(), "--pr-url", "https://github.com/acme/widgets/pull/3");

        assertEquals(List.of(
                "https://github.com/acme/widgets/pull/3",
                "https://github.com/acme/widgets/pull/1",
                "https://github.com/acme/widgets/pull/2"), command.collectUrls());
    }

    @Test
    void allPassingExitsZeroAndUsesConcurrency() {
        when(scheduler.runTrials(anyList(), anyInt())).thenReturn(
                new BatchSummary(2, 2, 0, List.of(), Map.of("a", true, "b", true), Map.of()));

        int exit = new CommandLine(command).execute(
                "--pr-url", "https://github.com/acme/widgets/pull/1",
                "--pr-url", "https://github.com/acme/widgets/pull/2", "-c", "3");

        assertEquals(0, exit);
        verify(scheduler).runTrials(argThat((List<TrialConfig> trials) -> trials.size() == 2), eq(3));
    }

    @Test
    void unresolvedUrlFailsTheBatch() {
        doThrow(new InvalidPrUrlException("bogus")).when(factory).fetchPrInfo("bogus");
        when(scheduler.runTrials(anyList(), anyInt())).thenReturn(
                new BatchSummary(1, 1, 0, List.of(), Map.of("a", true), Map.of()));

        int exit = new CommandLine(command).execute(
                "--pr-url", "https://github.com/acme/widgets/pull/1", "--pr-url", "bogus");

        assertEquals(1, exit);
        verify(scheduler).runTrials(argThat((List<TrialConfig> trials) -> trials.size() == 1), eq(4));
    }

    @Test
    void failedTrialExitsOne() {
        when(scheduler.runTrials(anyList(), anyInt())).thenReturn(
                new BatchSummary(1, 0, 1, List.of("a"), Map.of("a", false), Map.of()));

        assertEquals(1, new CommandLine(command).execute("--pr-url", "https://github.com/acme/widgets/pull/1"));
    }

    @Test
    void noUrlsExitsOne() {
        assertEquals(1, new CommandLine(command).execute());
        verifyNoInteractions(scheduler);
    }
}
