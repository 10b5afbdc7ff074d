package com.fixagent.dispatch.cli;

import com.fixagent.core.events.EventBus;
import com.fixagent.core.model.ExceptionInfo;
import com.fixagent.core.model.PrInfo;
import com.fixagent.core.model.ProjectType;
import com.fixagent.core.model.TestFixtures;
import com.fixagent.core.model.TrialConfig;
import com.fixagent.core.model.TrialResult;
import com.fixagent.core.model.VerificationResult;
import com.fixagent.core.trial.TrialOrchestrator;
import com.fixagent.github.InvalidPrUrlException;
import com.fixagent.sandbox.ProvisioningException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class RunSingleCommandTest {

    private static final String URL = "https://github.com/acme/widgets/pull/42";

    @TempDir
    Path outputDir;

    private TrialConfigFactory factory;
    private TrialOrchestrator orchestrator;
    private CommandLine cli;

    @BeforeEach
    void setUp() {
        factory = mock(TrialConfigFactory.class);
        orchestrator = mock(TrialOrchestrator.class);
        cli = new CommandLine(new RunSingleCommand(factory, orchestrator, new EventBus()));
    }

    private TrialConfig stubConfig() {
        PrInfo pr = TestFixtures.prInfo(42);
        TrialConfig config = TestFixtures.trialConfig(outputDir, ProjectType.JAVA_GRADLE);
        when(factory.fetchPrInfo(URL)).thenReturn(pr);
        when(factory.create(eq(pr), any())).thenReturn(config);
        return config;
    }

    @Test
    void passingBuildExitsZero() {
        TrialConfig config = stubConfig();
        TrialResult result = TrialResult.start(config, Instant.now());
        result.setVerificationResult(new VerificationResult(true, "BUILD SUCCESSFUL", 12.0, null,
                List.of("clean", "build")));
        result.setFinishedAt(Instant.now());
        when(orchestrator.runTrial(config)).thenReturn(result);

        assertEquals(0, cli.execute("--pr-url", URL));
    }

    @Test
    void infrastructureFailureExitsOne() {
        TrialConfig config = stubConfig();
        TrialResult result = TrialResult.start(config, Instant.now());
        result.setExceptionInfo(ExceptionInfo.from(new ProvisioningException("no docker")));
        result.setFinishedAt(Instant.now());
        when(orchestrator.runTrial(config)).thenReturn(result);

        assertEquals(1, cli.execute("--pr-url", URL));
    }

    @Test
    void unresolvablePrExitsOneWithoutRunning() {
        when(factory.fetchPrInfo("not-a-pr")).thenThrow(new InvalidPrUrlException("not-a-pr"));

        assertEquals(1, cli.execute("--pr-url", "not-a-pr"));
        verifyNoInteractions(orchestrator);
    }

    @Test
    void optionsReachTheFactory() {
        TrialConfig config = stubConfig();
        TrialResult result = TrialResult.start(config, Instant.now());
        result.setFinishedAt(Instant.now());
        when(orchestrator.runTrial(config)).thenReturn(result);

        cli.execute("--pr-url", URL, "--project-type", "maven", "--cpus", "8", "--no-internet", "--retries", "0");

        verify(factory).create(any(), argThat(options -> options.projectType() == ProjectType.JAVA_MAVEN
                && options.cpus() == 8
                && Boolean.FALSE.equals(options.allowInternet())
                && options.retryAttempts() == 0));
    }

    @Test
    void prUrlIsRequired() {
        assertEquals(CommandLine.ExitCode.USAGE, cli.execute());
    }
}
