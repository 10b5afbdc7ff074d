package com.fixagent.dispatch.cli;

import com.fixagent.core.events.EventBus;
import com.fixagent.core.events.TrialEvent;
import com.fixagent.core.model.PrInfo;
import com.fixagent.core.model.TrialConfig;
import com.fixagent.core.model.TrialResult;
import com.fixagent.core.trial.TrialOrchestrator;
import com.fixagent.sandbox.EnvironmentFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: fixagent-verifier run-single --pr-url &lt;url&gt;
 * <p>
 * Verifies one pull request in a fresh sandbox and prints the outcome.
 * Exits 1 unless the build passed.
 */
@Command(name = "run-single", mixinStandardHelpOptions = true, description = "Verify a single PR by URL")
@Component
public class RunSingleCommand implements Callable<Integer> {

    @Option(names = "--pr-url", required = true, description = "GitHub PR URL to verify")
    private String prUrl;

    @Mixin
    private TrialOptionsMixin options = new TrialOptionsMixin();

    private final TrialConfigFactory trialConfigFactory;
    private final TrialOrchestrator orchestrator;
    private final EventBus eventBus;

    public RunSingleCommand(TrialConfigFactory trialConfigFactory, TrialOrchestrator orchestrator,
                            EventBus eventBus) {
        this.trialConfigFactory = trialConfigFactory;
        this.orchestrator = orchestrator;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner("Automated PR Verification through Docker Isolation");

        ConsoleOutput.step(1, "Fetching PR information...");
        ConsoleOutput.detail("PR URL: " + prUrl);
        PrInfo pr;
        TrialConfig config;
        try {
            pr = trialConfigFactory.fetchPrInfo(prUrl);
            config = trialConfigFactory.create(pr, options.toTrialOptions());
        } catch (RuntimeException e) {
            ConsoleOutput.error("Failed to fetch PR info: " + e.getMessage());
            return 1;
        }
        ConsoleOutput.success("PR #" + pr.prNumber() + ": " + pr.title());
        ConsoleOutput.success("Repository: " + pr.repoOwner() + "/" + pr.repoName());
        ConsoleOutput.success("Source: " + pr.sourceBranch() + " @ " + pr.shortSourceCommit());
        ConsoleOutput.success("Target: " + pr.targetBranch() + " @ " + pr.shortTargetCommit());

        var progress = eventBus.subscribe(config.trialId().toString(), event -> printProgress(config, event));
        Thread cancelOnExit = new Thread(orchestrator::cancelAll, "cancel-on-exit");
        Runtime.getRuntime().addShutdownHook(cancelOnExit);
        TrialResult result;
        try {
            result = orchestrator.runTrial(config);
        } finally {
            removeHook(cancelOnExit);
            progress.unsubscribe();
        }

        ConsoleOutput.step(5, "Results");
        ConsoleOutput.trialResult(result);
        return result.isSuccess() ? 0 : 1;
    }

    private static void printProgress(TrialConfig config, TrialEvent event) {
        switch (event.state()) {
            case ENVIRONMENT_STARTING -> {
                ConsoleOutput.step(2, "Starting Docker environment...");
                ConsoleOutput.detail("Sandbox: " + EnvironmentFactory.sandboxName(config));
                ConsoleOutput.detail("Resources: " + config.environment().cpus() + " CPUs, "
                        + config.environment().memoryMb() + "MB RAM");
            }
            case WORKSPACE_SETUP -> ConsoleOutput.step(3, "Cloning and merging PR...");
            case VERIFYING -> {
                ConsoleOutput.step(4, "Running verification...");
                ConsoleOutput.detail("Verifier: " + event.data().get("verifier"));
                ConsoleOutput.detail("Timeout: " + config.verifier().timeoutSeconds() + "s");
            }
            default -> {
            }
        }
    }

    static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM already shutting down; the hook is running
        }
    }
}
