package com.fixagent.dispatch.cli;

import com.fixagent.core.events.EventBus;
import com.fixagent.core.model.PrInfo;
import com.fixagent.core.model.TrialConfig;
import com.fixagent.core.scheduler.BatchScheduler;
import com.fixagent.core.scheduler.BatchSummary;
import com.fixagent.core.trial.TrialState;
import com.fixagent.sandbox.SandboxProperties;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: fixagent-verifier run-batch --pr-url &lt;url&gt;... | --file urls.txt
 * <p>
 * Verifies many pull requests with bounded parallelism. Exits 1 if any
 * PR could not be resolved or any trial failed.
 */
@Command(name = "run-batch", mixinStandardHelpOptions = true, description = "Verify many PRs in parallel")
@Component
public class RunBatchCommand implements Callable<Integer> {

    @Option(names = "--pr-url", description = "GitHub PR URL (repeatable)")
    private List<String> prUrls = new ArrayList<>();

    @Option(names = "--file", description = "File with one PR URL per line; blank lines and # comments are ignored")
    private Path urlFile;

    @Option(names = {"--concurrent", "-c"}, description = "Trials run at once (default: fixagent.batch.concurrency)")
    private Integer concurrency;

    @Mixin
    private TrialOptionsMixin options = new TrialOptionsMixin();

    private final TrialConfigFactory trialConfigFactory;
    private final BatchScheduler scheduler;
    private final SandboxProperties properties;
    private final EventBus eventBus;

    public RunBatchCommand(TrialConfigFactory trialConfigFactory, BatchScheduler scheduler,
                           SandboxProperties properties, EventBus eventBus) {
        this.trialConfigFactory = trialConfigFactory;
        this.scheduler = scheduler;
        this.properties = properties;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner("Batch PR Verification");

        List<String> urls;
        try {
            urls = collectUrls();
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read " + urlFile + ": " + e.getMessage());
            return 1;
        }
        if (urls.isEmpty()) {
            ConsoleOutput.error("No PR URLs given; use --pr-url or --file");
            return 1;
        }

        int unresolved = 0;
        var trials = new ArrayList<TrialConfig>();
        var trialOptions = options.toTrialOptions();
        for (String url : urls) {
            try {
                PrInfo pr = trialConfigFactory.fetchPrInfo(url);
                trials.add(trialConfigFactory.create(pr, trialOptions));
                ConsoleOutput.success("PR #" + pr.prNumber() + " of " + pr.repoOwner() + "/" + pr.repoName());
            } catch (RuntimeException e) {
                unresolved++;
                ConsoleOutput.error(url + ": " + e.getMessage());
            }
        }

        int c = concurrency != null ? concurrency : properties.getConcurrency();
        ConsoleOutput.info("Running " + trials.size() + " trial(s), concurrency " + c);

        // retried attempts report under their own __retry-N names
        var progress = eventBus.subscribeToState(TrialState.FINALIZED, event ->
                ConsoleOutput.unitOutcome(event.trialName(), Boolean.TRUE.equals(event.data().get("success"))));
        Thread cancelOnExit = new Thread(scheduler::cancel, "cancel-batch-on-exit");
        Runtime.getRuntime().addShutdownHook(cancelOnExit);
        BatchSummary summary;
        try {
            summary = scheduler.runTrials(trials, c);
        } finally {
            RunSingleCommand.removeHook(cancelOnExit);
            progress.unsubscribe();
        }

        ConsoleOutput.batchSummary(summary);
        if (unresolved > 0) {
            ConsoleOutput.warn(unresolved + " PR URL(s) could not be resolved");
        }
        return summary.allSucceeded() && unresolved == 0 ? 0 : 1;
    }

    List<String> collectUrls() throws IOException {
        var urls = new LinkedHashSet<>(prUrls);
        if (urlFile != null) {
            for (String line : Files.readAllLines(urlFile, StandardCharsets.UTF_8)) {
                String trimmed = line.strip();
                if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                    urls.add(trimmed);
                }
            }
        }
        return new ArrayList<>(urls);
    }
}
