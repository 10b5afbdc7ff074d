package com.fixagent.dispatch.cli;

import com.fixagent.core.model.ProjectType;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Trial options shared by {@code run-single} and {@code run-batch}.
 */
public class TrialOptionsMixin {

    @Option(names = "--project-type",
            description = "java-gradle, java-maven, gradle or maven (auto-detected when omitted)")
    String projectType;

    @Option(names = {"--output", "-o"}, description = "Output directory")
    Path outputDir;

    @Option(names = "--cpus", description = "CPU cores")
    Integer cpus;

    @Option(names = "--memory", description = "Memory in MB")
    Integer memoryMb;

    @Option(names = "--timeout", description = "Build timeout in seconds")
    Integer timeoutSeconds;

    @Option(names = "--image", description = "Sandbox image override")
    String image;

    @Option(names = "--script", description = "Custom verification script to run instead of the build tool")
    String customScript;

    @Option(names = "--no-internet", description = "Run the sandbox without network access")
    boolean noInternet;

    @Option(names = "--retries", description = "Re-runs allowed after an infrastructure failure")
    Integer retryAttempts;

    TrialConfigFactory.TrialOptions toTrialOptions() {
        return new TrialConfigFactory.TrialOptions(
                projectType != null ? ProjectType.fromId(projectType) : null,
                outputDir,
                cpus,
                memoryMb,
                timeoutSeconds,
                image,
                customScript,
                noInternet ? Boolean.FALSE : null,
                retryAttempts);
    }
}
