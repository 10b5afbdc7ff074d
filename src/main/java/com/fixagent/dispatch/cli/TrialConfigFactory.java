package com.fixagent.dispatch.cli;

import com.fixagent.core.model.EnvironmentBackend;
import com.fixagent.core.model.EnvironmentConfig;
import com.fixagent.core.model.PrInfo;
import com.fixagent.core.model.Priority;
import com.fixagent.core.model.ProjectType;
import com.fixagent.core.model.TaskConfig;
import com.fixagent.core.model.TrialConfig;
import com.fixagent.core.model.VerifierConfig;
import com.fixagent.github.PrInfoProvider;
import com.fixagent.github.ProjectDetector;
import com.fixagent.sandbox.SandboxProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.UUID;

/**
 * Builds {@link TrialConfig}s from PR metadata and command-line options,
 * filling unset options from {@link SandboxProperties}.
 */
@Component
public class TrialConfigFactory {

    private static final Logger log = LoggerFactory.getLogger(TrialConfigFactory.class);

    private final PrInfoProvider prInfoProvider;
    private final ProjectDetector projectDetector;
    private final SandboxProperties properties;

    public TrialConfigFactory(PrInfoProvider prInfoProvider, ProjectDetector projectDetector,
                              SandboxProperties properties) {
        this.prInfoProvider = prInfoProvider;
        this.projectDetector = projectDetector;
        this.properties = properties;
    }

    /**
     * Per-run overrides; null fields fall back to configuration.
     */
    public record TrialOptions(
        ProjectType projectType,
        Path outputDir,
        Integer cpus,
        Integer memoryMb,
        Integer timeoutSeconds,
        String image,
        String customScript,
        Boolean allowInternet,
        Integer retryAttempts
    ) {
        public static TrialOptions defaults() {
            return new TrialOptions(null, null, null, null, null, null, null, null, null);
        }
    }

    public PrInfo fetchPrInfo(String prUrl) {
        return prInfoProvider.getPrInfo(prUrl);
    }

    public TrialConfig create(PrInfo pr, TrialOptions options) {
        ProjectType type = resolveProjectType(pr, options.projectType());
        var task = new TaskConfig(
                "pr-" + pr.prNumber(),
                pr.prUrl(),
                type,
                orDefault(options.timeoutSeconds(), properties.getTimeoutSeconds()),
                orDefault(options.cpus(), properties.getCpus()),
                orDefault(options.memoryMb(), properties.getMemoryMb()),
                options.allowInternet() != null ? options.allowInternet() : properties.isAllowInternet(),
                options.customScript(),
                Priority.MEDIUM);

        var environment = new EnvironmentConfig(EnvironmentBackend.DOCKER, task.cpus(), task.memoryMb(),
                task.allowInternet(), options.image());
        Path outputDir = options.outputDir() != null ? options.outputDir() : Path.of(properties.getOutputDir());
        String trialName = task.taskId() + "__trial-" + UUID.randomUUID().toString().substring(0, 8);

        return new TrialConfig(UUID.randomUUID(), trialName, task, pr, environment,
                VerifierConfig.from(task), outputDir,
                orDefault(options.retryAttempts(), properties.getRetryAttempts()));
    }

    /**
     * Explicit type wins; otherwise detect from the target branch. An
     * undetectable project is treated as Gradle.
     */
    ProjectType resolveProjectType(PrInfo pr, ProjectType explicit) {
        if (explicit != null) {
            return explicit;
        }
        ProjectType detected = projectDetector.detect(pr.repoOwner(), pr.repoName(), pr.targetBranch());
        if (detected == ProjectType.UNKNOWN) {
            log.warn("Could not detect project type of {}/{}; assuming {}",
                    pr.repoOwner(), pr.repoName(), ProjectType.JAVA_GRADLE.id());
            return ProjectType.JAVA_GRADLE;
        }
        return detected;
    }

    private static int orDefault(Integer value, int fallback) {
        return value != null ? value : fallback;
    }
}
