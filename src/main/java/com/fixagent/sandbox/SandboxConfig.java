package com.fixagent.sandbox;

import com.fixagent.github.GitHubClient;
import com.fixagent.github.ProjectDetector;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.zerodep.ZerodepDockerHttpClient;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class SandboxConfig {

    /** Docker connections kept per concurrent trial: one exec stream plus control calls. */
    static final int CONNECTIONS_PER_TRIAL = 4;

    @Bean
    public DockerClient dockerClient(SandboxProperties properties) {
        var config = DefaultDockerClientConfig.createDefaultConfigBuilder()
                .withDockerHost(resolveDockerHost(System.getenv("DOCKER_HOST"), properties.getDockerHost()))
                .build();
        var httpClient = new ZerodepDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .maxConnections(Math.max(16, properties.getConcurrency() * CONNECTIONS_PER_TRIAL))
                .connectionTimeout(Duration.ofSeconds(30))
                .build();
        return DockerClientImpl.getInstance(config, httpClient);
    }

    /** {@code DOCKER_HOST} overrides {@code fixagent.docker.host}. */
    static String resolveDockerHost(String environmentHost, String configuredHost) {
        return environmentHost != null && !environmentHost.isBlank() ? environmentHost : configuredHost;
    }

    @Bean
    public GitHubClient gitHubClient(SandboxProperties properties) {
        return new GitHubClient(properties.getGithubToken(), properties.getGithubApiUrl());
    }

    @Bean
    public ProjectDetector projectDetector(SandboxProperties properties) {
        return new ProjectDetector(properties.getGithubToken(), properties.getGithubApiUrl());
    }

    /** Registry used when no Micrometer backend is on the classpath. */
    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
