package com.fixagent.sandbox;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "fixagent")
public class SandboxProperties {

    private Docker docker = new Docker();
    private Trial trial = new Trial();
    private Batch batch = new Batch();
    private Github github = new Github();

    // -- Docker accessors (delegate to nested) --
    public String getDockerHost() { return docker.host; }
    public String getImagePrefix() { return docker.imagePrefix; }
    public String getDockerfileDir() { return docker.dockerfileDir; }
    public String getWorkingDir() { return docker.workingDir; }
    public int getStopTimeoutSeconds() { return docker.stopTimeoutSeconds; }

    // -- Trial accessors --
    public String getOutputDir() { return trial.outputDir; }
    public int getCpus() { return trial.cpus; }
    public int getMemoryMb() { return trial.memoryMb; }
    public int getTimeoutSeconds() { return trial.timeoutSeconds; }
    public boolean isAllowInternet() { return trial.allowInternet; }
    public int getRetryAttempts() { return trial.retryAttempts; }
    public int getSetupBudgetSeconds() { return trial.setupBudgetSeconds; }

    public int getConcurrency() { return batch.concurrency; }

    /**
     * GitHub token from configuration, falling back to {@code GITHUB_TOKEN}.
     */
    public String getGithubToken() {
        if (github.token != null && !github.token.isBlank()) {
            return github.token;
        }
        String env = System.getenv("GITHUB_TOKEN");
        return env != null && !env.isBlank() ? env : null;
    }
    public String getGithubApiUrl() { return github.apiUrl; }

    public Docker getDocker() { return docker; }
    public void setDocker(Docker docker) { this.docker = docker; }
    public Trial getTrial() { return trial; }
    public void setTrial(Trial trial) { this.trial = trial; }
    public Batch getBatch() { return batch; }
    public void setBatch(Batch batch) { this.batch = batch; }
    public Github getGithub() { return github; }
    public void setGithub(Github github) { this.github = github; }

    public static class Docker {
        private String host = "unix:///var/run/docker.sock";
        private String imagePrefix = "fixagent-verifier";
        private String dockerfileDir = "";
        private String workingDir = "/workspace";
        private int stopTimeoutSeconds = 10;

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }
        public String getImagePrefix() { return imagePrefix; }
        public void setImagePrefix(String imagePrefix) { this.imagePrefix = imagePrefix; }
        public String getDockerfileDir() { return dockerfileDir; }
        public void setDockerfileDir(String dockerfileDir) { this.dockerfileDir = dockerfileDir; }
        public String getWorkingDir() { return workingDir; }
        public void setWorkingDir(String workingDir) { this.workingDir = workingDir; }
        public int getStopTimeoutSeconds() { return stopTimeoutSeconds; }
        public void setStopTimeoutSeconds(int stopTimeoutSeconds) { this.stopTimeoutSeconds = stopTimeoutSeconds; }
    }

    public static class Trial {
        private String outputDir = "results";
        private int cpus = 2;
        private int memoryMb = 4096;
        private int timeoutSeconds = 1800;
        private boolean allowInternet = true;
        private int retryAttempts = 2;
        private int setupBudgetSeconds = 900;

        public String getOutputDir() { return outputDir; }
        public void setOutputDir(String outputDir) { this.outputDir = outputDir; }
        public int getCpus() { return cpus; }
        public void setCpus(int cpus) { this.cpus = cpus; }
        public int getMemoryMb() { return memoryMb; }
        public void setMemoryMb(int memoryMb) { this.memoryMb = memoryMb; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public boolean isAllowInternet() { return allowInternet; }
        public void setAllowInternet(boolean allowInternet) { this.allowInternet = allowInternet; }
        public int getRetryAttempts() { return retryAttempts; }
        public void setRetryAttempts(int retryAttempts) { this.retryAttempts = retryAttempts; }
        public int getSetupBudgetSeconds() { return setupBudgetSeconds; }
        public void setSetupBudgetSeconds(int setupBudgetSeconds) { this.setupBudgetSeconds = setupBudgetSeconds; }
    }

    public static class Batch {
        private int concurrency = 4;

        public int getConcurrency() { return concurrency; }
        public void setConcurrency(int concurrency) { this.concurrency = concurrency; }
    }

    public static class Github {
        private String token = "";
        private String apiUrl = "https://api.github.com";

        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }
        public String getApiUrl() { return apiUrl; }
        public void setApiUrl(String apiUrl) { this.apiUrl = apiUrl; }
    }
}
