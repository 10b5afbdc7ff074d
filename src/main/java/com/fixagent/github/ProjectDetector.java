package com.fixagent.github;

import com.fasterxml.jackson.databind.JsonNode;
import com.fixagent.core.model.ProjectType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Guesses a repository's {@link ProjectType} from the files at its root,
 * falling back to its primary language.
 */
public class ProjectDetector {

    private static final Logger log = LoggerFactory.getLogger(ProjectDetector.class);

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

    /** Indicator files per type, checked in declaration order. */
    static final Map<ProjectType, List<String>> RULES = new LinkedHashMap<>();
    static {
        RULES.put(ProjectType.JAVA_GRADLE,
                List.of("build.gradle", "build.gradle.kts", "gradlew", "settings.gradle", "settings.gradle.kts"));
        RULES.put(ProjectType.JAVA_MAVEN, List.of("pom.xml"));
        RULES.put(ProjectType.NODEJS_NPM, List.of("package-lock.json"));
        RULES.put(ProjectType.NODEJS_YARN, List.of("yarn.lock"));
        RULES.put(ProjectType.PYTHON_PIP, List.of("requirements.txt", "setup.py"));
        RULES.put(ProjectType.PYTHON_POETRY, List.of("poetry.lock"));
        RULES.put(ProjectType.RUST_CARGO, List.of("Cargo.toml"));
        RULES.put(ProjectType.GO_MOD, List.of("go.mod"));
        RULES.put(ProjectType.DOTNET, List.of("*.csproj", "*.sln"));
        RULES.put(ProjectType.RUBY_BUNDLER, List.of("Gemfile.lock"));
    }

    static final Map<String, ProjectType> LANGUAGES = Map.of(
            "Java", ProjectType.JAVA_GRADLE,
            "JavaScript", ProjectType.NODEJS_NPM,
            "TypeScript", ProjectType.NODEJS_NPM,
            "Python", ProjectType.PYTHON_PIP,
            "Rust", ProjectType.RUST_CARGO,
            "Go", ProjectType.GO_MOD,
            "C#", ProjectType.DOTNET,
            "Ruby", ProjectType.RUBY_BUNDLER);

    private final GitHubApi api;

    public ProjectDetector(String token, String baseUrl) {
        this.api = new GitHubApi(token, baseUrl);
    }

    /**
     * Detects the type of a remote repository at the given branch. Never throws;
     * returns {@link ProjectType#UNKNOWN} when nothing matches or the API is unreachable.
     */
    public ProjectType detect(String owner, String repo, String branch) {
        String ref = branch != null && !branch.isBlank() ? branch : "main";
        try {
            JsonNode contents = api.get("/repos/%s/%s/contents?ref=%s"
                    .formatted(owner, repo, URLEncoder.encode(ref, StandardCharsets.UTF_8)), REQUEST_TIMEOUT);
            var fileNames = new ArrayList<String>();
            for (JsonNode entry : contents) {
                if ("file".equals(entry.path("type").asText())) {
                    fileNames.add(entry.path("name").asText());
                }
            }
            Optional<ProjectType> matched = matchRules(fileNames);
            if (matched.isPresent()) {
                log.info("Detected {} for {}/{} from root files", matched.get().id(), owner, repo);
                return matched.get();
            }
        } catch (GitHubApiException e) {
            log.warn("Could not list {}/{}@{}: {}; falling back to language detection",
                    owner, repo, ref, e.getMessage());
        }
        return detectFromLanguage(owner, repo);
    }

    /** Detects the type of a checked-out repository. */
    public ProjectType detectLocal(Path repoDir) {
        try (Stream<Path> children = Files.list(repoDir)) {
            List<String> names = children
                    .filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .toList();
            return matchRules(names).orElse(ProjectType.UNKNOWN);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + repoDir, e);
        }
    }

    private ProjectType detectFromLanguage(String owner, String repo) {
        try {
            JsonNode languages = api.get("/repos/%s/%s/languages".formatted(owner, repo), REQUEST_TIMEOUT);
            var bytesByLanguage = new LinkedHashMap<String, Long>();
            languages.fields().forEachRemaining(e -> bytesByLanguage.put(e.getKey(), e.getValue().asLong()));
            ProjectType type = fromLanguages(bytesByLanguage);
            log.info("Detected {} for {}/{} from primary language", type.id(), owner, repo);
            return type;
        } catch (GitHubApiException e) {
            log.warn("Could not fetch languages of {}/{}: {}", owner, repo, e.getMessage());
            return ProjectType.UNKNOWN;
        }
    }

    static Optional<ProjectType> matchRules(Collection<String> fileNames) {
        for (var rule : RULES.entrySet()) {
            for (String indicator : rule.getValue()) {
                if (fileNames.stream().anyMatch(name -> matches(indicator, name))) {
                    return Optional.of(rule.getKey());
                }
            }
        }
        return Optional.empty();
    }

    static ProjectType fromLanguages(Map<String, Long> bytesByLanguage) {
        return bytesByLanguage.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .map(e -> LANGUAGES.getOrDefault(e.getKey(), ProjectType.UNKNOWN))
                .orElse(ProjectType.UNKNOWN);
    }

    private static boolean matches(String indicator, String fileName) {
        if (indicator.startsWith("*")) {
            return fileName.endsWith(indicator.substring(1));
        }
        return indicator.equals(fileName);
    }
}
