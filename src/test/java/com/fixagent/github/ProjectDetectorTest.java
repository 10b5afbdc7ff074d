package com.fixagent.github;

import com.fixagent.core.model.ProjectType;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ProjectDetectorTest {

    @TempDir
    Path repoDir;

    private HttpServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    private String serve(Map<String, String> bodies) throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        bodies.forEach((path, body) -> server.createContext(path, exchange -> {
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            int status = body.isEmpty() ? 500 : 200;
            exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
            if (bytes.length > 0) {
                exchange.getResponseBody().write(bytes);
            }
            exchange.close();
        }));
        server.start();
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @Test
    void rulesAreCheckedInOrder() {
        assertEquals(Optional.of(ProjectType.JAVA_GRADLE), ProjectDetector.matchRules(List.of("pom.xml", "gradlew")));
        assertEquals(Optional.of(ProjectType.JAVA_MAVEN), ProjectDetector.matchRules(List.of("README.md", "pom.xml")));
        assertEquals(Optional.of(ProjectType.RUST_CARGO), ProjectDetector.matchRules(List.of("Cargo.toml")));
    }

    @Test
    void wildcardRulesMatchSuffix() {
        assertEquals(Optional.of(ProjectType.DOTNET), ProjectDetector.matchRules(List.of("Widgets.csproj")));
        assertEquals(Optional.empty(), ProjectDetector.matchRules(List.of("README.md", "LICENSE")));
    }

    @Test
    void primaryLanguageDecidesFallback() {
        var languages = new LinkedHashMap<String, Long>();
        languages.put("Shell", 1200L);
        languages.put("Go", 98000L);

        assertEquals(ProjectType.GO_MOD, ProjectDetector.fromLanguages(languages));
        assertEquals(ProjectType.UNKNOWN, ProjectDetector.fromLanguages(Map.of("Haskell", 10L)));
        assertEquals(ProjectType.UNKNOWN, ProjectDetector.fromLanguages(Map.of()));
    }

    @Test
    void detectsLocalCheckout() throws Exception {
        Files.writeString(repoDir.resolve("pom.xml"), "<project/>");
        Files.createDirectory(repoDir.resolve("build.gradle"));

        assertEquals(ProjectType.JAVA_MAVEN, new ProjectDetector(null, null).detectLocal(repoDir));
    }

    @Test
    void detectsFromRemoteRootFiles() throws Exception {
        String baseUrl = serve(Map.of("/repos/acme/widgets/contents", """
                [{"name": "src", "type": "dir"}, {"name": "pom.xml", "type": "file"}]
                """));

        assertEquals(ProjectType.JAVA_MAVEN, new ProjectDetector(null, baseUrl).detect("acme", "widgets", null));
    }

    @Test
    void fallsBackToLanguagesWhenContentsFail() throws Exception {
        String baseUrl = serve(Map.of(
                "/repos/acme/widgets/contents", "",
                "/repos/acme/widgets/languages", "{\"TypeScript\": 5000, \"CSS\": 300}"));

        assertEquals(ProjectType.NODEJS_NPM, new ProjectDetector(null, baseUrl).detect("acme", "widgets", "dev"));
    }

    @Test
    void unreachableApiYieldsUnknown() {
        var detector = new ProjectDetector(null, "http://127.0.0.1:1");

        assertEquals(ProjectType.UNKNOWN, detector.detect("acme", "widgets", "main"));
    }
}
