package com.fixagent.github;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fixagent.core.model.PrInfo;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class GitHubClientTest {

    private static final String PR_JSON = """
            {
              "title": "Add login page",
              "state": "open",
              "head": {
                "ref": "feature/login",
                "sha": "a1b2c3",
                "repo": {"clone_url": "https://github.com/contributor/widgets.git"}
              },
              "base": {
                "ref": "main",
                "sha": "0f9e8d",
                "repo": {"clone_url": "https://github.com/acme/widgets.git"}
              }
            }
            """;

    private HttpServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    private String serve(String path, int status, String body, AtomicReference<String> authHeader) throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext(path, exchange -> {
            if (authHeader != null) {
                authHeader.set(exchange.getRequestHeaders().getFirst("Authorization"));
            }
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length);
            exchange.getResponseBody().write(bytes);
            exchange.close();
        });
        server.start();
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @Test
    void parsesPrUrl() {
        var coords = GitHubClient.parsePrUrl("https://github.com/acme/widgets/pull/42");

        assertEquals("acme", coords.owner());
        assertEquals("widgets", coords.repo());
        assertEquals(42, coords.number());
    }

    @Test
    void parsesPrUrlWithTrailingPath() {
        assertEquals(7, GitHubClient.parsePrUrl("https://github.com/acme/widgets/pull/7/files").number());
    }

    @Test
    void rejectsNonPrUrls() {
        var ex = assertThrows(InvalidPrUrlException.class,
                () -> GitHubClient.parsePrUrl("https://github.com/acme/widgets/issues/42"));
        assertEquals("Invalid GitHub PR URL: https://github.com/acme/widgets/issues/42", ex.getMessage());
        assertThrows(InvalidPrUrlException.class, () -> GitHubClient.parsePrUrl(null));
    }

    @Test
    void mapsPullRequestPayload() throws Exception {
        JsonNode json = new ObjectMapper().readTree(PR_JSON);
        String url = "https://github.com/acme/widgets/pull/42";

        PrInfo pr = GitHubClient.toPrInfo(url, GitHubClient.parsePrUrl(url), json);

        assertEquals("feature/login", pr.sourceBranch());
        assertEquals("a1b2c3", pr.sourceCommit());
        assertEquals("https://github.com/contributor/widgets.git", pr.sourceRepoUrl());
        assertEquals("main", pr.targetBranch());
        assertEquals("0f9e8d", pr.targetCommit());
        assertEquals("https://github.com/acme/widgets.git", pr.targetRepoUrl());
        assertEquals("Add login page", pr.title());
        assertEquals("open", pr.state());
    }

    @Test
    void deletedForkFallsBackToBaseRepository() throws Exception {
        JsonNode json = new ObjectMapper().readTree(PR_JSON.replace(
                "\"repo\": {\"clone_url\": \"https://github.com/contributor/widgets.git\"}", "\"repo\": null"));
        String url = "https://github.com/acme/widgets/pull/42";

        PrInfo pr = GitHubClient.toPrInfo(url, GitHubClient.parsePrUrl(url), json);

        assertEquals("https://github.com/acme/widgets.git", pr.sourceRepoUrl());
    }

    @Test
    void fetchesPrInfoWithToken() throws Exception {
        var auth = new AtomicReference<String>();
        String baseUrl = serve("/repos/acme/widgets/pulls/42", 200, PR_JSON, auth);

        PrInfo pr = new GitHubClient("secret", baseUrl + "/").getPrInfo("https://github.com/acme/widgets/pull/42");

        assertEquals(42, pr.prNumber());
        assertEquals("acme", pr.repoOwner());
        assertEquals("Bearer secret", auth.get());
    }

    @Test
    void errorStatusBecomesApiException() throws Exception {
        String baseUrl = serve("/repos/acme/widgets/pulls/42", 404, "{\"message\":\"Not Found\"}", null);
        var client = new GitHubClient(null, baseUrl);

        var ex = assertThrows(GitHubApiException.class,
                () -> client.getPrInfo("https://github.com/acme/widgets/pull/42"));
        assertEquals(404, ex.getStatusCode());
    }

    @Test
    void requestsCarryGitHubHeaders() {
        var api = new GitHubApi("", "https://api.github.com");

        var request = api.buildGet("/repos/acme/widgets", Duration.ofSeconds(5));

        assertEquals("application/vnd.github+json", request.headers().firstValue("Accept").orElseThrow());
        assertEquals("2022-11-28", request.headers().firstValue("X-GitHub-Api-Version").orElseThrow());
        assertTrue(request.headers().firstValue("Authorization").isEmpty());
    }

    @Test
    void cloneUrlUsesHttps() {
        assertEquals("https://github.com/acme/widgets.git", GitHubClient.cloneUrl("acme", "widgets"));
    }
}
