package com.fixagent.github;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Minimal GitHub REST transport shared by {@link GitHubClient} and {@link ProjectDetector}.
 */
class GitHubApi {

    static final String MEDIA_TYPE = "application/vnd.github+json";
    static final String API_VERSION = "2022-11-28";

    private final String token;
    private final String baseUrl;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    GitHubApi(String token, String baseUrl) {
        this.token = token;
        this.baseUrl = stripTrailingSlash(baseUrl != null && !baseUrl.isBlank() ? baseUrl : "https://api.github.com");
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    String baseUrl() {
        return baseUrl;
    }

    HttpRequest buildGet(String path, Duration timeout) {
        var builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .header("Accept", MEDIA_TYPE)
                .header("X-GitHub-Api-Version", API_VERSION)
                .timeout(timeout)
                .GET();
        if (token != null && !token.isBlank()) {
            builder.header("Authorization", "Bearer " + token);
        }
        return builder.build();
    }

    JsonNode get(String path, Duration timeout) {
        try {
            var response = httpClient.send(buildGet(path, timeout), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                throw new GitHubApiException("GitHub API GET %s failed (HTTP %d): %s"
                        .formatted(path, response.statusCode(), response.body()), response.statusCode());
            }
            return objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw new GitHubApiException("GitHub API request failed: GET " + path, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GitHubApiException("Interrupted during GitHub API request: GET " + path, e);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
