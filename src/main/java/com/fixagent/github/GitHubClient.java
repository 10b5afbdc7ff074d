package com.fixagent.github;

import com.fasterxml.jackson.databind.JsonNode;
import com.fixagent.core.model.PrInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link PrInfoProvider} backed by the GitHub REST API
 * ({@code GET /repos/{owner}/{repo}/pulls/{number}}).
 *
 * <p>Authentication is optional; without a token the unauthenticated rate
 * limit applies.
 */
public class GitHubClient implements PrInfoProvider {

    private static final Logger log = LoggerFactory.getLogger(GitHubClient.class);

    private static final Pattern PR_URL = Pattern.compile("github\\.com/([^/]+)/([^/]+)/pull/(\\d+)");
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final GitHubApi api;

    public GitHubClient(String token, String baseUrl) {
        this.api = new GitHubApi(token, baseUrl);
    }

    /** Owner, repository and number of a pull request. */
    public record PrCoordinates(String owner, String repo, int number) {}

    public static PrCoordinates parsePrUrl(String prUrl) {
        if (prUrl == null) {
            throw new InvalidPrUrlException("null");
        }
        Matcher m = PR_URL.matcher(prUrl);
        if (!m.find()) {
            throw new InvalidPrUrlException(prUrl);
        }
        return new PrCoordinates(m.group(1), m.group(2), Integer.parseInt(m.group(3)));
    }

    @Override
    public PrInfo getPrInfo(String prUrl) {
        PrCoordinates pr = parsePrUrl(prUrl);
        log.info("Fetching PR #{} of {}/{}", pr.number(), pr.owner(), pr.repo());
        JsonNode json = api.get("/repos/%s/%s/pulls/%d".formatted(pr.owner(), pr.repo(), pr.number()),
                REQUEST_TIMEOUT);
        return toPrInfo(prUrl, pr, json);
    }

    /** HTTPS clone URL of a repository. */
    public static String cloneUrl(String owner, String repo) {
        return "https://github.com/" + owner + "/" + repo + ".git";
    }

    /**
     * Maps a pull request payload. The head repository is null when the fork
     * was deleted; the base repository is used instead.
     */
    static PrInfo toPrInfo(String prUrl, PrCoordinates pr, JsonNode json) {
        JsonNode head = json.path("head");
        JsonNode base = json.path("base");
        JsonNode headRepo = head.path("repo");
        String baseCloneUrl = base.path("repo").path("clone_url").asText();
        String sourceRepoUrl = headRepo.isMissingNode() || headRepo.isNull()
                ? baseCloneUrl
                : headRepo.path("clone_url").asText();

        return new PrInfo(
                prUrl,
                pr.owner(),
                pr.repo(),
                pr.number(),
                head.path("ref").asText(),
                head.path("sha").asText(),
                sourceRepoUrl,
                base.path("ref").asText(),
                base.path("sha").asText(),
                baseCloneUrl,
                json.path("title").asText(),
                json.path("state").asText());
    }
}
