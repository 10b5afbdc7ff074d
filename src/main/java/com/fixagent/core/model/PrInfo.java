package com.fixagent.core.model;

import java.io.Serializable;

/**
 * Pull request metadata as returned by a {@code PrInfoProvider}.
 *
 * <p>Repository URLs are clone endpoints and commits are full SHAs.
 */
public record PrInfo(
    String prUrl,
    String repoOwner,
    String repoName,
    int prNumber,
    String sourceBranch,
    String sourceCommit,
    String sourceRepoUrl,
    String targetBranch,
    String targetCommit,
    String targetRepoUrl,
    String title,
    String state
) implements Serializable {

    /** HTTPS clone URL of the target repository. */
    public String cloneUrl() {
        return targetRepoUrl;
    }

    public String shortSourceCommit() {
        return abbreviate(sourceCommit);
    }

    public String shortTargetCommit() {
        return abbreviate(targetCommit);
    }

    private static String abbreviate(String sha) {
        return sha != null && sha.length() > 7 ? sha.substring(0, 7) : sha;
    }
}
