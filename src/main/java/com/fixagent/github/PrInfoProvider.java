package com.fixagent.github;

import com.fixagent.core.model.PrInfo;

/**
 * Resolves a pull request URL into the metadata needed to materialize its merge.
 */
public interface PrInfoProvider {

    /**
     * @throws InvalidPrUrlException if the URL does not name a pull request
     * @throws GitHubApiException    if the hosting service cannot be queried
     */
    PrInfo getPrInfo(String prUrl);
}
