package com.stargazer.tracker.crawl.http;

import com.stargazer.tracker.crawl.model.SearchPage;

public interface PageFetcher {

    /**
     * Fetches one page of results for {@code query}, starting after {@code cursor}
     * ({@code null} for the first page). Transient failures and explicit rate-limit
     * responses are retried internally.
     *
     * @throws PageFetchException once the retry budget is spent or the failure is not
     *     recoverable for this query
     */
    SearchPage fetchPage(String query, String cursor);
}
