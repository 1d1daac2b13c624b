package com.stargazer.tracker.crawl.model;

import java.util.List;

public record SearchPage(
    List<GitHubRepo> repos,
    boolean hasNextPage,
    String endCursor,
    int rateLimitRemaining
) {
    public SearchPage {
        repos = repos == null ? List.of() : List.copyOf(repos);
    }

    public boolean isEmpty() {
        return repos.isEmpty();
    }
}
