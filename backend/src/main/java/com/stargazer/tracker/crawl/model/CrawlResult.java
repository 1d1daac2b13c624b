package com.stargazer.tracker.crawl.model;

import java.time.Duration;

public record CrawlResult(
    long runId,
    int totalRepos,
    CrawlRunStatus status,
    Duration elapsed,
    String errorMessage
) {
    public boolean isSuccess() {
        return status == CrawlRunStatus.SUCCESS;
    }

    public double reposPerSecond() {
        double seconds = elapsed == null ? 0.0 : elapsed.toMillis() / 1000.0;
        return seconds > 0 ? totalRepos / seconds : 0.0;
    }
}
