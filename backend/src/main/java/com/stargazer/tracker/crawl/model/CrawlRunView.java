package com.stargazer.tracker.crawl.model;

import java.time.Instant;

public record CrawlRunView(
    long crawlRunId,
    Instant startedAt,
    Instant finishedAt,
    int reposFetched,
    CrawlRunStatus status,
    String errorMessage
) {}
