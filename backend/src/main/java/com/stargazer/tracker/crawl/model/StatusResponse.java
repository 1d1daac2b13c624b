package com.stargazer.tracker.crawl.model;

import java.util.Map;

public record StatusResponse(
    boolean dbConnectivity,
    Map<String, Long> counts,
    CrawlRunView latestRun,
    Long activeCrawlRunId
) {}
