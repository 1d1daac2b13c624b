package com.stargazer.tracker.crawl.model;

import java.time.Instant;

public record LatestStarCount(
    String nodeId,
    String nameWithOwner,
    String ownerLogin,
    String name,
    int starCount,
    Instant recordedAt
) {}
