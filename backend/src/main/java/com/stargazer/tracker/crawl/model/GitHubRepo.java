package com.stargazer.tracker.crawl.model;

import java.time.Instant;

/**
 * One repository as observed in a search result. A later observation of the same
 * {@code nodeId} is a new value that replaces the stored row.
 */
public record GitHubRepo(
    String nodeId,
    String nameWithOwner,
    String name,
    String ownerLogin,
    String description,
    String primaryLanguage,
    boolean isPrivate,
    int starCount,
    Instant createdAt,
    Instant updatedAt
) {}
