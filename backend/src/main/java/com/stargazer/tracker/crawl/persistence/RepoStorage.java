package com.stargazer.tracker.crawl.persistence;

import com.stargazer.tracker.crawl.model.CrawlRunStatus;
import com.stargazer.tracker.crawl.model.GitHubRepo;

import java.util.List;

/**
 * Write side used by a crawl run. Implementations must make {@link #upsertBatch} idempotent:
 * applying the same batch twice leaves the same rows.
 */
public interface RepoStorage {
    long createRun();

    void upsertBatch(List<GitHubRepo> repos);

    void updateRunProgress(long runId, int reposFetched);

    void finishRun(long runId, int reposFetched, CrawlRunStatus status, String errorMessage);
}
