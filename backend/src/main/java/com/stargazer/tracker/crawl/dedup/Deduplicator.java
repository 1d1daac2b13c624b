package com.stargazer.tracker.crawl.dedup;

import com.stargazer.tracker.crawl.model.GitHubRepo;

import java.util.List;

/**
 * Seen-set of one crawl run. Identifiers are never forgotten while the instance lives.
 */
public interface Deduplicator {

    /**
     * Returns the repositories of {@code batch} whose node id has not been seen yet, in batch
     * order, and marks them seen. Check and mark happen as one step with respect to other
     * callers, so two concurrent calls never both return the same id.
     */
    List<GitHubRepo> filterFresh(List<GitHubRepo> batch);

    int totalSeen();
}
