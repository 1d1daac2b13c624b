package com.stargazer.tracker.crawl.dedup;

import com.stargazer.tracker.crawl.model.GitHubRepo;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class InMemoryDeduplicator implements Deduplicator {
    private final Object lock = new Object();
    private final Set<String> seen = new HashSet<>();

    @Override
    public List<GitHubRepo> filterFresh(List<GitHubRepo> batch) {
        if (batch == null || batch.isEmpty()) {
            return List.of();
        }
        List<GitHubRepo> fresh = new ArrayList<>();
        synchronized (lock) {
            for (GitHubRepo repo : batch) {
                if (repo != null && repo.nodeId() != null && seen.add(repo.nodeId())) {
                    fresh.add(repo);
                }
            }
        }
        return fresh;
    }

    @Override
    public int totalSeen() {
        synchronized (lock) {
            return seen.size();
        }
    }
}
