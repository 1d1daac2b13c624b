package com.stargazer.tracker.crawl.service;

import com.stargazer.tracker.crawl.http.PageFetcher;
import com.stargazer.tracker.crawl.model.GitHubRepo;
import com.stargazer.tracker.crawl.model.SearchPage;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * In-memory {@link PageFetcher}: each query maps to a list of pages addressed by cursor
 * "1", "2", ...; queries without a script return one empty page.
 */
class ScriptedPageFetcher implements PageFetcher {
    private final Map<String, List<List<GitHubRepo>>> pages = new HashMap<>();
    private final Map<String, Supplier<RuntimeException>> failures = new HashMap<>();
    private final List<String> calls = Collections.synchronizedList(new ArrayList<>());
    private final Map<String, AtomicInteger> callsByQuery = new ConcurrentHashMap<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private volatile int remaining = 5000;
    private volatile long fetchDelayMs;
    private volatile Consumer<String> onFetch = query -> {};

    @SafeVarargs
    final ScriptedPageFetcher query(String query, List<GitHubRepo>... scriptedPages) {
        pages.put(query, Arrays.asList(scriptedPages));
        return this;
    }

    ScriptedPageFetcher queryPages(String query, List<List<GitHubRepo>> scriptedPages) {
        pages.put(query, List.copyOf(scriptedPages));
        return this;
    }

    ScriptedPageFetcher failing(String query, Supplier<RuntimeException> failure) {
        failures.put(query, failure);
        return this;
    }

    ScriptedPageFetcher remaining(int remaining) {
        this.remaining = remaining;
        return this;
    }

    ScriptedPageFetcher fetchDelayMs(long fetchDelayMs) {
        this.fetchDelayMs = fetchDelayMs;
        return this;
    }

    ScriptedPageFetcher onFetch(Runnable onFetch) {
        return onFetch(query -> onFetch.run());
    }

    /**
     * Called with the query before each scripted page is served.
     */
    ScriptedPageFetcher onFetch(Consumer<String> onFetch) {
        this.onFetch = onFetch;
        return this;
    }

    @Override
    public SearchPage fetchPage(String query, String cursor) {
        int current = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(current, Math::max);
        try {
            calls.add(query + "@" + cursor);
            callsByQuery.computeIfAbsent(query, key -> new AtomicInteger()).incrementAndGet();
            onFetch.accept(query);
            if (fetchDelayMs > 0) {
                Thread.sleep(fetchDelayMs);
            }
            Supplier<RuntimeException> failure = failures.get(query);
            if (failure != null) {
                throw failure.get();
            }
            List<List<GitHubRepo>> script = pages.getOrDefault(query, List.of());
            int index = cursor == null ? 0 : Integer.parseInt(cursor);
            if (index >= script.size()) {
                return new SearchPage(List.of(), false, null, remaining);
            }
            boolean hasNext = index + 1 < script.size();
            return new SearchPage(script.get(index), hasNext, hasNext ? String.valueOf(index + 1) : null, remaining);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    List<String> calls() {
        synchronized (calls) {
            return List.copyOf(calls);
        }
    }

    int callsFor(String query) {
        AtomicInteger count = callsByQuery.get(query);
        return count == null ? 0 : count.get();
    }

    int maxInFlight() {
        return maxInFlight.get();
    }

    static GitHubRepo repo(String id) {
        return new GitHubRepo(id, "owner/" + id, id, "owner", null, "Java", false, 10, null, null);
    }

    static List<GitHubRepo> repos(String... ids) {
        return Arrays.stream(ids).map(ScriptedPageFetcher::repo).toList();
    }
}
