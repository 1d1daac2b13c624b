package com.stargazer.tracker.crawl.service;

import com.stargazer.tracker.config.CrawlerProperties;
import com.stargazer.tracker.crawl.dedup.Deduplicator;
import com.stargazer.tracker.crawl.http.PageFetchException;
import com.stargazer.tracker.crawl.http.PageFetcher;
import com.stargazer.tracker.crawl.model.GitHubRepo;
import com.stargazer.tracker.crawl.model.SearchPage;
import com.stargazer.tracker.crawl.query.QueryPartitioner;
import com.stargazer.tracker.crawl.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;

/**
 * Drives the partitioned queries through the {@link PageFetcher}, at most
 * {@code maxConcurrency} fetches in flight, and hands back fresh repositories chunk by chunk.
 *
 * <p>Queries are scheduled in chunks of {@code maxConcurrency * chunkMultiplier}. A chunk
 * finishes when each of its query loops has run out of pages, failed, or observed the stop
 * signal. The stop signal is raised once the deduplicator has seen {@code target} repositories.
 */
@Service
public class CrawlOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(CrawlOrchestrator.class);

    private final PageFetcher fetcher;
    private final QueryPartitioner partitioner;
    private final CrawlerProperties properties;
    private final ExecutorService crawlExecutor;
    private final Sleeper sleeper;

    public CrawlOrchestrator(
        PageFetcher fetcher,
        QueryPartitioner partitioner,
        CrawlerProperties properties,
        @Qualifier("crawlExecutor") ExecutorService crawlExecutor,
        Sleeper sleeper
    ) {
        this.fetcher = fetcher;
        this.partitioner = partitioner;
        this.properties = properties;
        this.crawlExecutor = crawlExecutor;
        this.sleeper = sleeper;
    }

    public CrawlBatches collect(int target, Deduplicator deduplicator) {
        return collect(partitioner.generate(), target, deduplicator);
    }

    public CrawlBatches collect(List<String> queries, int target, Deduplicator deduplicator) {
        if (target < 1) {
            throw new IllegalArgumentException("target must be positive");
        }
        List<String> snapshot = queries == null ? List.of() : List.copyOf(queries);
        int chunkSize = properties.getChunkSize();
        int chunkCount = (snapshot.size() + chunkSize - 1) / chunkSize;
        CrawlRun run = new CrawlRun(
            snapshot,
            target,
            deduplicator,
            new Semaphore(properties.getMaxConcurrency()),
            new StopSignal(),
            chunkSize,
            chunkCount
        );
        log.info(
            "Crawl starting | queries={} | chunks={} | maxConcurrency={} | target={}",
            snapshot.size(),
            chunkCount,
            properties.getMaxConcurrency(),
            target
        );
        return new CrawlBatches(
            chunkCount,
            run.stopSignal,
            run::runChunk,
            () -> log.info("Crawl finished | total unique={} | stopped={}", deduplicator.totalSeen(), run.stopSignal.isSet())
        );
    }

    private final class CrawlRun {
        private final List<String> queries;
        private final int target;
        private final Deduplicator deduplicator;
        private final Semaphore limiter;
        private final StopSignal stopSignal;
        private final int chunkSize;
        private final int chunkCount;

        private CrawlRun(
            List<String> queries,
            int target,
            Deduplicator deduplicator,
            Semaphore limiter,
            StopSignal stopSignal,
            int chunkSize,
            int chunkCount
        ) {
            this.queries = queries;
            this.target = target;
            this.deduplicator = deduplicator;
            this.limiter = limiter;
            this.stopSignal = stopSignal;
            this.chunkSize = chunkSize;
            this.chunkCount = chunkCount;
        }

        private List<GitHubRepo> runChunk(int chunkIndex) {
            if (stopSignal.isSet()) {
                return List.of();
            }
            if (deduplicator.totalSeen() >= target) {
                stopSignal.signal();
                return List.of();
            }
            int from = chunkIndex * chunkSize;
            int to = Math.min(queries.size(), from + chunkSize);
            List<GitHubRepo> buffer = Collections.synchronizedList(new ArrayList<>());

            List<CompletableFuture<Integer>> futures = new ArrayList<>();
            try {
                for (String query : queries.subList(from, to)) {
                    futures.add(CompletableFuture.supplyAsync(() -> runQuery(query, buffer), crawlExecutor));
                }
                CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            } catch (CompletionException e) {
                stopSignal.signal();
                Throwable cause = e.getCause() == null ? e : e.getCause();
                throw new CrawlAbortedException("Query task failed in chunk " + (chunkIndex + 1), cause);
            } catch (RejectedExecutionException e) {
                stopSignal.signal();
                throw new CrawlAbortedException("Crawl executor rejected chunk " + (chunkIndex + 1), e);
            }

            List<GitHubRepo> batch;
            synchronized (buffer) {
                batch = List.copyOf(buffer);
            }
            log.info(
                "Chunk {}/{} | +{} new | total {}/{}",
                chunkIndex + 1,
                chunkCount,
                batch.size(),
                deduplicator.totalSeen(),
                target
            );
            return batch;
        }

        private int runQuery(String query, List<GitHubRepo> buffer) {
            String cursor = null;
            int found = 0;
            int pages = 0;
            if (deduplicator.totalSeen() >= target) {
                stopSignal.signal();
                return found;
            }
            while (!stopSignal.isSet()) {
                SearchPage page;
                try {
                    limiter.acquire();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted waiting for a fetch slot, abandoning query '{}'", query);
                    return found;
                }
                try {
                    if (stopSignal.isSet()) {
                        break;
                    }
                    page = fetcher.fetchPage(query, cursor);
                } catch (PageFetchException e) {
                    log.warn("Query failed after {} pages, skipping '{}': {}", pages, query, e.getMessage());
                    return found;
                } finally {
                    limiter.release();
                }
                pages++;

                List<GitHubRepo> fresh = deduplicator.filterFresh(page.repos());
                if (!fresh.isEmpty()) {
                    buffer.addAll(fresh);
                    found += fresh.size();
                }
                if (deduplicator.totalSeen() >= target && stopSignal.signal()) {
                    log.info("Target {} reached, stopping remaining queries", target);
                }
                if (page.rateLimitRemaining() < properties.getRateLimitLowWater() && !stopSignal.isSet()) {
                    if (!cooldown(query, page.rateLimitRemaining())) {
                        return found;
                    }
                }
                if (page.isEmpty() || !page.hasNextPage()) {
                    break;
                }
                if (page.endCursor() == null) {
                    log.warn("Page reported more results without a cursor, ending query '{}'", query);
                    break;
                }
                cursor = page.endCursor();
            }
            log.debug("Query done | '{}' | pages={} | new={}", query, pages, found);
            return found;
        }

        private boolean cooldown(String query, int remaining) {
            Duration pause = Duration.ofMillis(properties.getRateLimitCooldownMs());
            log.info("Rate limit low ({} remaining), cooling down {} ms", remaining, pause.toMillis());
            try {
                sleeper.sleep(pause);
                return true;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted during cooldown, abandoning query '{}'", query);
                return false;
            }
        }
    }
}
