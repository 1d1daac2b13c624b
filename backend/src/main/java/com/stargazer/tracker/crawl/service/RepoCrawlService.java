package com.stargazer.tracker.crawl.service;

import com.stargazer.tracker.crawl.dedup.Deduplicator;
import com.stargazer.tracker.crawl.dedup.InMemoryDeduplicator;
import com.stargazer.tracker.crawl.model.CrawlResult;
import com.stargazer.tracker.crawl.model.CrawlRunStatus;
import com.stargazer.tracker.crawl.model.GitHubRepo;
import com.stargazer.tracker.crawl.persistence.RepoStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs one crawl end to end: opens the run record, persists every batch the orchestrator
 * yields until the target is met, and closes the run as SUCCESS or FAILED. Batches already
 * written stay written when the run fails.
 */
@Service
public class RepoCrawlService {
    private static final Logger log = LoggerFactory.getLogger(RepoCrawlService.class);

    private final CrawlOrchestrator orchestrator;
    private final RepoStorage storage;
    private final ExecutorService crawlRunExecutor;
    private final AtomicReference<Long> activeRunId = new AtomicReference<>();

    public RepoCrawlService(
        CrawlOrchestrator orchestrator,
        RepoStorage storage,
        @Qualifier("crawlRunExecutor") ExecutorService crawlRunExecutor
    ) {
        this.orchestrator = orchestrator;
        this.storage = storage;
        this.crawlRunExecutor = crawlRunExecutor;
    }

    public CrawlResult execute(int target) {
        return execute(target, new InMemoryDeduplicator());
    }

    public CrawlResult execute(int target, Deduplicator deduplicator) {
        requirePositive(target);
        long runId = claimRun();
        try {
            return runWithId(runId, target, deduplicator);
        } finally {
            activeRunId.set(null);
        }
    }

    /**
     * Opens the run record and continues the crawl on the run executor.
     *
     * @return id of the new run
     * @throws ActiveCrawlRunException if this process is already running a crawl
     */
    public long startAsync(int target) {
        requirePositive(target);
        long runId = claimRun();
        try {
            crawlRunExecutor.submit(() -> {
                try {
                    runWithId(runId, target, new InMemoryDeduplicator());
                } finally {
                    activeRunId.set(null);
                }
            });
        } catch (RejectedExecutionException e) {
            activeRunId.set(null);
            storage.finishRun(runId, 0, CrawlRunStatus.FAILED, "run_rejected");
            throw e;
        }
        return runId;
    }

    public Long activeRunId() {
        return activeRunId.get();
    }

    private synchronized long claimRun() {
        Long active = activeRunId.get();
        if (active != null) {
            throw new ActiveCrawlRunException("Active crawl run in progress (id=" + active + ")");
        }
        long runId = storage.createRun();
        activeRunId.set(runId);
        return runId;
    }

    private CrawlResult runWithId(long runId, int target, Deduplicator deduplicator) {
        Instant startedAt = Instant.now();
        int total = 0;
        log.info("Crawl run {} started | target={}", runId, target);

        try (CrawlBatches batches = orchestrator.collect(target, deduplicator)) {
            while (total < target && batches.hasNext()) {
                List<GitHubRepo> batch = batches.next();
                int room = target - total;
                if (batch.size() > room) {
                    batch = batch.subList(0, room);
                }
                storage.upsertBatch(batch);
                total += batch.size();
                storage.updateRunProgress(runId, total);

                double seconds = Duration.between(startedAt, Instant.now()).toMillis() / 1000.0;
                log.info(
                    "Saved {} | total {}/{} | {} repos/s",
                    batch.size(),
                    total,
                    target,
                    String.format("%.1f", seconds > 0 ? total / seconds : 0.0)
                );
            }
            storage.finishRun(runId, total, CrawlRunStatus.SUCCESS, null);
            CrawlResult result = new CrawlResult(runId, total, CrawlRunStatus.SUCCESS, elapsedSince(startedAt), null);
            log.info(
                "Crawl run {} finished | {} repos in {}s",
                runId,
                total,
                result.elapsed().toSeconds()
            );
            return result;
        } catch (Exception e) {
            String message = describe(e);
            log.warn("Crawl run {} failed after {} repos: {}", runId, total, message, e);
            try {
                storage.finishRun(runId, total, CrawlRunStatus.FAILED, message);
            } catch (RuntimeException finishError) {
                log.error("Unable to record failure of crawl run {}", runId, finishError);
            }
            return new CrawlResult(runId, total, CrawlRunStatus.FAILED, elapsedSince(startedAt), message);
        }
    }

    private static void requirePositive(int target) {
        if (target < 1) {
            throw new IllegalArgumentException("target must be a positive number, got " + target);
        }
    }

    private static Duration elapsedSince(Instant startedAt) {
        return Duration.between(startedAt, Instant.now());
    }

    private static String describe(Throwable throwable) {
        String message = throwable.getMessage() == null ? throwable.getClass().getSimpleName() : throwable.getMessage();
        Throwable root = throwable;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        if (root != throwable) {
            String rootMessage = root.getMessage() == null ? root.toString() : root.getMessage();
            return message + ": " + rootMessage;
        }
        return message;
    }
}
