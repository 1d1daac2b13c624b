package com.stargazer.tracker.crawl.service;

import com.stargazer.tracker.config.CrawlerProperties;
import com.stargazer.tracker.crawl.model.CrawlRunStatus;
import com.stargazer.tracker.crawl.model.CrawlRunView;
import com.stargazer.tracker.crawl.persistence.CrawlJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Closes runs left RUNNING by a process that died mid-crawl.
 */
@Component
@Order(0)
public class CrawlRunLifecycleRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(CrawlRunLifecycleRunner.class);
    static final String ABORTED_ON_STARTUP = "aborted_on_startup";

    private final CrawlJdbcRepository repository;
    private final CrawlerProperties properties;

    public CrawlRunLifecycleRunner(CrawlJdbcRepository repository, CrawlerProperties properties) {
        this.repository = repository;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        boolean dbConnected;
        try {
            dbConnected = repository.isDbReachable();
        } catch (DataAccessException e) {
            dbConnected = false;
        }
        if (!dbConnected) {
            log.warn("Skipping crawl run cleanup because database is unreachable");
            return;
        }

        Instant cutoff = Instant.now().minus(Duration.ofMinutes(properties.getStaleRunMinutes()));
        List<CrawlRunView> running = repository.findRunningCrawlRuns();
        for (CrawlRunView run : running) {
            if (run.startedAt() != null && run.startedAt().isAfter(cutoff)) {
                continue;
            }
            repository.finishRun(run.crawlRunId(), run.reposFetched(), CrawlRunStatus.FAILED, ABORTED_ON_STARTUP);
            log.info(
                "Marked stale crawl run {} startedAt={} as failed ({} repos fetched)",
                run.crawlRunId(),
                run.startedAt(),
                run.reposFetched()
            );
        }
    }
}
