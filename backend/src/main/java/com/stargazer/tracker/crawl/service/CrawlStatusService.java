package com.stargazer.tracker.crawl.service;

import com.stargazer.tracker.crawl.model.CrawlRunView;
import com.stargazer.tracker.crawl.model.StatusResponse;
import com.stargazer.tracker.crawl.persistence.CrawlJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.springframework.http.HttpStatus.NOT_FOUND;

@Service
public class CrawlStatusService {
    private static final Logger log = LoggerFactory.getLogger(CrawlStatusService.class);
    private final CrawlJdbcRepository repository;
    private final RepoCrawlService crawlService;

    public CrawlStatusService(CrawlJdbcRepository repository, RepoCrawlService crawlService) {
        this.repository = repository;
        this.crawlService = crawlService;
    }

    public StatusResponse getStatus() {
        boolean dbConnected;
        try {
            dbConnected = repository.isDbReachable();
        } catch (DataAccessException e) {
            log.warn("Database unreachable: {}", e.getMessage());
            dbConnected = false;
        }
        if (!dbConnected) {
            return new StatusResponse(false, new LinkedHashMap<>(), null, crawlService.activeRunId());
        }

        Map<String, Long> counts = repository.tableCounts();
        CrawlRunView latest = repository.findMostRecentCrawlRun();
        return new StatusResponse(true, counts, latest, crawlService.activeRunId());
    }

    public CrawlRunView getRun(long crawlRunId) {
        CrawlRunView run = repository.findCrawlRunById(crawlRunId);
        if (run == null) {
            throw new ResponseStatusException(NOT_FOUND, "Crawl run not found: " + crawlRunId);
        }
        return run;
    }

    public List<CrawlRunView> getRecentRuns(Integer limit) {
        int safeLimit = limit == null ? 10 : Math.max(1, Math.min(limit, 100));
        return repository.findRecentCrawlRuns(safeLimit);
    }
}
