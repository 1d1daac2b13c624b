package com.stargazer.tracker.crawl.api;

import com.stargazer.tracker.config.CrawlerProperties;
import com.stargazer.tracker.crawl.model.CrawlRunView;
import com.stargazer.tracker.crawl.model.StatusResponse;
import com.stargazer.tracker.crawl.service.CrawlStatusService;
import com.stargazer.tracker.crawl.service.RepoCrawlService;
import com.stargazer.tracker.crawl.service.StarCountExportService;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api")
public class CrawlController {
    private final RepoCrawlService crawlService;
    private final CrawlStatusService crawlStatusService;
    private final StarCountExportService exportService;
    private final CrawlerProperties crawlerProperties;

    public CrawlController(
        RepoCrawlService crawlService,
        CrawlStatusService crawlStatusService,
        StarCountExportService exportService,
        CrawlerProperties crawlerProperties
    ) {
        this.crawlService = crawlService;
        this.crawlStatusService = crawlStatusService;
        this.exportService = exportService;
        this.crawlerProperties = crawlerProperties;
    }

    @PostMapping("/crawl/run")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Map<String, Long> startCrawl(@RequestParam(name = "target", required = false) Integer target) {
        if (target != null && target < 1) {
            throw new ResponseStatusException(BAD_REQUEST, "target must be positive");
        }
        int safeTarget = target == null ? crawlerProperties.getTarget() : target;
        long crawlRunId = crawlService.startAsync(safeTarget);
        return Map.of("crawlRunId", crawlRunId);
    }

    @GetMapping("/crawl/runs/{crawlRunId}")
    public CrawlRunView getRun(@PathVariable("crawlRunId") long crawlRunId) {
        return crawlStatusService.getRun(crawlRunId);
    }

    @GetMapping("/crawl/runs")
    public List<CrawlRunView> recentRuns(@RequestParam(name = "limit", required = false) Integer limit) {
        return crawlStatusService.getRecentRuns(limit);
    }

    @GetMapping("/status")
    public StatusResponse status() {
        return crawlStatusService.getStatus();
    }

    @GetMapping("/stars/latest.csv")
    public void latestStarCounts(HttpServletResponse response) throws IOException {
        response.setContentType("text/csv");
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setHeader("Content-Disposition", "attachment; filename=\"star_counts.csv\"");
        exportService.write(response.getWriter());
    }
}
