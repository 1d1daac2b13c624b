package com.stargazer.tracker.crawl.service;

import com.stargazer.tracker.config.CrawlerProperties;
import com.stargazer.tracker.crawl.model.CrawlResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Command-line mode: {@code --crawler.cli.run=true [--crawler.cli.target=N]}. Exits with 0
 * when the crawl succeeds and 1 otherwise.
 */
@Component
@Order(1)
public class CrawlCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(CrawlCliRunner.class);

    private final CrawlerProperties properties;
    private final RepoCrawlService crawlService;
    private final StarCountExportService exportService;
    private final ConfigurableApplicationContext applicationContext;

    public CrawlCliRunner(
        CrawlerProperties properties,
        RepoCrawlService crawlService,
        StarCountExportService exportService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.crawlService = crawlService;
        this.exportService = exportService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }
        int exitCode = runOnce();
        if (properties.getCli().isExitAfterRun()) {
            int code = SpringApplication.exit(applicationContext, () -> exitCode);
            System.exit(code);
        }
    }

    int runOnce() {
        if (!properties.getGithub().hasToken()) {
            log.error("crawler.github.token is not set (export GITHUB_TOKEN); refusing to start a crawl");
            return 1;
        }
        int target = properties.getCli().getTarget() > 0 ? properties.getCli().getTarget() : properties.getTarget();
        CrawlResult result = crawlService.execute(target);
        if (!result.isSuccess()) {
            log.error(
                "Crawl run {} failed after {} repos: {}",
                result.runId(),
                result.totalRepos(),
                result.errorMessage()
            );
            return 1;
        }
        log.info(
            "Crawl run {} collected {} repos in {}s ({} repos/s)",
            result.runId(),
            result.totalRepos(),
            result.elapsed().toSeconds(),
            String.format("%.1f", result.reposPerSecond())
        );

        if (properties.getCli().isExportAfterRun()) {
            try {
                exportService.exportToFile(Path.of(properties.getExport().getPath()));
            } catch (IOException e) {
                log.error("Export to {} failed", properties.getExport().getPath(), e);
                return 1;
            }
        }
        return 0;
    }
}
