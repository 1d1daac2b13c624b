package com.stargazer.tracker.crawl.service;

import com.stargazer.tracker.config.CrawlerProperties;
import com.stargazer.tracker.crawl.model.CrawlResult;
import com.stargazer.tracker.crawl.model.CrawlRunStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CrawlCliRunnerTest {
    @Mock
    private RepoCrawlService crawlService;

    @Mock
    private StarCountExportService exportService;

    @TempDir
    Path tempDir;

    private CrawlerProperties properties;

    @BeforeEach
    void setUp() {
        properties = new CrawlerProperties();
        properties.getGithub().setToken("test-token");
        properties.getCli().setRun(true);
        properties.getCli().setTarget(25);
    }

    @Test
    void missingTokenRefusesToStart() {
        properties.getGithub().setToken("");

        assertEquals(1, runner().runOnce());
        verify(crawlService, never()).execute(anyInt());
        verifyNoInteractions(exportService);
    }

    @Test
    void failedRunExitsWithOne() {
        when(crawlService.execute(25)).thenReturn(
            new CrawlResult(3L, 12, CrawlRunStatus.FAILED, Duration.ofSeconds(4), "boom")
        );

        assertEquals(1, runner().runOnce());
        verifyNoInteractions(exportService);
    }

    @Test
    void successfulRunExitsWithZero() {
        when(crawlService.execute(25)).thenReturn(success());

        assertEquals(0, runner().runOnce());
        verifyNoInteractions(exportService);
    }

    @Test
    void cliTargetFallsBackToCrawlerTarget() {
        properties.getCli().setTarget(0);
        properties.setTarget(40);
        when(crawlService.execute(40)).thenReturn(success());

        assertEquals(0, runner().runOnce());
    }

    @Test
    void exportRunsAfterSuccessfulCrawl() throws Exception {
        Path csv = tempDir.resolve("stars.csv");
        properties.getCli().setExportAfterRun(true);
        properties.getExport().setPath(csv.toString());
        when(crawlService.execute(25)).thenReturn(success());
        when(exportService.exportToFile(csv)).thenReturn(25);

        assertEquals(0, runner().runOnce());
        verify(exportService).exportToFile(csv);
    }

    @Test
    void failedExportExitsWithOne() throws Exception {
        properties.getCli().setExportAfterRun(true);
        properties.getExport().setPath(tempDir.resolve("stars.csv").toString());
        when(crawlService.execute(25)).thenReturn(success());
        when(exportService.exportToFile(any(Path.class))).thenThrow(new IOException("disk full"));

        assertEquals(1, runner().runOnce());
    }

    private CrawlCliRunner runner() {
        return new CrawlCliRunner(properties, crawlService, exportService, null);
    }

    private static CrawlResult success() {
        return new CrawlResult(7L, 25, CrawlRunStatus.SUCCESS, Duration.ofSeconds(5), null);
    }
}
