package com.stargazer.tracker.crawl.service;

import com.stargazer.tracker.config.CrawlerProperties;
import com.stargazer.tracker.crawl.http.PageFetchException;
import com.stargazer.tracker.crawl.model.CrawlResult;
import com.stargazer.tracker.crawl.model.CrawlRunStatus;
import com.stargazer.tracker.crawl.model.GitHubRepo;
import com.stargazer.tracker.crawl.persistence.RepoStorage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.stargazer.tracker.crawl.service.ScriptedPageFetcher.repos;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RepoCrawlServiceTest {
    @Mock
    private RepoStorage storage;

    private CrawlerProperties properties;
    private ExecutorService crawlExecutor;
    private ExecutorService runExecutor;

    @BeforeEach
    void setUp() {
        properties = new CrawlerProperties();
        properties.setMaxConcurrency(1);
        properties.setChunkMultiplier(1);
        crawlExecutor = Executors.newFixedThreadPool(properties.getChunkSize());
        runExecutor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        crawlExecutor.shutdownNow();
        runExecutor.shutdownNow();
    }

    @Test
    void overshootingBatchIsTrimmedToTarget() {
        when(storage.createRun()).thenReturn(42L);
        ScriptedPageFetcher fetcher = new ScriptedPageFetcher()
            .query("q1", repos("a", "b", "c", "d", "e", "f", "g"));

        CrawlResult result = service(fetcher, List.of("q1")).execute(5);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<GitHubRepo>> persisted = ArgumentCaptor.forClass(List.class);
        verify(storage).upsertBatch(persisted.capture());
        assertThat(persisted.getValue()).extracting(GitHubRepo::nodeId).containsExactly("a", "b", "c", "d", "e");
        verify(storage).updateRunProgress(42L, 5);
        verify(storage).finishRun(42L, 5, CrawlRunStatus.SUCCESS, null);
        assertEquals(42L, result.runId());
        assertEquals(5, result.totalRepos());
        assertTrue(result.isSuccess());
        assertNull(result.errorMessage());
    }

    @Test
    void exhaustedQueriesFinishSuccessfullyBelowTarget() {
        when(storage.createRun()).thenReturn(7L);
        ScriptedPageFetcher fetcher = new ScriptedPageFetcher()
            .query("q1", repos("a", "b"))
            .query("q2", repos("b", "c"));

        CrawlResult result = service(fetcher, List.of("q1", "q2")).execute(100);

        assertEquals(CrawlRunStatus.SUCCESS, result.status());
        assertEquals(3, result.totalRepos());
        verify(storage, times(2)).upsertBatch(anyList());
        verify(storage).updateRunProgress(7L, 2);
        verify(storage).updateRunProgress(7L, 3);
        verify(storage).finishRun(7L, 3, CrawlRunStatus.SUCCESS, null);
    }

    @Test
    void abandonedQueryStillLetsRunSucceed() {
        when(storage.createRun()).thenReturn(3L);
        ScriptedPageFetcher fetcher = new ScriptedPageFetcher()
            .failing("q1", () -> new PageFetchException("q1", "exhausted"))
            .query("q2", repos("a", "b"));

        CrawlResult result = service(fetcher, List.of("q1", "q2")).execute(2);

        assertTrue(result.isSuccess());
        assertEquals(2, result.totalRepos());
        verify(storage).finishRun(3L, 2, CrawlRunStatus.SUCCESS, null);
    }

    @Test
    void storageFailureFailsRunAndKeepsPartialTotal() {
        when(storage.createRun()).thenReturn(9L);
        doNothing()
            .doThrow(new DataAccessResourceFailureException("db down"))
            .when(storage).upsertBatch(anyList());
        ScriptedPageFetcher fetcher = new ScriptedPageFetcher()
            .query("q1", repos("a", "b"))
            .query("q2", repos("c"));

        CrawlResult result = service(fetcher, List.of("q1", "q2")).execute(10);

        assertEquals(CrawlRunStatus.FAILED, result.status());
        assertEquals(2, result.totalRepos());
        assertThat(result.errorMessage()).contains("db down");
        verify(storage).finishRun(eq(9L), eq(2), eq(CrawlRunStatus.FAILED), anyString());
        verify(storage, never()).finishRun(9L, 2, CrawlRunStatus.SUCCESS, null);
    }

    @Test
    void unexpectedFetchFailureFailsRun() {
        when(storage.createRun()).thenReturn(11L);
        ScriptedPageFetcher fetcher = new ScriptedPageFetcher()
            .failing("q1", () -> new IllegalStateException("parser exploded"));

        CrawlResult result = service(fetcher, List.of("q1")).execute(10);

        assertEquals(CrawlRunStatus.FAILED, result.status());
        assertEquals(0, result.totalRepos());
        assertThat(result.errorMessage()).contains("parser exploded");
        verify(storage, never()).upsertBatch(anyList());
    }

    @Test
    void nonPositiveTargetIsRejectedBeforeARunIsOpened() {
        RepoCrawlService service = service(new ScriptedPageFetcher(), List.of("q1"));

        assertThrows(IllegalArgumentException.class, () -> service.execute(0));
        verify(storage, never()).createRun();
    }

    @Test
    void secondRunIsRejectedWhileOneIsActive() throws Exception {
        when(storage.createRun()).thenReturn(1L);
        CountDownLatch fetching = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ScriptedPageFetcher fetcher = new ScriptedPageFetcher()
            .query("q1", repos("a"))
            .onFetch(() -> {
                fetching.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        RepoCrawlService service = service(fetcher, List.of("q1"));

        long runId = service.startAsync(5);
        assertTrue(fetching.await(5, TimeUnit.SECONDS));

        assertEquals(1L, runId);
        assertEquals(Long.valueOf(1L), service.activeRunId());
        assertThrows(ActiveCrawlRunException.class, () -> service.execute(5));

        release.countDown();
        verify(storage, timeout(5000)).finishRun(1L, 1, CrawlRunStatus.SUCCESS, null);
        verify(storage, times(1)).createRun();
    }

    private RepoCrawlService service(ScriptedPageFetcher fetcher, List<String> queries) {
        CrawlOrchestrator orchestrator = new CrawlOrchestrator(
            fetcher,
            () -> queries,
            properties,
            crawlExecutor,
            duration -> {}
        );
        return new RepoCrawlService(orchestrator, storage, runExecutor);
    }
}
