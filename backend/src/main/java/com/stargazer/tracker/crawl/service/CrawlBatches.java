package com.stargazer.tracker.crawl.service;

import com.stargazer.tracker.crawl.model.GitHubRepo;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.IntFunction;

/**
 * Lazy, finite sequence of fresh-repository batches. Each chunk of queries runs only when
 * the consumer asks for the next batch; chunks that produce nothing fresh are skipped, so
 * a returned batch is never empty. Not restartable.
 */
public class CrawlBatches implements Iterator<List<GitHubRepo>>, AutoCloseable {
    private final int chunkCount;
    private final StopSignal stopSignal;
    private final IntFunction<List<GitHubRepo>> chunkRunner;
    private final Runnable onFinished;
    private int nextChunk;
    private List<GitHubRepo> pending;
    private boolean finished;

    CrawlBatches(int chunkCount, StopSignal stopSignal, IntFunction<List<GitHubRepo>> chunkRunner, Runnable onFinished) {
        this.chunkCount = chunkCount;
        this.stopSignal = stopSignal;
        this.chunkRunner = chunkRunner;
        this.onFinished = onFinished;
    }

    @Override
    public boolean hasNext() {
        if (pending != null) {
            return true;
        }
        while (!finished && nextChunk < chunkCount && !stopSignal.isSet()) {
            List<GitHubRepo> batch = chunkRunner.apply(nextChunk++);
            if (batch != null && !batch.isEmpty()) {
                pending = batch;
                return true;
            }
        }
        finish();
        return false;
    }

    @Override
    public List<GitHubRepo> next() {
        if (!hasNext()) {
            throw new NoSuchElementException("crawl batches exhausted");
        }
        List<GitHubRepo> batch = pending;
        pending = null;
        return batch;
    }

    public boolean isStopped() {
        return stopSignal.isSet();
    }

    /**
     * Stops the run; chunks that have not started yet are never scheduled.
     */
    @Override
    public void close() {
        stopSignal.signal();
        pending = null;
        finish();
    }

    private void finish() {
        if (!finished) {
            finished = true;
            onFinished.run();
        }
    }
}
