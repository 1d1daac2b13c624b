package com.stargazer.tracker.crawl.model;

public enum CrawlRunStatus {
    RUNNING,
    SUCCESS,
    FAILED
}
