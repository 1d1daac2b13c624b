package com.stargazer.tracker.crawl.service;

public class CrawlAbortedException extends RuntimeException {
    public CrawlAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
