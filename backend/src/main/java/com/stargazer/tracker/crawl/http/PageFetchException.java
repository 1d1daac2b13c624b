package com.stargazer.tracker.crawl.http;

public class PageFetchException extends RuntimeException {
    private final String query;

    public PageFetchException(String query, String message) {
        super(message);
        this.query = query;
    }

    public PageFetchException(String query, String message, Throwable cause) {
        super(message, cause);
        this.query = query;
    }

    public String getQuery() {
        return query;
    }
}
