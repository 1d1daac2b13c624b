package com.stargazer.tracker.crawl.query;

import java.util.List;

/**
 * Enumerates the search queries of one crawl run. Implementations are pure and
 * deterministic: the same configuration always yields the same ordered list.
 */
public interface QueryPartitioner {
    List<String> generate();
}
