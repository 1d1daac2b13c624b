package com.stargazer.tracker.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.stargazer.tracker.crawl.query.FacetQueryPartitioner;
import com.stargazer.tracker.crawl.query.QueryPartitioner;
import com.stargazer.tracker.crawl.util.NamedThreadFactory;
import com.stargazer.tracker.crawl.util.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class CrawlConfig {

    /**
     * Query loops of one chunk run here; in-flight fetches are capped separately by the
     * orchestrator's limiter, so the pool is sized to hold a whole chunk.
     */
    @Bean(name = "crawlExecutor", destroyMethod = "shutdown")
    public ExecutorService crawlExecutor(CrawlerProperties properties) {
        return Executors.newFixedThreadPool(properties.getChunkSize(), new NamedThreadFactory("crawl-worker"));
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(CrawlerProperties properties) {
        int size = Math.max(4, properties.getMaxConcurrency() * 2);
        return Executors.newFixedThreadPool(size, new NamedThreadFactory("http"));
    }

    @Bean(name = "crawlRunExecutor", destroyMethod = "shutdown")
    public ExecutorService crawlRunExecutor() {
        return Executors.newSingleThreadExecutor(new NamedThreadFactory("crawl-run"));
    }

    @Bean
    public QueryPartitioner queryPartitioner(CrawlerProperties properties) {
        return FacetQueryPartitioner.fromProperties(properties.getQuery());
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
