package com.stargazer.tracker.config;

import com.stargazer.tracker.crawl.query.StarRangeStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {
    private static final String DEFAULT_USER_AGENT = "star-tracker/0.1 (+contact)";
    private static final int MAX_PAGE_SIZE = 100;

    private String userAgent;
    private int target = 100_000;
    private int maxConcurrency = 15;
    private int chunkMultiplier = 4;
    private int rateLimitLowWater = 20;
    private long rateLimitCooldownMs = 60_000;
    private int requestMaxAttempts = 5;
    private int requestRetryBaseDelayMs = 2000;
    private int requestRetryMaxDelayMs = 32_000;
    private long rateLimitedSleepMs = 60_000;
    private int requestTimeoutSeconds = 30;
    private int staleRunMinutes = 120;
    private Github github = new Github();
    private Query query = new Query();
    private Storage storage = new Storage();
    private Export export = new Export();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getTarget() {
        return Math.max(1, target);
    }

    public void setTarget(int target) {
        this.target = Math.max(1, target);
    }

    public int getMaxConcurrency() {
        return Math.max(1, maxConcurrency);
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = Math.max(1, maxConcurrency);
    }

    public int getChunkMultiplier() {
        return Math.max(1, chunkMultiplier);
    }

    public void setChunkMultiplier(int chunkMultiplier) {
        this.chunkMultiplier = Math.max(1, chunkMultiplier);
    }

    public int getChunkSize() {
        return getMaxConcurrency() * getChunkMultiplier();
    }

    public int getRateLimitLowWater() {
        return Math.max(0, rateLimitLowWater);
    }

    public void setRateLimitLowWater(int rateLimitLowWater) {
        this.rateLimitLowWater = Math.max(0, rateLimitLowWater);
    }

    public long getRateLimitCooldownMs() {
        return Math.max(0, rateLimitCooldownMs);
    }

    public void setRateLimitCooldownMs(long rateLimitCooldownMs) {
        this.rateLimitCooldownMs = Math.max(0, rateLimitCooldownMs);
    }

    public int getRequestMaxAttempts() {
        return Math.max(1, requestMaxAttempts);
    }

    public void setRequestMaxAttempts(int requestMaxAttempts) {
        this.requestMaxAttempts = Math.max(1, requestMaxAttempts);
    }

    public int getRequestRetryBaseDelayMs() {
        return requestRetryBaseDelayMs;
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = requestRetryBaseDelayMs;
    }

    public int getRequestRetryMaxDelayMs() {
        return requestRetryMaxDelayMs;
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = requestRetryMaxDelayMs;
    }

    public long getRateLimitedSleepMs() {
        return Math.max(0, rateLimitedSleepMs);
    }

    public void setRateLimitedSleepMs(long rateLimitedSleepMs) {
        this.rateLimitedSleepMs = Math.max(0, rateLimitedSleepMs);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public int getStaleRunMinutes() {
        return Math.max(1, staleRunMinutes);
    }

    public void setStaleRunMinutes(int staleRunMinutes) {
        this.staleRunMinutes = Math.max(1, staleRunMinutes);
    }

    public Github getGithub() {
        return github;
    }

    public void setGithub(Github github) {
        this.github = github;
    }

    public Query getQuery() {
        return query;
    }

    public void setQuery(Query query) {
        this.query = query;
    }

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage;
    }

    public Export getExport() {
        return export;
    }

    public void setExport(Export export) {
        this.export = export;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Github {
        private String apiUrl = "https://api.github.com/graphql";
        private String token = "";
        private int pageSize = MAX_PAGE_SIZE;

        public String getApiUrl() {
            return apiUrl;
        }

        public void setApiUrl(String apiUrl) {
            this.apiUrl = apiUrl;
        }

        public String getToken() {
            return token == null ? "" : token.trim();
        }

        public void setToken(String token) {
            this.token = token;
        }

        public boolean hasToken() {
            return !getToken().isEmpty();
        }

        public int getPageSize() {
            return Math.max(1, Math.min(MAX_PAGE_SIZE, pageSize));
        }

        public void setPageSize(int pageSize) {
            this.pageSize = Math.max(1, Math.min(MAX_PAGE_SIZE, pageSize));
        }
    }

    public static class Query {
        private List<String> languages = new ArrayList<>(List.of(
            "Python", "JavaScript", "TypeScript", "Java", "Go",
            "Rust", "C++", "C", "C#", "Ruby",
            "PHP", "Swift", "Kotlin", "Scala", "Shell",
            "HTML", "CSS", "Vue", "Dart", "R"
        ));
        private StarRangeStrategy starStrategy = StarRangeStrategy.COARSE;
        private List<String> starRanges = new ArrayList<>();
        private boolean includeYears = true;
        private int firstYear = 2016;
        private int lastYear = 2024;

        public List<String> getLanguages() {
            return languages;
        }

        public void setLanguages(List<String> languages) {
            this.languages = languages == null ? new ArrayList<>() : languages;
        }

        public StarRangeStrategy getStarStrategy() {
            return starStrategy;
        }

        public void setStarStrategy(StarRangeStrategy starStrategy) {
            this.starStrategy = starStrategy == null ? StarRangeStrategy.COARSE : starStrategy;
        }

        public List<String> getStarRanges() {
            return starRanges;
        }

        public void setStarRanges(List<String> starRanges) {
            this.starRanges = starRanges == null ? new ArrayList<>() : starRanges;
        }

        public boolean isIncludeYears() {
            return includeYears;
        }

        public void setIncludeYears(boolean includeYears) {
            this.includeYears = includeYears;
        }

        public int getFirstYear() {
            return firstYear;
        }

        public void setFirstYear(int firstYear) {
            this.firstYear = firstYear;
        }

        public int getLastYear() {
            return Math.max(firstYear, lastYear);
        }

        public void setLastYear(int lastYear) {
            this.lastYear = lastYear;
        }
    }

    public static class Storage {
        private int batchSize = 500;
        private ChronoUnit snapshotGranularity = ChronoUnit.DAYS;

        public int getBatchSize() {
            return Math.max(1, batchSize);
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = Math.max(1, batchSize);
        }

        public ChronoUnit getSnapshotGranularity() {
            return snapshotGranularity;
        }

        public void setSnapshotGranularity(ChronoUnit snapshotGranularity) {
            this.snapshotGranularity = snapshotGranularity == null ? ChronoUnit.DAYS : snapshotGranularity;
        }
    }

    public static class Export {
        private String path = "star_counts.csv";

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }
    }

    public static class Cli {
        private boolean run;
        private int target;
        private boolean exportAfterRun;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public int getTarget() {
            return target;
        }

        public void setTarget(int target) {
            this.target = target;
        }

        public boolean isExportAfterRun() {
            return exportAfterRun;
        }

        public void setExportAfterRun(boolean exportAfterRun) {
            this.exportAfterRun = exportAfterRun;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
