package com.stargazer.tracker.crawl.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.stargazer.tracker.config.CrawlerProperties;
import com.stargazer.tracker.crawl.model.GitHubRepo;
import com.stargazer.tracker.crawl.model.HttpFetchResult;
import com.stargazer.tracker.crawl.model.SearchPage;
import com.stargazer.tracker.crawl.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * {@link PageFetcher} over the GitHub GraphQL repository search.
 *
 * <p>Transport failures, timeouts and 408/5xx responses back off exponentially. An explicit
 * rate-limit response (HTTP 429, a 403 mentioning the rate limit, or a {@code RATE_LIMITED}
 * GraphQL error) sleeps for {@code Retry-After} or the configured rate-limit pause. Both
 * consume an attempt; when the budget runs out the query is given up with a
 * {@link PageFetchException}.
 */
@Service
public class GitHubSearchFetcher implements PageFetcher {
    private static final Logger log = LoggerFactory.getLogger(GitHubSearchFetcher.class);
    private static final int UNKNOWN_REMAINING = Integer.MAX_VALUE;

    static final String SEARCH_QUERY = """
        query SearchRepos($query: String!, $first: Int!, $after: String) {
          rateLimit {
            remaining
            resetAt
            cost
          }
          search(query: $query, type: REPOSITORY, first: $first, after: $after) {
            repositoryCount
            pageInfo {
              hasNextPage
              endCursor
            }
            nodes {
              ... on Repository {
                id
                nameWithOwner
                name
                owner { login }
                description
                primaryLanguage { name }
                isPrivate
                stargazerCount
                createdAt
                updatedAt
              }
            }
          }
        }
        """;

    private final GraphqlHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final GitHubRepoMapper mapper;
    private final CrawlerProperties properties;
    private final Sleeper sleeper;

    public GitHubSearchFetcher(
        GraphqlHttpClient httpClient,
        ObjectMapper objectMapper,
        GitHubRepoMapper mapper,
        CrawlerProperties properties,
        Sleeper sleeper
    ) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.mapper = mapper;
        this.properties = properties;
        this.sleeper = sleeper;
    }

    @Override
    public SearchPage fetchPage(String query, String cursor) {
        String payload = buildPayload(query, cursor);
        int maxAttempts = properties.getRequestMaxAttempts();
        String lastFailure = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            HttpFetchResult result = httpClient.postJson(payload);

            if (isRateLimitResponse(result)) {
                lastFailure = "rate_limited (" + result.describe() + ")";
                pauseForRateLimit(query, result.retryAfterSeconds(), attempt, maxAttempts);
                continue;
            }
            if (isRetryable(result)) {
                lastFailure = result.describe();
                log.warn(
                    "Search request failed attempt {}/{} for query '{}': {}",
                    attempt,
                    maxAttempts,
                    abbreviate(query),
                    lastFailure
                );
                if (attempt < maxAttempts) {
                    backoff(query, attempt);
                }
                continue;
            }
            if (!result.isSuccessful()) {
                throw new PageFetchException(query, "Search request rejected with " + result.describe());
            }

            JsonNode root;
            try {
                root = objectMapper.readTree(result.body());
            } catch (JsonProcessingException e) {
                lastFailure = "invalid_json: " + e.getOriginalMessage();
                log.warn("Unparseable search response attempt {}/{} for query '{}'", attempt, maxAttempts, abbreviate(query));
                if (attempt < maxAttempts) {
                    backoff(query, attempt);
                }
                continue;
            }

            if (hasRateLimitedError(root)) {
                lastFailure = "graphql_rate_limited";
                pauseForRateLimit(query, result.retryAfterSeconds(), attempt, maxAttempts);
                continue;
            }
            JsonNode errors = root.path("errors");
            if (errors.isArray() && !errors.isEmpty()) {
                log.warn("GraphQL errors for query '{}': {}", abbreviate(query), errors);
            }
            JsonNode data = root.path("data");
            if (!data.isObject() || !data.path("search").isObject()) {
                throw new PageFetchException(query, "Search response carried no data: " + errors);
            }
            return toPage(query, data);
        }

        throw new PageFetchException(
            query,
            "Exhausted " + maxAttempts + " attempts for query '" + abbreviate(query) + "': " + lastFailure
        );
    }

    String buildPayload(String query, String cursor) {
        ObjectNode variables = objectMapper.createObjectNode();
        variables.put("query", query);
        variables.put("first", properties.getGithub().getPageSize());
        if (cursor == null) {
            variables.putNull("after");
        } else {
            variables.put("after", cursor);
        }
        ObjectNode request = objectMapper.createObjectNode();
        request.put("query", SEARCH_QUERY);
        request.set("variables", variables);
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new PageFetchException(query, "Failed to encode search request", e);
        }
    }

    private SearchPage toPage(String query, JsonNode data) {
        JsonNode search = data.path("search");
        JsonNode nodes = search.path("nodes");
        List<GitHubRepo> repos = new ArrayList<>();
        int skipped = 0;
        if (nodes.isArray()) {
            for (JsonNode node : nodes) {
                Optional<GitHubRepo> repo = mapper.map(node);
                if (repo.isPresent()) {
                    repos.add(repo.get());
                } else {
                    skipped++;
                }
            }
        }
        if (skipped > 0) {
            log.debug("Skipped {} unusable nodes for query '{}'", skipped, abbreviate(query));
        }

        JsonNode pageInfo = search.path("pageInfo");
        JsonNode endCursor = pageInfo.path("endCursor");
        JsonNode remaining = data.path("rateLimit").path("remaining");
        return new SearchPage(
            repos,
            pageInfo.path("hasNextPage").asBoolean(false),
            endCursor.isTextual() ? endCursor.asText() : null,
            remaining.isNumber() ? remaining.asInt() : UNKNOWN_REMAINING
        );
    }

    private boolean isRateLimitResponse(HttpFetchResult result) {
        if (result.isTransportError()) {
            return false;
        }
        int status = result.statusCode();
        if (status == 429) {
            return true;
        }
        if (status == 403 && result.body() != null) {
            return result.body().toLowerCase(Locale.ROOT).contains("rate limit");
        }
        return false;
    }

    private boolean isRetryable(HttpFetchResult result) {
        if (result.isTransportError()) {
            return !"invalid_url".equals(result.errorCode()) && !"interrupted".equals(result.errorCode());
        }
        int status = result.statusCode();
        return status == 408 || status >= 500;
    }

    private boolean hasRateLimitedError(JsonNode root) {
        JsonNode errors = root.path("errors");
        if (!errors.isArray()) {
            return false;
        }
        for (JsonNode error : errors) {
            if ("RATE_LIMITED".equals(error.path("type").asText(null))) {
                return true;
            }
        }
        return false;
    }

    private void pauseForRateLimit(String query, Long retryAfterSeconds, int attempt, int maxAttempts) {
        if (attempt >= maxAttempts) {
            return;
        }
        Duration pause = retryAfterSeconds != null
            ? Duration.ofSeconds(retryAfterSeconds)
            : Duration.ofMillis(properties.getRateLimitedSleepMs());
        log.info("Rate limited on query '{}', sleeping {} ms before retry", abbreviate(query), pause.toMillis());
        sleep(query, pause);
    }

    private void backoff(String query, int attempt) {
        int baseDelayMs = properties.getRequestRetryBaseDelayMs();
        if (baseDelayMs <= 0) {
            return;
        }
        long delay = (long) baseDelayMs * (1L << Math.min(30, Math.max(0, attempt - 1)));
        int maxDelayMs = properties.getRequestRetryMaxDelayMs();
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        sleep(query, Duration.ofMillis(delay));
    }

    private void sleep(String query, Duration duration) {
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PageFetchException(query, "Interrupted while waiting to retry", e);
        }
    }

    private static String abbreviate(String query) {
        if (query == null || query.length() <= 80) {
            return query;
        }
        return query.substring(0, 80) + "...";
    }
}
