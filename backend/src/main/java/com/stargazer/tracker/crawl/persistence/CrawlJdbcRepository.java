package com.stargazer.tracker.crawl.persistence;

import com.stargazer.tracker.config.CrawlerProperties;
import com.stargazer.tracker.crawl.model.CrawlRunStatus;
import com.stargazer.tracker.crawl.model.CrawlRunView;
import com.stargazer.tracker.crawl.model.GitHubRepo;
import com.stargazer.tracker.crawl.model.LatestStarCount;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;

@Repository
public class CrawlJdbcRepository implements RepoStorage {
    private static final Logger log = LoggerFactory.getLogger(CrawlJdbcRepository.class);
    private static final int MAX_ERROR_LENGTH = 2000;

    private static final String UPSERT_REPOSITORY_POSTGRES = """
        INSERT INTO repositories (
            node_id, name_with_owner, name, owner_login, description, primary_language,
            is_private, created_at, updated_at, crawled_at
        )
        VALUES (
            :nodeId, :nameWithOwner, :name, :ownerLogin, :description, :primaryLanguage,
            :isPrivate, :createdAt, :updatedAt, :crawledAt
        )
        ON CONFLICT (node_id)
        DO UPDATE SET
            name_with_owner = EXCLUDED.name_with_owner,
            name = EXCLUDED.name,
            owner_login = EXCLUDED.owner_login,
            description = EXCLUDED.description,
            primary_language = EXCLUDED.primary_language,
            is_private = EXCLUDED.is_private,
            updated_at = EXCLUDED.updated_at,
            crawled_at = EXCLUDED.crawled_at
        """;

    private static final String UPDATE_REPOSITORY = """
        UPDATE repositories
        SET name_with_owner = :nameWithOwner,
            name = :name,
            owner_login = :ownerLogin,
            description = :description,
            primary_language = :primaryLanguage,
            is_private = :isPrivate,
            updated_at = :updatedAt,
            crawled_at = :crawledAt
        WHERE node_id = :nodeId
        """;

    private static final String INSERT_REPOSITORY = """
        INSERT INTO repositories (
            node_id, name_with_owner, name, owner_login, description, primary_language,
            is_private, created_at, updated_at, crawled_at
        )
        VALUES (
            :nodeId, :nameWithOwner, :name, :ownerLogin, :description, :primaryLanguage,
            :isPrivate, :createdAt, :updatedAt, :crawledAt
        )
        """;

    private static final String INSERT_SNAPSHOT = """
        INSERT INTO repository_stars (node_id, star_count, recorded_at)
        VALUES (:nodeId, :starCount, :recordedAt)
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final boolean postgres;
    private final CrawlerProperties properties;

    public CrawlJdbcRepository(NamedParameterJdbcTemplate jdbc, CrawlerProperties properties) {
        this.jdbc = jdbc;
        this.postgres = detectPostgres(jdbc);
        this.properties = properties;
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public Map<String, Long> tableCounts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        counts.put("repositories", countTable("repositories"));
        counts.put("repository_stars", countTable("repository_stars"));
        counts.put("crawl_runs", countTable("crawl_runs"));
        return counts;
    }

    public long countTable(String tableName) {
        Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM " + tableName, Long.class);
        return count == null ? 0L : count;
    }

    @Override
    public long createRun() {
        Instant startedAt = Instant.now();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("startedAt", toTimestamp(startedAt))
            .addValue("status", CrawlRunStatus.RUNNING.name());

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO crawl_runs (started_at, repos_fetched, status)
                VALUES (:startedAt, 0, :status)
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert crawl run");
        }
        return key.longValue();
    }

    /**
     * Upserts the repository rows and records one star snapshot per repository. The snapshot
     * time is truncated to the configured granularity, so re-applying a batch within the same
     * window adds no rows.
     */
    @Override
    public void upsertBatch(List<GitHubRepo> repos) {
        if (repos == null || repos.isEmpty()) {
            return;
        }
        Instant now = Instant.now();
        Instant recordedAt = truncate(now, properties.getStorage().getSnapshotGranularity());
        int batchSize = properties.getStorage().getBatchSize();

        for (int i = 0; i < repos.size(); i += batchSize) {
            List<GitHubRepo> chunk = repos.subList(i, Math.min(repos.size(), i + batchSize));
            MapSqlParameterSource[] repoParams = chunk.stream()
                .map(repo -> repositoryParams(repo, now))
                .toArray(MapSqlParameterSource[]::new);
            MapSqlParameterSource[] snapshotParams = chunk.stream()
                .map(repo -> snapshotParams(repo, recordedAt))
                .toArray(MapSqlParameterSource[]::new);

            if (postgres) {
                jdbc.batchUpdate(UPSERT_REPOSITORY_POSTGRES, repoParams);
                jdbc.batchUpdate(INSERT_SNAPSHOT + " ON CONFLICT (node_id, recorded_at) DO NOTHING", snapshotParams);
            } else {
                for (MapSqlParameterSource params : repoParams) {
                    upsertRepositoryLegacy(params);
                }
                for (MapSqlParameterSource params : snapshotParams) {
                    insertSnapshotLegacy(params);
                }
            }
            log.debug("Persisted {} repositories (postgres={})", chunk.size(), postgres);
        }
    }

    @Override
    public void updateRunProgress(long runId, int reposFetched) {
        jdbc.update(
            """
                UPDATE crawl_runs
                SET repos_fetched = :reposFetched
                WHERE id = :runId
                """,
            new MapSqlParameterSource()
                .addValue("runId", runId)
                .addValue("reposFetched", reposFetched)
        );
    }

    @Override
    public void finishRun(long runId, int reposFetched, CrawlRunStatus status, String errorMessage) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("runId", runId)
            .addValue("finishedAt", toTimestamp(Instant.now()))
            .addValue("reposFetched", reposFetched)
            .addValue("status", status.name())
            .addValue("errorMessage", truncateError(errorMessage));
        jdbc.update(
            """
                UPDATE crawl_runs
                SET finished_at = :finishedAt,
                    repos_fetched = :reposFetched,
                    status = :status,
                    error_message = :errorMessage
                WHERE id = :runId
                """,
            params
        );
    }

    public CrawlRunView findCrawlRunById(long runId) {
        List<CrawlRunView> runs = jdbc.query(
            """
                SELECT id, started_at, finished_at, repos_fetched, status, error_message
                FROM crawl_runs
                WHERE id = :runId
                """,
            new MapSqlParameterSource("runId", runId),
            crawlRunRowMapper()
        );
        return runs.isEmpty() ? null : runs.get(0);
    }

    public CrawlRunView findMostRecentCrawlRun() {
        List<CrawlRunView> runs = findRecentCrawlRuns(1);
        return runs.isEmpty() ? null : runs.get(0);
    }

    public List<CrawlRunView> findRecentCrawlRuns(int limit) {
        int safeLimit = limit <= 0 ? 10 : limit;
        return jdbc.query(
            """
                SELECT id, started_at, finished_at, repos_fetched, status, error_message
                FROM crawl_runs
                ORDER BY started_at DESC, id DESC
                LIMIT :limit
                """,
            new MapSqlParameterSource("limit", safeLimit),
            crawlRunRowMapper()
        );
    }

    public List<CrawlRunView> findRunningCrawlRuns() {
        return jdbc.query(
            """
                SELECT id, started_at, finished_at, repos_fetched, status, error_message
                FROM crawl_runs
                WHERE status = 'RUNNING'
                ORDER BY started_at ASC, id ASC
                """,
            new MapSqlParameterSource(),
            crawlRunRowMapper()
        );
    }

    /**
     * Streams the newest snapshot of every repository, highest star count first.
     */
    public void forEachLatestStarCount(Consumer<LatestStarCount> consumer) {
        jdbc.query(
            """
                SELECT r.node_id, r.name_with_owner, r.owner_login, r.name, s.star_count, s.recorded_at
                FROM repositories r
                JOIN repository_stars s ON s.node_id = r.node_id
                JOIN (
                    SELECT node_id, MAX(recorded_at) AS recorded_at
                    FROM repository_stars
                    GROUP BY node_id
                ) latest ON latest.node_id = s.node_id AND latest.recorded_at = s.recorded_at
                ORDER BY s.star_count DESC, r.node_id ASC
                """,
            new MapSqlParameterSource(),
            (RowCallbackHandler) rs -> {
                consumer.accept(new LatestStarCount(
                    rs.getString("node_id"),
                    rs.getString("name_with_owner"),
                    rs.getString("owner_login"),
                    rs.getString("name"),
                    rs.getInt("star_count"),
                    toInstant(rs.getTimestamp("recorded_at"))
                ));
            }
        );
    }

    private void upsertRepositoryLegacy(MapSqlParameterSource params) {
        int updated = jdbc.update(UPDATE_REPOSITORY, params);
        if (updated > 0) {
            return;
        }
        try {
            jdbc.update(INSERT_REPOSITORY, params);
        } catch (DuplicateKeyException e) {
            log.debug("Repository {} inserted concurrently, updating instead", params.getValue("nodeId"));
            jdbc.update(UPDATE_REPOSITORY, params);
        }
    }

    private void insertSnapshotLegacy(MapSqlParameterSource params) {
        try {
            jdbc.update(INSERT_SNAPSHOT, params);
        } catch (DuplicateKeyException e) {
            log.debug(
                "Snapshot for {} at {} already recorded",
                params.getValue("nodeId"),
                params.getValue("recordedAt")
            );
        }
    }

    private MapSqlParameterSource repositoryParams(GitHubRepo repo, Instant crawledAt) {
        return new MapSqlParameterSource()
            .addValue("nodeId", repo.nodeId())
            .addValue("nameWithOwner", repo.nameWithOwner())
            .addValue("name", repo.name())
            .addValue("ownerLogin", repo.ownerLogin())
            .addValue("description", repo.description())
            .addValue("primaryLanguage", repo.primaryLanguage())
            .addValue("isPrivate", repo.isPrivate())
            .addValue("createdAt", toTimestamp(repo.createdAt()))
            .addValue("updatedAt", toTimestamp(repo.updatedAt()))
            .addValue("crawledAt", toTimestamp(crawledAt));
    }

    private MapSqlParameterSource snapshotParams(GitHubRepo repo, Instant recordedAt) {
        return new MapSqlParameterSource()
            .addValue("nodeId", repo.nodeId())
            .addValue("starCount", Math.max(0, repo.starCount()))
            .addValue("recordedAt", toTimestamp(recordedAt));
    }

    private RowMapper<CrawlRunView> crawlRunRowMapper() {
        return (rs, rowNum) -> new CrawlRunView(
            rs.getLong("id"),
            toInstant(rs.getTimestamp("started_at")),
            toInstant(rs.getTimestamp("finished_at")),
            rs.getInt("repos_fetched"),
            CrawlRunStatus.valueOf(rs.getString("status")),
            rs.getString("error_message")
        );
    }

    static Instant truncate(Instant value, ChronoUnit granularity) {
        if (granularity == null || granularity.compareTo(ChronoUnit.DAYS) > 0) {
            return value.truncatedTo(ChronoUnit.DAYS);
        }
        return value.truncatedTo(granularity);
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private String truncateError(String message) {
        if (message == null || message.length() <= MAX_ERROR_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_LENGTH);
    }

    private boolean detectPostgres(NamedParameterJdbcTemplate jdbcTemplate) {
        if (jdbcTemplate.getJdbcTemplate().getDataSource() == null) {
            return false;
        }
        try (Connection connection = jdbcTemplate.getJdbcTemplate().getDataSource().getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String productName = metaData == null ? null : metaData.getDatabaseProductName();
            String url = metaData == null ? null : metaData.getURL();
            if (url != null && url.toLowerCase(Locale.ROOT).startsWith("jdbc:h2:")) {
                return false;
            }
            return productName != null && productName.toLowerCase(Locale.ROOT).contains("postgres");
        } catch (Exception e) {
            log.warn("Unable to detect database product; falling back to portable upserts", e);
            return false;
        }
    }
}
