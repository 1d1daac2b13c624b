package com.stargazer.tracker.crawl.service;

import com.stargazer.tracker.crawl.model.GitHubRepo;
import com.stargazer.tracker.crawl.persistence.CrawlJdbcRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

@SpringBootTest
@ActiveProfiles("test")
class StarCountExportServiceTest {

    @Autowired
    private StarCountExportService exportService;

    @Autowired
    private CrawlJdbcRepository repository;

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    @TempDir
    Path tempDir;

    @BeforeEach
    void seed() {
        jdbc.getJdbcTemplate().execute("DELETE FROM repository_stars");
        jdbc.getJdbcTemplate().execute("DELETE FROM repositories");
        repository.upsertBatch(List.of(
            new GitHubRepo("R_a", "octo/a", "a", "octo", null, "Go", false, 3, null, null),
            new GitHubRepo("R_b", "octo/b,quoted", "b,quoted", "octo", null, "Go", false, 300, null, null)
        ));
    }

    @Test
    void writesHeaderAndRowsByStarCountDescending() throws Exception {
        StringWriter out = new StringWriter();

        int rows = exportService.write(out);

        String[] lines = out.toString().split("\n");
        assertEquals(2, rows);
        assertEquals("node_id,name_with_owner,owner_login,name,star_count,recorded_at", lines[0]);
        assertThat(lines[1]).startsWith("R_b,\"octo/b,quoted\",octo,\"b,quoted\",300,");
        assertThat(lines[2]).startsWith("R_a,octo/a,octo,a,3,");
    }

    @Test
    void exportsToFile() throws Exception {
        Path target = tempDir.resolve("out/star_counts.csv");

        int rows = exportService.exportToFile(target);

        assertEquals(2, rows);
        List<String> lines = Files.readAllLines(target, StandardCharsets.UTF_8);
        assertEquals(3, lines.size());
    }
}
