package com.stargazer.tracker.crawl;

import com.stargazer.tracker.crawl.persistence.CrawlJdbcRepository;
import com.stargazer.tracker.crawl.model.CrawlRunStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class CrawlApiSmokeTest {

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private CrawlJdbcRepository repository;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void statusReportsConnectivityAndCounts() throws Exception {
        mockMvc.perform(get("/api/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.dbConnectivity").value(true))
            .andExpect(jsonPath("$.counts.repositories").isNumber())
            .andExpect(jsonPath("$.counts.repository_stars").isNumber())
            .andExpect(jsonPath("$.counts.crawl_runs").isNumber());
    }

    @Test
    void crawlRunEndpointIsPostOnly() throws Exception {
        mockMvc.perform(get("/api/crawl/run"))
            .andExpect(status().isMethodNotAllowed());
    }

    @Test
    void nonPositiveTargetIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/crawl/run").param("target", "0"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void unknownRunIsNotFound() throws Exception {
        mockMvc.perform(get("/api/crawl/runs/{id}", 987_654L))
            .andExpect(status().isNotFound());
    }

    @Test
    void finishedRunIsVisibleThroughApi() throws Exception {
        long runId = repository.createRun();
        repository.finishRun(runId, 12, CrawlRunStatus.SUCCESS, null);

        mockMvc.perform(get("/api/crawl/runs/{id}", runId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.crawlRunId").value(runId))
            .andExpect(jsonPath("$.status").value("SUCCESS"))
            .andExpect(jsonPath("$.reposFetched").value(12));

        mockMvc.perform(get("/api/crawl/runs").param("limit", "5"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$").isArray());
    }

    @Test
    void latestStarCountsAreServedAsCsv() throws Exception {
        mockMvc.perform(get("/api/stars/latest.csv"))
            .andExpect(status().isOk())
            .andExpect(content().contentTypeCompatibleWith("text/csv"))
            .andExpect(content().string(startsWith("node_id,name_with_owner,owner_login,name,star_count,recorded_at")));
    }
}
