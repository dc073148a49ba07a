package com.resultvault.api;

import com.resultvault.retention.RetentionReport;
import com.resultvault.shared.model.AnalysisResult;
import com.resultvault.shared.model.ResultArtifact;
import com.resultvault.storage.ResultNotFoundException;
import com.resultvault.storage.ResultStorage;
import com.resultvault.storage.ResultStorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.notNullValue;
import static org.mockito.Mockito.reset;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Web slice test for the result endpoints.
 */
@WebMvcTest(ResultController.class)
class ResultControllerTest {

    private static final Instant CREATED = Instant.parse("2026-01-11T02:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ResultStorage resultStorage;

    private ResultArtifact chart;

    @BeforeEach
    void setUp() {
        reset(resultStorage);
        chart = new ResultArtifact("r1", "chart.png", "alice/r1/chart.png", "image/png", 3L, Map.of());
        ReflectionTestUtils.setField(chart, "id", 42L);
    }

    @Test
    void testListResults() throws Exception {
        AnalysisResult result = new AnalysisResult("r1", "alice", CREATED, Map.of("source", "statement.xlsx"));
        result.setSummary(Map.of("net", 10));
        when(resultStorage.listResults("alice")).thenReturn(List.of(result));

        mockMvc.perform(get("/api/users/alice/results"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].resultId").value("r1"))
                .andExpect(jsonPath("$[0].finalized").value(true))
                .andExpect(jsonPath("$[0].metadata.source").value("statement.xlsx"));
    }

    @Test
    void testUnknownResultIs404WithTraceId() throws Exception {
        when(resultStorage.findResult("alice", "nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/users/alice/results/nope").header("X-Request-ID", "req-123"))
                .andExpect(status().isNotFound())
                .andExpect(header().string("X-Request-ID", "req-123"))
                .andExpect(jsonPath("$.error").value("ResultNotFound"))
                .andExpect(jsonPath("$.traceId").value("req-123"));
    }

    @Test
    void testListArtifacts() throws Exception {
        when(resultStorage.listArtifacts("alice", "r1")).thenReturn(List.of(chart));

        mockMvc.perform(get("/api/users/alice/results/r1/artifacts"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(42))
                .andExpect(jsonPath("$[0].uri").value("alice/r1/chart.png"))
                .andExpect(jsonPath("$[0].size").value(3));
    }

    @Test
    void testListArtifactsOfUnknownResult() throws Exception {
        when(resultStorage.listArtifacts("alice", "nope")).thenThrow(new ResultNotFoundException("nope"));

        mockMvc.perform(get("/api/users/alice/results/nope/artifacts"))
                .andExpect(status().isNotFound());
    }

    @Test
    void testDownloadArtifact() throws Exception {
        when(resultStorage.listArtifacts("alice", "r1")).thenReturn(List.of(chart));
        when(resultStorage.readArtifact("alice/r1/chart.png")).thenReturn(new byte[] {1, 2, 3});

        mockMvc.perform(get("/api/users/alice/results/r1/artifacts/42"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Type", "image/png"))
                .andExpect(content().bytes(new byte[] {1, 2, 3}));
    }

    @Test
    void testDownloadEncodesUnsafeFileName() throws Exception {
        ResultArtifact report = new ResultArtifact("r1", "q1 \"final\" r\u00e9sum\u00e9.csv", "alice/r1/q1_final.csv",
                "text/csv", 1L, Map.of());
        ReflectionTestUtils.setField(report, "id", 43L);
        when(resultStorage.listArtifacts("alice", "r1")).thenReturn(List.of(report));
        when(resultStorage.readArtifact("alice/r1/q1_final.csv")).thenReturn(new byte[] {7});

        String disposition = mockMvc.perform(get("/api/users/alice/results/r1/artifacts/43"))
                .andExpect(status().isOk())
                .andReturn().getResponse().getHeader("Content-Disposition");

        assertThat(disposition).startsWith("inline;");
        assertThat(disposition).contains("filename*=UTF-8''");
        assertThat(disposition).contains("r%C3%A9sum%C3%A9.csv");
        assertThat(disposition).doesNotContain("\"final\"");
        assertThat(disposition.chars().allMatch(c -> c < 128)).isTrue();
    }

    @Test
    void testDownloadMissingArtifact() throws Exception {
        when(resultStorage.listArtifacts("alice", "r1")).thenReturn(List.of(chart));

        mockMvc.perform(get("/api/users/alice/results/r1/artifacts/7"))
                .andExpect(status().isNotFound());
    }

    @Test
    void testUnreadableBlobIs500() throws Exception {
        when(resultStorage.listArtifacts("alice", "r1")).thenReturn(List.of(chart));
        when(resultStorage.readArtifact("alice/r1/chart.png")).thenThrow(new ResultStorageException("gone"));

        mockMvc.perform(get("/api/users/alice/results/r1/artifacts/42"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("StorageError"))
                .andExpect(jsonPath("$.timestamp", notNullValue()));
    }

    @Test
    void testDeleteResult() throws Exception {
        when(resultStorage.deleteResult("alice", "r1")).thenReturn(true);
        when(resultStorage.deleteResult("alice", "r2")).thenReturn(false);

        mockMvc.perform(delete("/api/users/alice/results/r1")).andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/users/alice/results/r2")).andExpect(status().isNotFound());
    }

    @Test
    void testEnforceRetention() throws Exception {
        when(resultStorage.enforceRetention("alice"))
                .thenReturn(new RetentionReport("alice", 5, List.of("r1", "r2"), 0, 1024L));

        mockMvc.perform(post("/api/users/alice/results/retention"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted").value(2))
                .andExpect(jsonPath("$.deletedResultIds[1]").value("r2"))
                .andExpect(jsonPath("$.remainingBytes").value(1024));

        verify(resultStorage).enforceRetention("alice");
    }
}
