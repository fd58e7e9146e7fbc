package net.cratedigger.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Duration;
import java.util.List;
import net.cratedigger.config.RecommendationProperties;
import net.cratedigger.domain.recommendation.BackfillStrategy;
import net.cratedigger.domain.recommendation.Recommendation;
import net.cratedigger.domain.recommendation.ValidationReport;
import net.cratedigger.service.history.HistorySummary;
import net.cratedigger.service.history.SuggestionHistory;
import net.cratedigger.service.pipeline.PipelineRequest;
import net.cratedigger.service.pipeline.PipelineResult;
import net.cratedigger.service.pipeline.RecommendationPipeline;
import net.cratedigger.service.provider.RecommendationProviderException;
import net.cratedigger.service.provider.RecommendationProviderException.ErrorCode;
import net.cratedigger.support.cache.BoundedCache;
import net.cratedigger.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class RecommendationControllerTest {

    @Mock
    private RecommendationPipeline pipeline;

    @Mock
    private SuggestionHistory history;

    private BoundedCache<String, List<Recommendation>> resultCache;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        resultCache = new BoundedCache<>("results", 5, Duration.ofMinutes(5), MutableClock.startingAt("2026-03-01T00:00:00Z"));
        RecommendationController controller =
            new RecommendationController(pipeline, new RecommendationProperties(), resultCache, history);
        mockMvc = MockMvcBuilders.standaloneSetup(controller).build();
    }

    @Test
    void should_RunPipelineWithOverrides_When_ParametersGiven() throws Exception {
        PipelineResult result = new PipelineResult(
            List.of(Recommendation.of("Yes", "Fragile", "Progressive Rock", 0.9)),
            List.of(), ValidationReport.empty(), false, false, List.of());
        when(pipeline.run(any(PipelineRequest.class))).thenReturn(result);

        mockMvc.perform(post("/api/recommendations/run")
                .param("max", "3")
                .param("styles", "progressive-rock")
                .param("backfill", "OFF"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.recommendations[0].artist").value("Yes"))
            .andExpect(jsonPath("$.cacheHit").value(false));

        ArgumentCaptor<PipelineRequest> captor = ArgumentCaptor.forClass(PipelineRequest.class);
        verify(pipeline).run(captor.capture());
        assertThat(captor.getValue().maxRecommendations()).isEqualTo(3);
        assertThat(captor.getValue().styleFilters()).containsExactly("progressive-rock");
        assertThat(captor.getValue().backfillStrategy()).isEqualTo(BackfillStrategy.OFF);
    }

    @Test
    void should_ReturnBadRequest_When_MaxIsNotPositive() throws Exception {
        mockMvc.perform(post("/api/recommendations/run").param("max", "0"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void should_ReturnTooManyRequests_When_ProviderRateLimited() throws Exception {
        when(pipeline.run(any(PipelineRequest.class)))
            .thenThrow(new RecommendationProviderException(ErrorCode.RATE_LIMITED, "slow down"));

        mockMvc.perform(post("/api/recommendations/run"))
            .andExpect(status().isTooManyRequests());
    }

    @Test
    void should_ReportCacheStatistics_When_Requested() throws Exception {
        resultCache.set("key", List.of());

        mockMvc.perform(get("/api/recommendations/cache-stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.name").value("results"))
            .andExpect(jsonPath("$.size").value(1))
            .andExpect(jsonPath("$.maxSize").value(5));
    }

    @Test
    void should_ReportHistorySummary_When_Requested() throws Exception {
        when(history.summary()).thenReturn(new HistorySummary(4, 1, 0, 2, 1));

        mockMvc.perform(get("/api/recommendations/history-summary"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.suggestions").value(4))
            .andExpect(jsonPath("$.overSuggested").value(1));
    }
}
