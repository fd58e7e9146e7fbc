package net.cratedigger.controller;

import java.util.List;
import lombok.extern.slf4j.Slf4j;
import net.cratedigger.config.RecommendationProperties;
import net.cratedigger.domain.recommendation.BackfillStrategy;
import net.cratedigger.domain.recommendation.Recommendation;
import net.cratedigger.service.history.HistorySummary;
import net.cratedigger.service.history.SuggestionHistory;
import net.cratedigger.service.pipeline.PipelineRequest;
import net.cratedigger.service.pipeline.PipelineResult;
import net.cratedigger.service.pipeline.RecommendationPipeline;
import net.cratedigger.service.provider.RecommendationProviderException;
import net.cratedigger.support.cache.BoundedCache;
import net.cratedigger.support.cache.CacheStatistics;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

/**
 * Runs the recommendation pipeline on demand and reports cache and history state.
 */
@RestController
@RequestMapping("/api/recommendations")
@Slf4j
public class RecommendationController {

    private final RecommendationPipeline pipeline;
    private final RecommendationProperties properties;
    private final BoundedCache<String, List<Recommendation>> resultCache;
    private final SuggestionHistory history;

    public RecommendationController(RecommendationPipeline pipeline,
                                    RecommendationProperties properties,
                                    BoundedCache<String, List<Recommendation>> resultCache,
                                    SuggestionHistory history) {
        this.pipeline = pipeline;
        this.properties = properties;
        this.resultCache = resultCache;
        this.history = history;
    }

    /**
     * Runs one batch. Omitted parameters fall back to {@code cratedigger.recommendations.*}.
     *
     * @param max overrides the number of delivered items
     * @param styles overrides the style filters
     * @param relax overrides relaxed style matching
     * @param backfill overrides the backfill strategy
     * @return delivered items with filter diagnostics
     */
    @PostMapping("/run")
    public PipelineResult run(@RequestParam(name = "max", required = false) Integer max,
                              @RequestParam(name = "styles", required = false) List<String> styles,
                              @RequestParam(name = "relax", required = false) Boolean relax,
                              @RequestParam(name = "backfill", required = false) BackfillStrategy backfill) {
        PipelineRequest defaults = PipelineRequest.from(properties);
        PipelineRequest request;
        try {
            request = new PipelineRequest(
                max != null ? max : defaults.maxRecommendations(),
                defaults.mode(),
                backfill != null ? backfill : defaults.backfillStrategy(),
                defaults.maxTopUpIterations(),
                styles != null ? styles : defaults.styleFilters(),
                relax != null ? relax : defaults.relaxStyleMatching());
        } catch (IllegalArgumentException invalid) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, invalid.getMessage(), invalid);
        }
        try {
            return pipeline.run(request);
        } catch (RecommendationProviderException failure) {
            log.warn("Recommendation run failed ({}): {}", failure.errorCode(), failure.getMessage());
            HttpStatus status = switch (failure.errorCode()) {
                case RATE_LIMITED -> HttpStatus.TOO_MANY_REQUESTS;
                case NOT_CONFIGURED, CIRCUIT_OPEN -> HttpStatus.SERVICE_UNAVAILABLE;
                case REQUEST_FAILED, MALFORMED_RESPONSE -> HttpStatus.BAD_GATEWAY;
            };
            throw new ResponseStatusException(status, failure.getMessage(), failure);
        }
    }

    @GetMapping("/cache-stats")
    public CacheStatistics cacheStatistics() {
        return resultCache.statistics();
    }

    @GetMapping("/history-summary")
    public HistorySummary historySummary() {
        return history.summary();
    }
}
