package net.cratedigger.service.pipeline;

import java.util.List;
import java.util.Objects;
import net.cratedigger.config.RecommendationProperties;
import net.cratedigger.domain.recommendation.BackfillStrategy;
import net.cratedigger.domain.recommendation.RecommendationMode;

/**
 * Settings for one pipeline run. Every field contributes to the result cache key.
 */
public record PipelineRequest(
    int maxRecommendations,
    RecommendationMode mode,
    BackfillStrategy backfillStrategy,
    int maxTopUpIterations,
    List<String> styleFilters,
    boolean relaxStyleMatching
) {

    public PipelineRequest {
        if (maxRecommendations <= 0) {
            throw new IllegalArgumentException("maxRecommendations must be positive but was " + maxRecommendations);
        }
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(backfillStrategy, "backfillStrategy must not be null");
        maxTopUpIterations = Math.max(0, maxTopUpIterations);
        styleFilters = styleFilters == null ? List.of() : List.copyOf(styleFilters);
    }

    public static PipelineRequest from(RecommendationProperties properties) {
        return new PipelineRequest(
            properties.getMaxRecommendations(),
            properties.getMode(),
            properties.getBackfillStrategy(),
            properties.getMaxTopUpIterations(),
            properties.getStyleFilters(),
            properties.isRelaxStyleMatching()
        );
    }
}
