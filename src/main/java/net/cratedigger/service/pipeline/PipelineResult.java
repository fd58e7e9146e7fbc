package net.cratedigger.service.pipeline;

import java.util.List;
import net.cratedigger.domain.recommendation.Recommendation;
import net.cratedigger.domain.recommendation.ValidationReport;

/**
 * Outcome of one pipeline run.
 *
 * @param recommendations delivered items, at most the requested maximum, in pipeline order
 * @param filtered items removed during this run; empty on a cache hit
 * @param validationReport counters from sanitizing and validating; empty on a cache hit
 * @param cacheHit whether this run reused items it did not compute itself: a stored entry, or
 *     the computation of a concurrent run with the same key that it waited on. Diagnostics of
 *     such a run stay with the run that computed them.
 * @param cancelled whether the run stopped early; {@code recommendations} then holds what was ready
 * @param released items accepted through review and released for import since the previous run
 */
public record PipelineResult(
    List<Recommendation> recommendations,
    List<FilteredRecommendation> filtered,
    ValidationReport validationReport,
    boolean cacheHit,
    boolean cancelled,
    List<Recommendation> released
) {

    public PipelineResult {
        recommendations = List.copyOf(recommendations);
        filtered = List.copyOf(filtered);
        released = List.copyOf(released);
    }

    PipelineResult withReleased(List<Recommendation> releasedItems) {
        return new PipelineResult(recommendations, filtered, validationReport, cacheHit, cancelled, releasedItems);
    }

    static PipelineResult fromCache(List<Recommendation> recommendations) {
        return new PipelineResult(recommendations, List.of(), ValidationReport.empty(), true, false, List.of());
    }
}
