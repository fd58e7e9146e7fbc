package net.cratedigger.service.pipeline;

import net.cratedigger.domain.recommendation.Recommendation;

/**
 * An item removed from a batch, with the stage and reason that removed it.
 *
 * @param item removed item as it looked when removed, {@code null} for null input entries
 * @param stage stage that removed it
 * @param reason short human-readable explanation
 * @param reviewable whether the item is offered to the review queue
 */
public record FilteredRecommendation(Recommendation item, PipelineStage stage, String reason, boolean reviewable) {

    public static FilteredRecommendation of(Recommendation item, PipelineStage stage, String reason) {
        return new FilteredRecommendation(item, stage, reason, stage.reviewable() && item != null);
    }

    /**
     * Removal that is reported but never offered for review, such as an in-batch repeat.
     */
    public static FilteredRecommendation reportOnly(Recommendation item, PipelineStage stage, String reason) {
        return new FilteredRecommendation(item, stage, reason, false);
    }
}
