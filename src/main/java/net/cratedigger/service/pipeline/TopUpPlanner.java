package net.cratedigger.service.pipeline;

import net.cratedigger.domain.recommendation.BackfillStrategy;
import org.springframework.stereotype.Component;

/**
 * Decides whether and how much to top up a short batch.
 */
@Component
public class TopUpPlanner {

    /** Extra candidates requested per missing item, since some will be filtered again. */
    private static final double OVERFETCH_RATIO = 0.5;

    /**
     * Top-up runs only when something survived, the batch is short, and the strategy allows it.
     */
    public boolean shouldTopUp(int survivors, PipelineRequest request) {
        return survivors > 0
            && survivors < request.maxRecommendations()
            && request.backfillStrategy() != BackfillStrategy.OFF
            && maxRounds(request) > 0;
    }

    public int maxRounds(PipelineRequest request) {
        return request.backfillStrategy().effectiveIterations(request.maxTopUpIterations());
    }

    /**
     * Number of candidates to ask for when {@code deficit} items are missing.
     */
    public int requestSize(int deficit, BackfillStrategy strategy) {
        if (deficit <= 0) {
            return 0;
        }
        double ratio = strategy == BackfillStrategy.AGGRESSIVE ? OVERFETCH_RATIO * 2 : OVERFETCH_RATIO;
        return deficit + (int) Math.ceil(deficit * ratio);
    }
}
