package net.cratedigger.service.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.cratedigger.domain.recommendation.Recommendation;

/**
 * Items that passed a stage, in order, and the items it removed.
 *
 * <p>{@code kept} may hold {@code null} entries only between sanitizing and
 * schema validation, which drops them.</p>
 */
public record StageOutcome(List<Recommendation> kept, List<FilteredRecommendation> filtered) {

    public StageOutcome {
        kept = Collections.unmodifiableList(new ArrayList<>(kept));
        filtered = List.copyOf(filtered);
    }

    public static StageOutcome passThrough(List<Recommendation> items) {
        return new StageOutcome(items, List.of());
    }
}
