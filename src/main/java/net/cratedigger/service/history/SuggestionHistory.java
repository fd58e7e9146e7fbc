package net.cratedigger.service.history;

import java.util.Collection;
import net.cratedigger.domain.history.DislikeLevel;
import net.cratedigger.domain.recommendation.Recommendation;

/**
 * Append-only record of what was suggested and how the user reacted.
 *
 * <p>Entries are never edited or removed. Appends are visible to readers as soon
 * as the call returns.</p>
 */
public interface SuggestionHistory {

    void recordSuggestions(Collection<Recommendation> items);

    /**
     * Records a rejection.
     *
     * @return {@code false} when the item was suggested too recently for a rejection to count
     */
    boolean recordRejected(String artist, String album, String reason);

    /**
     * Records a dislike.
     *
     * @return {@code false} when the item was suggested too recently for a dislike to count
     */
    boolean recordDisliked(String artist, String album, DislikeLevel level);

    void recordAccepted(String artist, String album);

    /**
     * Whether the item should be kept out of new batches: any dislike, or a rejection
     * still inside the rejection memory, and no acceptance since.
     */
    boolean wasRejectedOrDisliked(String artist, String album);

    /**
     * Compact exclusion lines for provider prompts, or an empty string when nothing applies.
     */
    String exclusionPrompt();

    HistorySummary summary();
}
