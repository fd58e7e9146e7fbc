package net.cratedigger.service.pipeline;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import net.cratedigger.domain.recommendation.Recommendation;
import net.cratedigger.domain.recommendation.RecommendationMode;
import net.cratedigger.domain.review.ReviewKey;
import net.cratedigger.domain.review.ReviewStatus;
import net.cratedigger.service.history.SuggestionHistory;
import net.cratedigger.service.library.LibraryCatalog;
import net.cratedigger.service.review.ReviewQueue;
import org.springframework.stereotype.Component;

/**
 * Third pipeline stage: removes items the user already has or already turned down.
 *
 * <p>An item is removed when it is in the library, when the suggestion history
 * reports it rejected or disliked, when the review queue holds it as
 * {@code Rejected} or {@code Never}, or when an earlier item in the same batch (or
 * an item already accepted by this run) has the same key.</p>
 */
@Component
public class DuplicateFilter {

    private final LibraryCatalog library;
    private final SuggestionHistory history;
    private final ReviewQueue reviewQueue;

    public DuplicateFilter(LibraryCatalog library, SuggestionHistory history, ReviewQueue reviewQueue) {
        this.library = Objects.requireNonNull(library, "library must not be null");
        this.history = Objects.requireNonNull(history, "history must not be null");
        this.reviewQueue = Objects.requireNonNull(reviewQueue, "reviewQueue must not be null");
    }

    StageOutcome filter(List<Recommendation> items, RecommendationMode mode, Set<ReviewKey> alreadyAccepted) {
        Set<ReviewKey> seen = new HashSet<>(alreadyAccepted);
        List<Recommendation> kept = new ArrayList<>(items.size());
        List<FilteredRecommendation> filtered = new ArrayList<>();
        for (Recommendation item : items) {
            ReviewKey key = keyFor(item, mode);
            if (seen.contains(key)) {
                filtered.add(FilteredRecommendation.reportOnly(item, PipelineStage.DEDUPLICATE, "duplicate in batch"));
                continue;
            }
            String reason = exclusionReason(item, mode);
            if (reason != null) {
                filtered.add(FilteredRecommendation.of(item, PipelineStage.DEDUPLICATE, reason));
                continue;
            }
            seen.add(key);
            kept.add(item);
        }
        return new StageOutcome(kept, filtered);
    }

    static ReviewKey keyFor(Recommendation item, RecommendationMode mode) {
        return mode.requiresAlbum() ? ReviewKey.of(item.artist(), item.album()) : ReviewKey.of(item.artist(), "");
    }

    /**
     * Albums under which a standing decision about the item may be recorded. Artist-mode
     * items keep the album the provider named, and queue and history entries are keyed by
     * it, so both the artist-only key and the album key are checked.
     */
    private static List<String> decisionAlbums(Recommendation item, RecommendationMode mode) {
        if (mode.requiresAlbum()) {
            return List.of(item.album());
        }
        String album = item.album() == null ? "" : item.album().trim();
        return album.isEmpty() ? List.of("") : List.of("", album);
    }

    private String exclusionReason(Recommendation item, RecommendationMode mode) {
        boolean inLibrary = mode.requiresAlbum()
            ? library.containsAlbum(item.artist(), item.album())
            : library.containsArtist(item.artist());
        if (inLibrary) {
            return "already in library";
        }
        for (String album : decisionAlbums(item, mode)) {
            if (history.wasRejectedOrDisliked(item.artist(), album)) {
                return "previously rejected or disliked";
            }
            ReviewStatus status = reviewQueue.findStatus(item.artist(), album).orElse(null);
            if (status != null && status.blocksResuggestion()) {
                return "review status " + status.wireName();
            }
        }
        return null;
    }
}
