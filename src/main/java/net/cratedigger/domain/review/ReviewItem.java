package net.cratedigger.domain.review;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import net.cratedigger.domain.recommendation.Recommendation;

/**
 * A recommendation held for manual review together with its review state.
 */
public record ReviewItem(
    String artist,
    String album,
    String genre,
    String reason,
    double confidence,
    Integer year,
    ReviewStatus status,
    Instant createdAt,
    Instant updatedAt,
    String notes
) {

    public static ReviewItem pending(Recommendation recommendation, String notes, Instant now) {
        return new ReviewItem(
            recommendation.artist(),
            recommendation.album(),
            recommendation.genre(),
            recommendation.reason(),
            recommendation.confidence(),
            recommendation.year(),
            ReviewStatus.PENDING,
            now,
            now,
            notes
        );
    }

    @JsonIgnore
    public ReviewKey key() {
        return ReviewKey.of(artist, album);
    }

    public ReviewItem transitionTo(ReviewStatus newStatus, String newNotes, Instant now) {
        String resolvedNotes = newNotes == null || newNotes.isBlank() ? notes : newNotes;
        return new ReviewItem(artist, album, genre, reason, confidence, year, newStatus, createdAt, now, resolvedNotes);
    }

    public Recommendation toRecommendation() {
        return new Recommendation(artist, album, genre, reason, confidence, year, "review-queue");
    }
}
