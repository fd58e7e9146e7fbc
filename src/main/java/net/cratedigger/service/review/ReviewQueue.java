package net.cratedigger.service.review;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import net.cratedigger.domain.recommendation.Recommendation;
import net.cratedigger.domain.review.ReviewCounts;
import net.cratedigger.domain.review.ReviewItem;
import net.cratedigger.domain.review.ReviewStatus;

/**
 * Durable holding area for recommendations that need a human decision.
 *
 * <p>Keys are case-insensitive {@code (artist, album)} pairs. Enqueue is idempotent:
 * a key that already exists in any status is left untouched. Accepted items leave
 * the queue only through {@link #dequeueAccepted()}.</p>
 */
public interface ReviewQueue {

    /**
     * Adds items as {@link ReviewStatus#PENDING}.
     *
     * @param items candidates to hold
     * @param reason why they were held, stored as notes
     * @return number of items actually added
     */
    int enqueue(Collection<Recommendation> items, String reason);

    /**
     * Moves an item to a new status.
     *
     * @return {@code false} when no item exists for the key
     */
    boolean setStatus(String artist, String album, ReviewStatus status, String notes);

    Optional<ReviewStatus> findStatus(String artist, String album);

    /**
     * Removes and returns every accepted item.
     */
    List<Recommendation> dequeueAccepted();

    /**
     * Returns pending items, newest first.
     */
    List<ReviewItem> getPending();

    ReviewCounts getCounts();

    /**
     * Removes every item in the given status.
     *
     * @return number of items removed
     */
    int clear(ReviewStatus status);

    /**
     * Removes every item.
     *
     * @return number of items removed
     */
    int clearAll();
}
