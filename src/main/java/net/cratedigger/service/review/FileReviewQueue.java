package net.cratedigger.service.review;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import net.cratedigger.domain.recommendation.Recommendation;
import net.cratedigger.domain.review.ReviewCounts;
import net.cratedigger.domain.review.ReviewItem;
import net.cratedigger.domain.review.ReviewKey;
import net.cratedigger.domain.review.ReviewStatus;
import net.cratedigger.support.persistence.JsonDocumentStore;
import org.springframework.util.StringUtils;

/**
 * {@link ReviewQueue} kept in memory and rewritten to a JSON document after every mutation.
 *
 * <p>When a write fails the transition still applies in memory; the next successful
 * mutation rewrites the whole document.</p>
 */
@Slf4j
public class FileReviewQueue implements ReviewQueue {

    private final JsonDocumentStore<List<ReviewItem>> store;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<ReviewKey, ReviewItem> items = new LinkedHashMap<>();

    public FileReviewQueue(JsonDocumentStore<List<ReviewItem>> store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        for (ReviewItem item : store.load(List::of)) {
            if (item != null && StringUtils.hasText(item.artist()) && item.status() != null) {
                items.putIfAbsent(item.key(), item);
            }
        }
        log.info("Review queue loaded {} items from {}", items.size(), store.path());
    }

    @Override
    public int enqueue(Collection<Recommendation> candidates, String reason) {
        if (candidates == null || candidates.isEmpty()) {
            return 0;
        }
        Instant now = clock.instant();
        int added = 0;
        lock.lock();
        try {
            for (Recommendation candidate : candidates) {
                if (candidate == null || !StringUtils.hasText(candidate.artist())) {
                    continue;
                }
                ReviewKey key = ReviewKey.of(candidate.artist(), candidate.album());
                if (items.putIfAbsent(key, ReviewItem.pending(candidate, reason, now)) == null) {
                    added++;
                }
            }
            if (added > 0) {
                persistLocked();
            }
        } finally {
            lock.unlock();
        }
        if (added > 0) {
            log.info("Queued {} of {} recommendations for review ({})", added, candidates.size(), reason);
        }
        return added;
    }

    @Override
    public boolean setStatus(String artist, String album, ReviewStatus status, String notes) {
        Objects.requireNonNull(status, "status must not be null");
        ReviewKey key = ReviewKey.of(artist, album);
        lock.lock();
        try {
            ReviewItem current = items.get(key);
            if (current == null) {
                return false;
            }
            items.put(key, current.transitionTo(status, notes, clock.instant()));
            persistLocked();
        } finally {
            lock.unlock();
        }
        log.debug("Review item {} moved to {}", key, status);
        return true;
    }

    @Override
    public Optional<ReviewStatus> findStatus(String artist, String album) {
        ReviewKey key = ReviewKey.of(artist, album);
        lock.lock();
        try {
            return Optional.ofNullable(items.get(key)).map(ReviewItem::status);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Recommendation> dequeueAccepted() {
        List<Recommendation> released = new ArrayList<>();
        lock.lock();
        try {
            Iterator<ReviewItem> iterator = items.values().iterator();
            while (iterator.hasNext()) {
                ReviewItem item = iterator.next();
                if (item.status() == ReviewStatus.ACCEPTED) {
                    released.add(item.toRecommendation());
                    iterator.remove();
                }
            }
            if (!released.isEmpty()) {
                persistLocked();
            }
        } finally {
            lock.unlock();
        }
        return released;
    }

    @Override
    public List<ReviewItem> getPending() {
        lock.lock();
        try {
            return items.values().stream()
                .filter(item -> item.status() == ReviewStatus.PENDING)
                .sorted(Comparator.comparing(ReviewItem::createdAt, Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ReviewCounts getCounts() {
        int pending = 0;
        int accepted = 0;
        int rejected = 0;
        int never = 0;
        lock.lock();
        try {
            for (ReviewItem item : items.values()) {
                switch (item.status()) {
                    case PENDING -> pending++;
                    case ACCEPTED -> accepted++;
                    case REJECTED -> rejected++;
                    case NEVER_AGAIN -> never++;
                }
            }
        } finally {
            lock.unlock();
        }
        return new ReviewCounts(pending, accepted, rejected, never);
    }

    @Override
    public int clear(ReviewStatus status) {
        Objects.requireNonNull(status, "status must not be null");
        lock.lock();
        try {
            int before = items.size();
            items.values().removeIf(item -> item.status() == status);
            int removed = before - items.size();
            if (removed > 0) {
                persistLocked();
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int clearAll() {
        lock.lock();
        try {
            int removed = items.size();
            items.clear();
            persistLocked();
            return removed;
        } finally {
            lock.unlock();
        }
    }

    private void persistLocked() {
        if (!store.save(List.copyOf(items.values()))) {
            log.warn("Review queue write failed; {} items remain in memory only until the next write", items.size());
        }
    }
}
