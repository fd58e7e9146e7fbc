package net.cratedigger.application.review;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import net.cratedigger.domain.review.ReviewKey;
import net.cratedigger.support.persistence.JsonDocumentStore;

/**
 * Externally tracked list of review keys the user ticked for a bulk action,
 * stored in {@code artist|album} form.
 */
@Slf4j
public class ApprovalSelection {

    private final JsonDocumentStore<List<String>> store;
    private final ReentrantLock lock = new ReentrantLock();
    private final Set<ReviewKey> keys = new LinkedHashSet<>();

    public ApprovalSelection(JsonDocumentStore<List<String>> store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        for (String raw : store.load(List::of)) {
            ReviewKey.parse(raw).ifPresent(keys::add);
        }
    }

    public List<ReviewKey> keys() {
        lock.lock();
        try {
            return List.copyOf(keys);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces the selection with the given keys.
     */
    public void replace(Collection<ReviewKey> selected) {
        lock.lock();
        try {
            keys.clear();
            if (selected != null) {
                keys.addAll(selected);
            }
            persistLocked();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Empties the selection.
     *
     * @return number of keys removed
     */
    public int clearSelection() {
        lock.lock();
        try {
            int cleared = keys.size();
            keys.clear();
            persistLocked();
            return cleared;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes only the given keys from the selection.
     *
     * @return number of keys removed
     */
    public int clearSelection(Collection<ReviewKey> processed) {
        if (processed == null || processed.isEmpty()) {
            return 0;
        }
        lock.lock();
        try {
            int before = keys.size();
            keys.removeAll(processed);
            int cleared = before - keys.size();
            if (cleared > 0) {
                persistLocked();
            }
            return cleared;
        } finally {
            lock.unlock();
        }
    }

    private void persistLocked() {
        if (!store.save(keys.stream().map(ReviewKey::asString).toList())) {
            log.warn("Approval selection write failed; {} keys kept in memory", keys.size());
        }
    }
}
