package net.cratedigger.support.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory cache with a hard entry bound, least-recently-used eviction,
 * per-entry time-to-live and single-flight computation.
 *
 * <p>Every read and write goes through one lock. Recency is tracked by an
 * access-ordered {@link LinkedHashMap}: a hit or an overwrite moves the entry
 * to the most-recently-used end, and insertion evicts from the other end until
 * the size is back within {@code maxSize}. Both {@link #set} and the completion
 * of {@link #getOrCompute} insert through the same routine.</p>
 *
 * <p>Concurrent {@link #getOrCompute} calls for the same missing key share one
 * in-flight future and the factory runs once. The factory runs outside the
 * lock. A failed or {@code null} computation is delivered to every waiter and
 * nothing is stored, so the next call computes again.</p>
 *
 * @param <K> key type
 * @param <V> value type, never {@code null}
 */
public class BoundedCache<K, V> {

    private static final Logger log = LoggerFactory.getLogger(BoundedCache.class);

    private static final long BASE_OVERHEAD_BYTES = 1024L;
    private static final long PER_ENTRY_BYTES = 32L + 1024L + 48L;

    private final String name;
    private final int maxSize;
    private final Duration defaultTtl;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<K, Entry<V>> entries = new LinkedHashMap<>(16, 0.75f, true);
    private final Map<K, CompletableFuture<V>> inFlight = new HashMap<>();
    private long hits;
    private long misses;
    private long evictions;

    /**
     * Creates a cache.
     *
     * @param name label used in logs and statistics
     * @param maxSize maximum number of entries, must be positive
     * @param defaultTtl lifetime applied when callers pass no TTL, must be positive
     * @param clock time source for expiry
     * @throws IllegalArgumentException when {@code maxSize} or {@code defaultTtl} is not positive
     */
    public BoundedCache(String name, int maxSize, Duration defaultTtl, Clock clock) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive but was " + maxSize);
        }
        this.maxSize = maxSize;
        this.defaultTtl = requirePositive(defaultTtl);
    }

    public String name() {
        return name;
    }

    /**
     * Returns the live value for a key. Expired entries are removed on sight and read as absent.
     */
    public Optional<V> get(K key) {
        Objects.requireNonNull(key, "key must not be null");
        lock.lock();
        try {
            Entry<V> entry = liveEntryLocked(key, clock.instant());
            if (entry == null) {
                misses++;
                return Optional.empty();
            }
            hits++;
            return Optional.of(entry.value());
        } finally {
            lock.unlock();
        }
    }

    public void set(K key, V value) {
        set(key, value, defaultTtl);
    }

    /**
     * Stores a value, replacing any previous entry for the key. Overwrites do not change the size.
     */
    public void set(K key, V value, Duration ttl) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Duration lifetime = ttl == null ? defaultTtl : requirePositive(ttl);
        lock.lock();
        try {
            storeLocked(key, value, lifetime);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the cached value or computes it once for all concurrent callers.
     *
     * <p>Each caller receives its own dependent future, so cancelling one caller's
     * future leaves the shared computation and the other callers untouched. When
     * the computation succeeds the value is stored before any caller observes it.</p>
     *
     * @param key cache key
     * @param ttl lifetime of the computed entry, {@code null} for the default
     * @param factory asynchronous producer invoked at most once per miss
     * @return future completing with the cached or computed value
     */
    public CompletableFuture<V> getOrCompute(K key, Duration ttl,
                                             Function<? super K, ? extends CompletionStage<V>> factory) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(factory, "factory must not be null");
        Duration lifetime = ttl == null ? defaultTtl : requirePositive(ttl);

        CompletableFuture<V> shared;
        boolean owner = false;
        lock.lock();
        try {
            Entry<V> entry = liveEntryLocked(key, clock.instant());
            if (entry != null) {
                hits++;
                return CompletableFuture.completedFuture(entry.value());
            }
            misses++;
            shared = inFlight.get(key);
            if (shared == null) {
                shared = new CompletableFuture<>();
                inFlight.put(key, shared);
                owner = true;
            }
        } finally {
            lock.unlock();
        }

        if (owner) {
            startComputation(key, lifetime, factory, shared);
        } else {
            log.debug("Cache '{}' joined in-flight computation for key {}", name, key);
        }
        return shared.copy();
    }

    /**
     * Removes a key. Returns whether a live or expired entry was present.
     */
    public boolean remove(K key) {
        Objects.requireNonNull(key, "key must not be null");
        lock.lock();
        try {
            return entries.remove(key) != null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops all stored entries. In-flight computations still complete and store their result.
     */
    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sweeps expired entries.
     *
     * @return number of entries removed
     */
    public int cleanupExpired() {
        Instant now = clock.instant();
        int removed = 0;
        lock.lock();
        try {
            Iterator<Entry<V>> iterator = entries.values().iterator();
            while (iterator.hasNext()) {
                if (iterator.next().isExpired(now)) {
                    iterator.remove();
                    removed++;
                }
            }
        } finally {
            lock.unlock();
        }
        if (removed > 0) {
            log.debug("Cache '{}' swept {} expired entries", name, removed);
        }
        return removed;
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public CacheStatistics statistics() {
        lock.lock();
        try {
            long lookups = hits + misses;
            double hitRate = lookups == 0 ? 0.0 : (double) hits / lookups;
            long memory = BASE_OVERHEAD_BYTES + entries.size() * PER_ENTRY_BYTES;
            return new CacheStatistics(name, entries.size(), maxSize, hits, misses, evictions, hitRate, memory);
        } finally {
            lock.unlock();
        }
    }

    private void startComputation(K key, Duration lifetime,
                                  Function<? super K, ? extends CompletionStage<V>> factory,
                                  CompletableFuture<V> shared) {
        CompletionStage<V> stage;
        try {
            stage = Objects.requireNonNull(factory.apply(key), "factory returned a null stage");
        } catch (RuntimeException factoryFailure) {
            failComputation(key, shared, factoryFailure);
            return;
        }
        stage.whenComplete((value, failure) -> {
            if (failure != null) {
                failComputation(key, shared, unwrap(failure));
                return;
            }
            if (value == null) {
                failComputation(key, shared, new IllegalStateException(
                    "Cache '%s' computation produced null for key %s".formatted(name, key)));
                return;
            }
            lock.lock();
            try {
                storeLocked(key, value, lifetime);
                inFlight.remove(key, shared);
            } finally {
                lock.unlock();
            }
            shared.complete(value);
        });
    }

    private void failComputation(K key, CompletableFuture<V> shared, Throwable failure) {
        lock.lock();
        try {
            inFlight.remove(key, shared);
        } finally {
            lock.unlock();
        }
        log.debug("Cache '{}' computation failed for key {}: {}", name, key, failure.toString());
        shared.completeExceptionally(failure);
    }

    private Entry<V> liveEntryLocked(K key, Instant now) {
        Entry<V> entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.isExpired(now)) {
            entries.remove(key);
            return null;
        }
        return entry;
    }

    private void storeLocked(K key, V value, Duration lifetime) {
        entries.put(key, new Entry<>(value, clock.instant().plus(lifetime)));
        while (entries.size() > maxSize) {
            Iterator<Map.Entry<K, Entry<V>>> eldest = entries.entrySet().iterator();
            K evictedKey = eldest.next().getKey();
            eldest.remove();
            evictions++;
            log.debug("Cache '{}' evicted least recently used key {}", name, evictedKey);
        }
    }

    private static Throwable unwrap(Throwable failure) {
        if ((failure instanceof CompletionException || failure instanceof ExecutionException)
            && failure.getCause() != null) {
            return failure.getCause();
        }
        return failure;
    }

    private static Duration requirePositive(Duration ttl) {
        Objects.requireNonNull(ttl, "ttl must not be null");
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive but was " + ttl);
        }
        return ttl;
    }

    private record Entry<V>(V value, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
