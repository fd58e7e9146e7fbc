package net.cratedigger.service.history;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import lombok.extern.slf4j.Slf4j;
import net.cratedigger.config.HistoryProperties;
import net.cratedigger.domain.history.DislikeLevel;
import net.cratedigger.domain.history.HistoryEvent;
import net.cratedigger.domain.history.HistoryRecord;
import net.cratedigger.domain.recommendation.Recommendation;
import net.cratedigger.domain.review.ReviewKey;
import net.cratedigger.support.persistence.JsonDocumentStore;
import org.springframework.util.StringUtils;

/**
 * {@link SuggestionHistory} backed by a JSON array on disk.
 *
 * <p>Entries are indexed per key in memory. Every append rewrites the document;
 * a failed write is logged and the entry stays visible in memory.</p>
 */
@Slf4j
public class FileSuggestionHistory implements SuggestionHistory {

    private static final int MAX_PROMPT_ENTRIES = 50;

    private final JsonDocumentStore<List<HistoryRecord>> store;
    private final Clock clock;
    private final Duration rejectionGuard;
    private final Duration rejectionMemory;
    private final int overSuggestedThreshold;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<HistoryRecord> records = new ArrayList<>();
    private final Map<ReviewKey, List<HistoryRecord>> byKey = new LinkedHashMap<>();

    public FileSuggestionHistory(JsonDocumentStore<List<HistoryRecord>> store,
                                 HistoryProperties properties,
                                 Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        Objects.requireNonNull(properties, "properties must not be null");
        this.rejectionGuard = properties.getRejectionGuard();
        this.rejectionMemory = properties.getRejectionMemory();
        this.overSuggestedThreshold = properties.getOverSuggestedThreshold();
        for (HistoryRecord loaded : store.load(List::of)) {
            if (loaded != null && loaded.event() != null && loaded.timestamp() != null
                && StringUtils.hasText(loaded.artist())) {
                indexLocked(loaded);
            }
        }
        log.info("Suggestion history loaded {} entries from {}", records.size(), store.path());
    }

    @Override
    public void recordSuggestions(Collection<Recommendation> items) {
        if (items == null || items.isEmpty()) {
            return;
        }
        Instant now = clock.instant();
        lock.writeLock().lock();
        try {
            int appended = 0;
            for (Recommendation item : items) {
                if (item == null || !StringUtils.hasText(item.artist())) {
                    continue;
                }
                indexLocked(new HistoryRecord(item.artist(), albumOrEmpty(item.album()), HistoryEvent.SUGGESTED, now, null, null));
                appended++;
            }
            if (appended > 0) {
                persistLocked();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean recordRejected(String artist, String album, String reason) {
        return appendGuarded(new HistoryRecord(artist, albumOrEmpty(album), HistoryEvent.REJECTED, clock.instant(), reason, null));
    }

    @Override
    public boolean recordDisliked(String artist, String album, DislikeLevel level) {
        DislikeLevel resolved = level == null ? DislikeLevel.NORMAL : level;
        return appendGuarded(new HistoryRecord(artist, albumOrEmpty(album), HistoryEvent.DISLIKED, clock.instant(), null, resolved));
    }

    @Override
    public void recordAccepted(String artist, String album) {
        if (!StringUtils.hasText(artist)) {
            return;
        }
        lock.writeLock().lock();
        try {
            indexLocked(new HistoryRecord(artist, albumOrEmpty(album), HistoryEvent.ACCEPTED, clock.instant(), null, null));
            persistLocked();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean wasRejectedOrDisliked(String artist, String album) {
        Instant now = clock.instant();
        lock.readLock().lock();
        try {
            return isExcludedLocked(byKey.getOrDefault(ReviewKey.of(artist, album), List.of()), now);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public String exclusionPrompt() {
        Instant now = clock.instant();
        Set<String> never = new LinkedHashSet<>();
        Set<String> avoid = new LinkedHashSet<>();
        lock.readLock().lock();
        try {
            for (List<HistoryRecord> entries : byKey.values()) {
                HistoryRecord first = entries.get(0);
                String label = label(first);
                if (isStronglyDisliked(entries)) {
                    never.add(label);
                } else if (isExcludedLocked(entries, now) || isOverSuggested(entries)) {
                    avoid.add(label);
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        StringBuilder prompt = new StringBuilder();
        appendLine(prompt, "NEVER_RECOMMEND", never);
        appendLine(prompt, "AVOID", avoid);
        return prompt.toString().trim();
    }

    @Override
    public HistorySummary summary() {
        int suggested = 0;
        int rejected = 0;
        int disliked = 0;
        int accepted = 0;
        int overSuggested = 0;
        lock.readLock().lock();
        try {
            for (HistoryRecord entry : records) {
                switch (entry.event()) {
                    case SUGGESTED -> suggested++;
                    case REJECTED -> rejected++;
                    case DISLIKED -> disliked++;
                    case ACCEPTED -> accepted++;
                }
            }
            for (List<HistoryRecord> entries : byKey.values()) {
                if (isOverSuggested(entries)) {
                    overSuggested++;
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        return new HistorySummary(suggested, rejected, disliked, accepted, overSuggested);
    }

    private boolean appendGuarded(HistoryRecord entry) {
        if (!StringUtils.hasText(entry.artist())) {
            return false;
        }
        lock.writeLock().lock();
        try {
            Instant lastSuggested = latest(byKey.getOrDefault(entry.key(), List.of()), HistoryEvent.SUGGESTED);
            if (lastSuggested != null && lastSuggested.plus(rejectionGuard).isAfter(entry.timestamp())) {
                log.debug("Ignoring {} for {}: suggested at {}, inside the {} guard window",
                    entry.event().wireName(), entry.key(), lastSuggested, rejectionGuard);
                return false;
            }
            indexLocked(entry);
            persistLocked();
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private boolean isExcludedLocked(List<HistoryRecord> entries, Instant now) {
        Instant accepted = latest(entries, HistoryEvent.ACCEPTED);
        Instant disliked = latest(entries, HistoryEvent.DISLIKED);
        if (disliked != null && (accepted == null || disliked.isAfter(accepted))) {
            return true;
        }
        Instant rejected = latest(entries, HistoryEvent.REJECTED);
        if (rejected == null || (accepted != null && !rejected.isAfter(accepted))) {
            return false;
        }
        return rejected.plus(rejectionMemory).isAfter(now);
    }

    private boolean isStronglyDisliked(List<HistoryRecord> entries) {
        Instant accepted = latest(entries, HistoryEvent.ACCEPTED);
        for (HistoryRecord entry : entries) {
            if (entry.event() == HistoryEvent.DISLIKED
                && entry.dislikeLevel() != DislikeLevel.NORMAL
                && (accepted == null || entry.timestamp().isAfter(accepted))) {
                return true;
            }
        }
        return false;
    }

    private boolean isOverSuggested(List<HistoryRecord> entries) {
        if (latest(entries, HistoryEvent.ACCEPTED) != null) {
            return false;
        }
        long count = entries.stream().filter(entry -> entry.event() == HistoryEvent.SUGGESTED).count();
        return count >= overSuggestedThreshold;
    }

    private static Instant latest(List<HistoryRecord> entries, HistoryEvent event) {
        Instant latest = null;
        for (HistoryRecord entry : entries) {
            if (entry.event() == event && entry.timestamp() != null
                && (latest == null || entry.timestamp().isAfter(latest))) {
                latest = entry.timestamp();
            }
        }
        return latest;
    }

    private void indexLocked(HistoryRecord entry) {
        records.add(entry);
        byKey.computeIfAbsent(entry.key(), ignored -> new ArrayList<>()).add(entry);
    }

    private void persistLocked() {
        if (!store.save(List.copyOf(records))) {
            log.warn("Suggestion history write failed; {} entries held in memory", records.size());
        }
    }

    private static void appendLine(StringBuilder prompt, String prefix, Set<String> labels) {
        if (labels.isEmpty()) {
            return;
        }
        List<String> limited = labels.stream().limit(MAX_PROMPT_ENTRIES).toList();
        prompt.append(prefix).append(": ").append(String.join("; ", limited)).append('\n');
    }

    private static String label(HistoryRecord entry) {
        return StringUtils.hasText(entry.album()) ? entry.artist() + " - " + entry.album() : entry.artist();
    }

    private static String albumOrEmpty(String album) {
        return album == null ? "" : album;
    }
}
