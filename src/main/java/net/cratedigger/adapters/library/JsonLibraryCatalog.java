package net.cratedigger.adapters.library;

import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import lombok.extern.slf4j.Slf4j;
import net.cratedigger.domain.review.ReviewKey;
import net.cratedigger.service.library.LibraryCatalog;
import net.cratedigger.support.persistence.JsonDocumentStore;
import net.cratedigger.util.HashUtils;
import net.cratedigger.util.StyleSlugs;
import org.springframework.util.StringUtils;

/**
 * {@link LibraryCatalog} read from a JSON array of {@link LibraryEntry} values.
 *
 * <p>The document is loaded at construction and again on {@link #reload()}.
 * Lookups are case-insensitive.</p>
 */
@Slf4j
public class JsonLibraryCatalog implements LibraryCatalog {

    private final JsonDocumentStore<List<LibraryEntry>> store;
    private volatile Snapshot snapshot = Snapshot.EMPTY;

    public JsonLibraryCatalog(JsonDocumentStore<List<LibraryEntry>> store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        reload();
    }

    /**
     * Re-reads the library document and replaces the in-memory view.
     *
     * @return number of entries loaded
     */
    public int reload() {
        List<LibraryEntry> entries = store.load(List::of);
        Snapshot loaded = Snapshot.of(entries);
        this.snapshot = loaded;
        log.info("Library loaded: {} albums by {} artists (fingerprint {})",
            loaded.albums().size(), loaded.artists().size(), loaded.fingerprint().substring(0, 12));
        return entries.size();
    }

    @Override
    public boolean containsArtist(String artist) {
        return StringUtils.hasText(artist) && snapshot.artists().contains(ReviewKey.of(artist, "").artist());
    }

    @Override
    public boolean containsAlbum(String artist, String album) {
        return StringUtils.hasText(artist) && snapshot.albums().contains(ReviewKey.of(artist, album));
    }

    @Override
    public String fingerprint() {
        return snapshot.fingerprint();
    }

    @Override
    public List<String> topGenres(int limit) {
        return snapshot.genreCounts().entrySet().stream()
            .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()))
            .limit(Math.max(0, limit))
            .map(Map.Entry::getKey)
            .toList();
    }

    private record Snapshot(Set<String> artists, Set<ReviewKey> albums, Map<String, Integer> genreCounts,
                            String fingerprint) {

        static final Snapshot EMPTY = new Snapshot(Set.of(), Set.of(), Map.of(), HashUtils.sha256Hex(""));

        static Snapshot of(List<LibraryEntry> entries) {
            Set<String> artists = new HashSet<>();
            Set<ReviewKey> albums = new HashSet<>();
            Map<String, Integer> genres = new HashMap<>();
            TreeSet<String> sortedKeys = new TreeSet<>();
            for (LibraryEntry entry : entries) {
                if (entry == null || !StringUtils.hasText(entry.artist())) {
                    continue;
                }
                ReviewKey key = ReviewKey.of(entry.artist(), entry.album());
                artists.add(key.artist());
                if (!key.album().isEmpty()) {
                    albums.add(key);
                }
                sortedKeys.add(key.asString());
                for (String tag : StyleSlugs.splitTags(entry.genre())) {
                    genres.merge(tag, 1, Integer::sum);
                }
            }
            return new Snapshot(Set.copyOf(artists), Set.copyOf(albums), Map.copyOf(genres),
                HashUtils.sha256Hex(String.join("\n", sortedKeys)));
        }
    }
}
