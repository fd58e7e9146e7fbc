package net.cratedigger.service.library;

import java.util.List;

/**
 * Read-only view of the user's existing collection.
 */
public interface LibraryCatalog {

    boolean containsArtist(String artist);

    boolean containsAlbum(String artist, String album);

    /**
     * Stable digest of the library contents. Changes whenever membership changes.
     */
    String fingerprint();

    /**
     * Most common genres in the library, most frequent first.
     */
    List<String> topGenres(int limit);
}
