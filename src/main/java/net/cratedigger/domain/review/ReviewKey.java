package net.cratedigger.domain.review;

import java.util.Locale;
import java.util.Optional;
import org.springframework.util.StringUtils;

/**
 * Case-insensitive identity of a recommended item, written as {@code artist|album}.
 *
 * <p>Artist-mode items have an empty album component.</p>
 */
public record ReviewKey(String artist, String album) {

    private static final char SEPARATOR = '|';

    public ReviewKey {
        artist = normalize(artist);
        album = normalize(album);
    }

    public static ReviewKey of(String artist, String album) {
        return new ReviewKey(artist, album);
    }

    /**
     * Parses the {@code artist|album} wire form. A value without a separator is an artist key.
     */
    public static Optional<ReviewKey> parse(String value) {
        if (!StringUtils.hasText(value)) {
            return Optional.empty();
        }
        int separator = value.indexOf(SEPARATOR);
        ReviewKey key = separator < 0
            ? new ReviewKey(value, "")
            : new ReviewKey(value.substring(0, separator), value.substring(separator + 1));
        return key.artist().isEmpty() ? Optional.empty() : Optional.of(key);
    }

    public String asString() {
        return artist + SEPARATOR + album;
    }

    @Override
    public String toString() {
        return asString();
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
