package net.cratedigger.domain.recommendation;

/**
 * A single candidate item produced by a provider and carried through the pipeline.
 *
 * <p>{@code album} is {@code null} or blank in artist mode. {@code confidence} is
 * whatever the provider claimed until validation clamps it into {@code [0, 1]}.</p>
 *
 * @param artist artist name, required
 * @param album album title, required in album mode
 * @param genre free-form genre field, possibly compound ("Rock / Jazz")
 * @param reason provider's justification
 * @param confidence provider confidence
 * @param year release year when known
 * @param source provider name that produced the item
 */
public record Recommendation(
    String artist,
    String album,
    String genre,
    String reason,
    double confidence,
    Integer year,
    String source
) {

    public static Recommendation of(String artist, String album, String genre, double confidence) {
        return new Recommendation(artist, album, genre, null, confidence, null, null);
    }

    /**
     * Label used in logs and option lists.
     */
    public String displayName() {
        if (album == null || album.isBlank()) {
            return artist;
        }
        return artist + " - " + album;
    }
}
