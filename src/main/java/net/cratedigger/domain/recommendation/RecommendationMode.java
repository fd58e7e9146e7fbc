package net.cratedigger.domain.recommendation;

/**
 * Whether a batch recommends specific albums or whole artists.
 */
public enum RecommendationMode {
    ALBUMS,
    ARTISTS;

    public boolean requiresAlbum() {
        return this == ALBUMS;
    }
}
