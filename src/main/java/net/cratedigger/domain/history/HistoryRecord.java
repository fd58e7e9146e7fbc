package net.cratedigger.domain.history;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import net.cratedigger.domain.review.ReviewKey;

/**
 * One immutable history entry.
 *
 * @param artist artist as suggested
 * @param album album as suggested, empty for artist-mode items
 * @param event what happened, serialized as {@code status}
 * @param timestamp when it happened
 * @param reason optional free text, used by rejections
 * @param dislikeLevel set only for {@link HistoryEvent#DISLIKED}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HistoryRecord(
    String artist,
    String album,
    @JsonProperty("status") HistoryEvent event,
    Instant timestamp,
    String reason,
    DislikeLevel dislikeLevel
) {

    @JsonIgnore
    public ReviewKey key() {
        return ReviewKey.of(artist, album);
    }
}
