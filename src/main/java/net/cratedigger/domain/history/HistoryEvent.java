package net.cratedigger.domain.history;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of entry appended to the suggestion history.
 */
public enum HistoryEvent {
    SUGGESTED("Suggested"),
    REJECTED("Rejected"),
    DISLIKED("Disliked"),
    ACCEPTED("Accepted");

    private final String wireName;

    HistoryEvent(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static HistoryEvent fromWire(String value) {
        for (HistoryEvent event : values()) {
            if (event.wireName.equalsIgnoreCase(value) || event.name().equalsIgnoreCase(value)) {
                return event;
            }
        }
        throw new IllegalArgumentException("Unknown history event: " + value);
    }
}
