package net.cratedigger.domain.review;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Lifecycle of an item held for manual review.
 *
 * <p>{@code PENDING} is the entry state. {@code ACCEPTED} items wait for
 * {@code dequeueAccepted}. {@code REJECTED} and {@code NEVER_AGAIN} keep the key
 * out of later batches.</p>
 */
public enum ReviewStatus {
    PENDING("Pending"),
    ACCEPTED("Accepted"),
    REJECTED("Rejected"),
    NEVER_AGAIN("Never");

    private final String wireName;

    ReviewStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean blocksResuggestion() {
        return this == REJECTED || this == NEVER_AGAIN;
    }

    /**
     * Parses a wire or enum name, ignoring case.
     *
     * @throws IllegalArgumentException for unknown names
     */
    @JsonCreator
    public static ReviewStatus fromWire(String value) {
        if (value != null) {
            String normalized = value.trim();
            for (ReviewStatus status : values()) {
                if (status.wireName.equalsIgnoreCase(normalized) || status.name().equalsIgnoreCase(normalized)) {
                    return status;
                }
            }
            if ("neveragain".equals(normalized.toLowerCase(Locale.ROOT).replace("_", ""))) {
                return NEVER_AGAIN;
            }
        }
        throw new IllegalArgumentException("Unknown review status: " + value);
    }
}
