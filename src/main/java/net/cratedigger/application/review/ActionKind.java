package net.cratedigger.application.review;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of actions accepted by {@link ReviewActionHandler}, keyed by wire name.
 */
public enum ActionKind {
    GET_QUEUE("review/getqueue"),
    ACCEPT("review/accept"),
    REJECT("review/reject"),
    NEVER("review/never"),
    APPLY("review/apply"),
    CLEAR("review/clear"),
    SELECT("review/select"),
    REJECT_SELECTED("review/rejectselected"),
    NEVER_SELECTED("review/neverselected"),
    GET_OPTIONS("review/getoptions"),
    GET_SUMMARY_OPTIONS("review/getsummaryoptions"),
    STYLE_OPTIONS("styles/getoptions"),
    TEST_CONNECTION("testconnection");

    private final String wireName;

    ActionKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<ActionKind> fromWire(String action) {
        if (action == null) {
            return Optional.empty();
        }
        String normalized = action.trim().toLowerCase(Locale.ROOT);
        for (ActionKind kind : values()) {
            if (kind.wireName.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
