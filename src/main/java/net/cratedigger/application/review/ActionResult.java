package net.cratedigger.application.review;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import net.cratedigger.domain.review.ReviewItem;

/**
 * Typed payloads returned by review actions. Each variant serializes to a small JSON object.
 */
public sealed interface ActionResult {

    record QueueItems(List<ReviewItem> items) implements ActionResult {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record StatusUpdate(boolean ok, String error) implements ActionResult {

        static StatusUpdate success() {
            return new StatusUpdate(true, null);
        }

        static StatusUpdate failure(String error) {
            return new StatusUpdate(false, error);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Applied(boolean ok, int approved, int released, int cleared, String note) implements ActionResult {
    }

    record SelectionUpdate(boolean ok, int updated, int cleared) implements ActionResult {
    }

    record Cleared(boolean ok, int cleared) implements ActionResult {
    }

    record Options(List<Option> options) implements ActionResult {
    }

    record Option(String value, String name) {
    }

    record Connection(boolean ok, String provider) implements ActionResult {
    }

    record Failure(String error) implements ActionResult {
    }
}
