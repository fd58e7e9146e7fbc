package net.cratedigger.application.review;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import net.cratedigger.application.review.ActionResult.Applied;
import net.cratedigger.application.review.ActionResult.Cleared;
import net.cratedigger.application.review.ActionResult.Connection;
import net.cratedigger.application.review.ActionResult.Failure;
import net.cratedigger.application.review.ActionResult.Option;
import net.cratedigger.application.review.ActionResult.Options;
import net.cratedigger.application.review.ActionResult.QueueItems;
import net.cratedigger.application.review.ActionResult.SelectionUpdate;
import net.cratedigger.application.review.ActionResult.StatusUpdate;
import net.cratedigger.domain.history.DislikeLevel;
import net.cratedigger.domain.recommendation.Recommendation;
import net.cratedigger.domain.review.ReviewCounts;
import net.cratedigger.domain.review.ReviewItem;
import net.cratedigger.domain.review.ReviewKey;
import net.cratedigger.domain.review.ReviewStatus;
import net.cratedigger.service.history.SuggestionHistory;
import net.cratedigger.service.provider.RecommendationProvider;
import net.cratedigger.service.review.PendingImportBuffer;
import net.cratedigger.service.review.ReviewQueue;
import net.cratedigger.service.style.StyleCatalogService;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Dispatches named review actions against the queue, history and approval selection.
 *
 * <p>Parameters arrive as a flat string map ({@code artist}, {@code album},
 * {@code notes}, {@code keys}, {@code status}, {@code query}). Every action returns
 * a typed {@link ActionResult}; unknown actions and bad parameters yield
 * {@link Failure} instead of an exception.</p>
 */
@Slf4j
@Service
public class ReviewActionHandler {

    private static final int STYLE_OPTION_LIMIT = 50;

    private final ReviewQueue reviewQueue;
    private final SuggestionHistory history;
    private final ApprovalSelection selection;
    private final PendingImportBuffer importBuffer;
    private final StyleCatalogService styleCatalog;
    private final RecommendationProvider provider;

    public ReviewActionHandler(ReviewQueue reviewQueue,
                               SuggestionHistory history,
                               ApprovalSelection selection,
                               PendingImportBuffer importBuffer,
                               StyleCatalogService styleCatalog,
                               RecommendationProvider provider) {
        this.reviewQueue = Objects.requireNonNull(reviewQueue, "reviewQueue must not be null");
        this.history = Objects.requireNonNull(history, "history must not be null");
        this.selection = Objects.requireNonNull(selection, "selection must not be null");
        this.importBuffer = Objects.requireNonNull(importBuffer, "importBuffer must not be null");
        this.styleCatalog = Objects.requireNonNull(styleCatalog, "styleCatalog must not be null");
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
    }

    public ActionResult handle(String action, Map<String, String> parameters) {
        Map<String, String> params = parameters == null ? Map.of() : parameters;
        Optional<ActionKind> kind = ActionKind.fromWire(action);
        if (kind.isEmpty()) {
            log.warn("Rejected unknown action '{}'", action);
            return new Failure("Unknown action: " + action);
        }
        log.debug("Handling action {}", kind.get().wireName());
        try {
            return switch (kind.get()) {
                case GET_QUEUE -> new QueueItems(reviewQueue.getPending());
                case ACCEPT -> accept(params);
                case REJECT -> reject(params);
                case NEVER -> never(params);
                case APPLY -> apply(params);
                case CLEAR -> clear(params);
                case SELECT -> select(params);
                case REJECT_SELECTED -> markSelected(params, ReviewStatus.REJECTED);
                case NEVER_SELECTED -> markSelected(params, ReviewStatus.NEVER_AGAIN);
                case GET_OPTIONS -> pendingOptions();
                case GET_SUMMARY_OPTIONS -> summaryOptions();
                case STYLE_OPTIONS -> styleOptions(params);
                case TEST_CONNECTION -> new Connection(provider.testConnection(), provider.providerName());
            };
        } catch (IllegalArgumentException badParameter) {
            log.warn("Action {} rejected: {}", kind.get().wireName(), badParameter.getMessage());
            return new Failure(badParameter.getMessage());
        }
    }

    private ActionResult accept(Map<String, String> params) {
        String artist = params.get("artist");
        String album = params.get("album");
        if (!StringUtils.hasText(artist) || !StringUtils.hasText(album)) {
            return StatusUpdate.failure("artist and album are required");
        }
        if (!reviewQueue.setStatus(artist, album, ReviewStatus.ACCEPTED, params.get("notes"))) {
            return StatusUpdate.failure("not in review queue: " + ReviewKey.of(artist, album));
        }
        return StatusUpdate.success();
    }

    private ActionResult reject(Map<String, String> params) {
        String artist = params.get("artist");
        String album = params.get("album");
        if (!StringUtils.hasText(artist) || !StringUtils.hasText(album)) {
            return StatusUpdate.failure("artist and album are required");
        }
        standingDecision(artist, album, ReviewStatus.REJECTED, params.get("notes"));
        return StatusUpdate.success();
    }

    private ActionResult never(Map<String, String> params) {
        String artist = params.get("artist");
        if (!StringUtils.hasText(artist)) {
            return StatusUpdate.failure("artist is required");
        }
        standingDecision(artist, params.getOrDefault("album", ""), ReviewStatus.NEVER_AGAIN, params.get("notes"));
        return StatusUpdate.success();
    }

    private ActionResult apply(Map<String, String> params) {
        KeyRequest request = requestedKeys(params);
        int approved = 0;
        for (ReviewKey key : request.keys()) {
            if (reviewQueue.setStatus(key.artist(), key.album(), ReviewStatus.ACCEPTED, "approved in bulk")) {
                approved++;
            }
        }
        List<Recommendation> released = reviewQueue.dequeueAccepted();
        for (Recommendation item : released) {
            history.recordAccepted(item.artist(), item.album());
        }
        importBuffer.addAll(released);
        int cleared = clearProcessed(request);
        log.info("Applied review selection: {} approved, {} released for import, {} selection keys cleared",
            approved, released.size(), cleared);
        String note = released.isEmpty() ? "Nothing to release" : "Released " + released.size() + " items for import";
        return new Applied(true, approved, released.size(), cleared, note);
    }

    private ActionResult clear(Map<String, String> params) {
        String status = params.get("status");
        int cleared = StringUtils.hasText(status)
            ? reviewQueue.clear(ReviewStatus.fromWire(status))
            : reviewQueue.clearAll();
        return new Cleared(true, cleared);
    }

    private ActionResult select(Map<String, String> params) {
        List<ReviewKey> keys = parseKeys(params.get("keys"));
        selection.replace(keys);
        return new SelectionUpdate(true, keys.size(), 0);
    }

    private ActionResult markSelected(Map<String, String> params, ReviewStatus status) {
        KeyRequest request = requestedKeys(params);
        int updated = 0;
        for (ReviewKey key : request.keys()) {
            if (reviewQueue.setStatus(key.artist(), key.album(), status, "bulk " + status.wireName().toLowerCase(Locale.ROOT))) {
                recordOutcome(key.artist(), key.album(), status, null);
                updated++;
            }
        }
        int cleared = clearProcessed(request);
        return new SelectionUpdate(true, updated, cleared);
    }

    private Options pendingOptions() {
        List<Option> options = new ArrayList<>();
        for (ReviewItem item : reviewQueue.getPending()) {
            String name = String.format(Locale.ROOT, "%s (%.0f%%)",
                item.toRecommendation().displayName(), item.confidence() * 100);
            options.add(new Option(item.key().asString(), name));
        }
        return new Options(options);
    }

    private Options summaryOptions() {
        ReviewCounts counts = reviewQueue.getCounts();
        return new Options(List.of(
            new Option("pending", "Pending: " + counts.pending()),
            new Option("accepted", "Accepted: " + counts.accepted()),
            new Option("rejected", "Rejected: " + counts.rejected()),
            new Option("never", "Never: " + counts.neverAgain())
        ));
    }

    private Options styleOptions(Map<String, String> params) {
        List<Option> options = styleCatalog.search(params.get("query"), STYLE_OPTION_LIMIT).stream()
            .map(style -> new Option(style.slug(), style.name()))
            .toList();
        return new Options(options);
    }

    /**
     * Records a rejection or never-again decision so it stands against later batches,
     * queueing the item first when the user rejects something that was delivered directly.
     */
    private void standingDecision(String artist, String album, ReviewStatus status, String notes) {
        if (!reviewQueue.setStatus(artist, album, status, notes)) {
            reviewQueue.enqueue(List.of(new Recommendation(artist, album, null, null, 0.0, null, "manual")),
                "manual " + status.wireName().toLowerCase(Locale.ROOT));
            reviewQueue.setStatus(artist, album, status, notes);
        }
        recordOutcome(artist, album, status, notes);
    }

    private void recordOutcome(String artist, String album, ReviewStatus status, String notes) {
        boolean recorded = status == ReviewStatus.NEVER_AGAIN
            ? history.recordDisliked(artist, album, DislikeLevel.NEVER_AGAIN)
            : history.recordRejected(artist, album, notes);
        if (!recorded) {
            log.debug("History ignored {} for {} inside the guard window; review status still stands",
                status.wireName(), ReviewKey.of(artist, album));
        }
    }

    private KeyRequest requestedKeys(Map<String, String> params) {
        List<ReviewKey> explicit = parseKeys(params.get("keys"));
        return explicit.isEmpty()
            ? new KeyRequest(selection.keys(), true)
            : new KeyRequest(explicit, false);
    }

    /**
     * Explicit keys leave the rest of the selection in place.
     */
    private int clearProcessed(KeyRequest request) {
        return request.fromSelection()
            ? selection.clearSelection()
            : selection.clearSelection(request.keys());
    }

    private record KeyRequest(List<ReviewKey> keys, boolean fromSelection) {
    }

    private static List<ReviewKey> parseKeys(String csv) {
        List<ReviewKey> keys = new ArrayList<>();
        if (!StringUtils.hasText(csv)) {
            return keys;
        }
        for (String raw : csv.split(",")) {
            ReviewKey.parse(raw).ifPresent(keys::add);
        }
        return keys;
    }
}
