package net.cratedigger.service.pipeline;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import net.cratedigger.domain.recommendation.Recommendation;
import net.cratedigger.domain.recommendation.RecommendationMode;
import net.cratedigger.domain.recommendation.ValidationReport;
import net.cratedigger.domain.review.ReviewKey;
import net.cratedigger.service.history.SuggestionHistory;
import net.cratedigger.service.library.LibraryCatalog;
import net.cratedigger.service.pipeline.RecommendationFilterStages.BatchOutcome;
import net.cratedigger.service.provider.RecommendationProvider;
import net.cratedigger.service.review.PendingImportBuffer;
import net.cratedigger.service.review.ReviewQueue;
import net.cratedigger.support.cache.BoundedCache;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Produces a batch of recommendations for the configured library.
 *
 * <p>A run fetches candidates from the provider, passes them through the filtering
 * stages, tops the batch up when it is short and truncates it to the requested
 * size. The delivered list is cached per provider, request, library fingerprint and
 * configuration version; concurrent runs with the same key share one computation
 * and a cache hit touches neither the provider nor the review queue.</p>
 *
 * <p>Items removed by deduplication, the style guard or the safety gate are offered
 * to the review queue. Delivered items are recorded as suggested. Provider failures
 * propagate and are never cached. A cancelled run returns what had passed every
 * stage so far and is never cached either. Runs that were waiting on a computation
 * cancelled by the run that started it compute again under their own signal.</p>
 */
@Slf4j
@Service
public class RecommendationPipeline {

    private final RecommendationProvider provider;
    private final LibraryCatalog library;
    private final BoundedCache<String, List<Recommendation>> resultCache;
    private final RecommendationCacheKeyBuilder cacheKeyBuilder;
    private final RecommendationFilterStages stages;
    private final TopUpPlanner topUpPlanner;
    private final RecommendationPromptBuilder promptBuilder;
    private final RecommendationSanitizer sanitizer;
    private final ReviewQueue reviewQueue;
    private final SuggestionHistory history;
    private final PendingImportBuffer importBuffer;
    private final Executor providerExecutor;

    public RecommendationPipeline(RecommendationProvider provider,
                                  LibraryCatalog library,
                                  BoundedCache<String, List<Recommendation>> resultCache,
                                  RecommendationCacheKeyBuilder cacheKeyBuilder,
                                  RecommendationFilterStages stages,
                                  TopUpPlanner topUpPlanner,
                                  RecommendationPromptBuilder promptBuilder,
                                  RecommendationSanitizer sanitizer,
                                  ReviewQueue reviewQueue,
                                  SuggestionHistory history,
                                  PendingImportBuffer importBuffer,
                                  @Qualifier("providerExecutor") Executor providerExecutor) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.library = Objects.requireNonNull(library, "library must not be null");
        this.resultCache = Objects.requireNonNull(resultCache, "resultCache must not be null");
        this.cacheKeyBuilder = Objects.requireNonNull(cacheKeyBuilder, "cacheKeyBuilder must not be null");
        this.stages = Objects.requireNonNull(stages, "stages must not be null");
        this.topUpPlanner = Objects.requireNonNull(topUpPlanner, "topUpPlanner must not be null");
        this.promptBuilder = Objects.requireNonNull(promptBuilder, "promptBuilder must not be null");
        this.sanitizer = Objects.requireNonNull(sanitizer, "sanitizer must not be null");
        this.reviewQueue = Objects.requireNonNull(reviewQueue, "reviewQueue must not be null");
        this.history = Objects.requireNonNull(history, "history must not be null");
        this.importBuffer = Objects.requireNonNull(importBuffer, "importBuffer must not be null");
        this.providerExecutor = Objects.requireNonNull(providerExecutor, "providerExecutor must not be null");
    }

    public PipelineResult run(PipelineRequest request) {
        return run(request, CancellationSignal.create());
    }

    /**
     * Runs the pipeline.
     *
     * @param request run settings
     * @param signal cancellation signal; once fired the run stops waiting on the provider
     * @return delivered items with diagnostics
     * @throws net.cratedigger.service.provider.RecommendationProviderException when the provider fails
     */
    public PipelineResult run(PipelineRequest request, CancellationSignal signal) {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(signal, "signal must not be null");

        List<Recommendation> released = drainReleased();
        String cacheKey = cacheKeyBuilder.build(provider.providerName(), request, library.fingerprint());
        PipelineResult result = null;
        while (result == null) {
            result = awaitBatch(request, signal, cacheKey);
        }
        return result.withReleased(released);
    }

    /**
     * Waits on the cached or shared computation for the key.
     *
     * @return the run's result, or {@code null} when a computation started by another
     *     run was cancelled by that run and this run has to compute for itself
     */
    private PipelineResult awaitBatch(PipelineRequest request, CancellationSignal signal, String cacheKey) {
        AtomicReference<PipelineResult> computed = new AtomicReference<>();
        CompletableFuture<List<Recommendation>> batch = resultCache.getOrCompute(cacheKey, null,
            key -> computeBatch(request, signal, computed));
        try {
            Optional<List<Recommendation>> items = signal.await(batch);
            if (items.isEmpty()) {
                log.info("Recommendation run cancelled while waiting for a shared computation");
                return new PipelineResult(List.of(), List.of(), ValidationReport.empty(), false, true, List.of());
            }
            if (computed.get() != null) {
                return computed.get();
            }
            log.debug("Recommendation for key {} served by the cache or a concurrent run", cacheKey);
            return PipelineResult.fromCache(items.get());
        } catch (PipelineCancelledException cancelled) {
            if (computed.get() != null) {
                return cancelled.partialResult();
            }
            log.info("Shared computation for key {} was cancelled by the run that started it; retrying", cacheKey);
            return null;
        }
    }

    private CompletableFuture<List<Recommendation>> computeBatch(PipelineRequest request,
                                                                 CancellationSignal signal,
                                                                 AtomicReference<PipelineResult> computed) {
        try {
            PipelineResult result = compute(request, signal);
            computed.set(result);
            return CompletableFuture.completedFuture(result.recommendations());
        } catch (PipelineCancelledException cancelled) {
            computed.set(cancelled.partialResult());
            return CompletableFuture.failedFuture(cancelled);
        } catch (RuntimeException failure) {
            return CompletableFuture.failedFuture(failure);
        }
    }

    private PipelineResult compute(PipelineRequest request, CancellationSignal signal) {
        int max = request.maxRecommendations();
        List<FilteredRecommendation> filtered = new ArrayList<>();

        Optional<List<Recommendation>> initial = callProvider(promptBuilder.build(request, max, List.of()), signal);
        if (initial.isEmpty()) {
            throw new PipelineCancelledException(finish(List.of(), filtered, ValidationReport.empty(), true));
        }

        BatchOutcome first = stages.run(initial.get(), request, Set.of());
        filtered.addAll(first.filtered());
        ValidationReport report = first.report();
        List<Recommendation> accepted = new ArrayList<>(first.kept());
        boolean cancelled = false;

        if (topUpPlanner.shouldTopUp(accepted.size(), request)) {
            int rounds = topUpPlanner.maxRounds(request);
            for (int round = 1; round <= rounds && accepted.size() < max; round++) {
                if (signal.isCancelled()) {
                    cancelled = true;
                    break;
                }
                int ask = topUpPlanner.requestSize(max - accepted.size(), request.backfillStrategy());
                Optional<List<Recommendation>> candidates =
                    callProvider(promptBuilder.build(request, ask, accepted), signal);
                if (candidates.isEmpty()) {
                    cancelled = true;
                    break;
                }
                BatchOutcome topUp = stages.run(candidates.get(), request, keysOf(accepted, request.mode()));
                filtered.addAll(topUp.filtered());
                report = report.merge(topUp.report());
                if (topUp.kept().isEmpty()) {
                    log.info("Top-up round {}/{} yielded no new items; stopping", round, rounds);
                    break;
                }
                accepted.addAll(topUp.kept());
                log.debug("Top-up round {}/{} added {} items ({} of {})",
                    round, rounds, topUp.kept().size(), accepted.size(), max);
            }
        } else if (accepted.isEmpty()) {
            log.info("No candidates survived filtering; skipping top-up");
        }

        List<Recommendation> delivered = accepted.size() > max ? accepted.subList(0, max) : accepted;
        PipelineResult result = finish(delivered, filtered, report, cancelled);
        if (cancelled) {
            throw new PipelineCancelledException(result);
        }
        log.info("Recommendation run delivered {} of {} requested ({} filtered, {} dropped as malformed)",
            result.recommendations().size(), max, filtered.size(), report.droppedItems());
        return result;
    }

    private PipelineResult finish(List<Recommendation> delivered,
                                  List<FilteredRecommendation> filtered,
                                  ValidationReport report,
                                  boolean cancelled) {
        offerForReview(filtered);
        history.recordSuggestions(delivered);
        return new PipelineResult(delivered, filtered, report, false, cancelled, List.of());
    }

    private Optional<List<Recommendation>> callProvider(String prompt, CancellationSignal signal) {
        if (signal.isCancelled()) {
            return Optional.empty();
        }
        CompletableFuture<List<Recommendation>> call = CompletableFuture.supplyAsync(() -> {
            List<Recommendation> response = provider.getRecommendations(prompt);
            return response == null ? List.<Recommendation>of() : response;
        }, providerExecutor);
        return signal.await(call);
    }

    private void offerForReview(List<FilteredRecommendation> filtered) {
        Map<String, List<Recommendation>> byReason = new LinkedHashMap<>();
        for (FilteredRecommendation removal : filtered) {
            if (removal.reviewable()) {
                String reason = removal.stage().name().toLowerCase(Locale.ROOT) + ": " + removal.reason();
                byReason.computeIfAbsent(reason, ignored -> new ArrayList<>()).add(removal.item());
            }
        }
        byReason.forEach((reason, items) -> reviewQueue.enqueue(items, reason));
    }

    private List<Recommendation> drainReleased() {
        List<Recommendation> released = new ArrayList<>();
        for (Recommendation item : importBuffer.drain()) {
            if (sanitizer.isValid(item)) {
                released.add(item);
            } else {
                log.warn("Discarding released item '{}' that failed import validation", item.displayName());
            }
        }
        return released;
    }

    private static Set<ReviewKey> keysOf(List<Recommendation> items, RecommendationMode mode) {
        Set<ReviewKey> keys = new LinkedHashSet<>();
        for (Recommendation item : items) {
            keys.add(DuplicateFilter.keyFor(item, mode));
        }
        return keys;
    }
}
