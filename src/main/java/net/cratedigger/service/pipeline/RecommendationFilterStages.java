package net.cratedigger.service.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import net.cratedigger.domain.recommendation.Recommendation;
import net.cratedigger.domain.recommendation.ValidationReport;
import net.cratedigger.domain.review.ReviewKey;
import org.springframework.stereotype.Component;

/**
 * Runs the five filtering stages over one provider batch, in fixed order:
 * sanitize, schema-validate, deduplicate, style guard, safety gate. An item removed
 * by a stage never reaches a later one.
 */
@Component
public class RecommendationFilterStages {

    private final RecommendationSanitizer sanitizer;
    private final RecommendationSchemaValidator validator;
    private final DuplicateFilter duplicateFilter;
    private final StyleGuard styleGuard;
    private final SafetyGate safetyGate;

    public RecommendationFilterStages(RecommendationSanitizer sanitizer,
                                      RecommendationSchemaValidator validator,
                                      DuplicateFilter duplicateFilter,
                                      StyleGuard styleGuard,
                                      SafetyGate safetyGate) {
        this.sanitizer = Objects.requireNonNull(sanitizer, "sanitizer must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.duplicateFilter = Objects.requireNonNull(duplicateFilter, "duplicateFilter must not be null");
        this.styleGuard = Objects.requireNonNull(styleGuard, "styleGuard must not be null");
        this.safetyGate = Objects.requireNonNull(safetyGate, "safetyGate must not be null");
    }

    /**
     * @param raw provider output, possibly containing {@code null} entries
     * @param request run settings
     * @param alreadyAccepted keys delivered earlier in the same run
     */
    public BatchOutcome run(List<Recommendation> raw, PipelineRequest request, Set<ReviewKey> alreadyAccepted) {
        List<Recommendation> input = raw == null ? List.of() : raw;
        ValidationReportBuilder report = new ValidationReportBuilder(input.size());
        List<FilteredRecommendation> filtered = new ArrayList<>();

        StageOutcome sanitized = sanitizer.sanitize(input, request.mode(), report);
        filtered.addAll(sanitized.filtered());

        StageOutcome validated = validator.validate(sanitized.kept(), request.mode(), report);
        filtered.addAll(validated.filtered());

        StageOutcome unique = duplicateFilter.filter(validated.kept(), request.mode(), alreadyAccepted);
        filtered.addAll(unique.filtered());

        StageOutcome styled = styleGuard.apply(unique.kept(), request.styleFilters(), request.relaxStyleMatching());
        filtered.addAll(styled.filtered());

        List<Recommendation> safe = new ArrayList<>(styled.kept().size());
        for (Recommendation item : styled.kept()) {
            Optional<String> veto = safetyGate.veto(item);
            if (veto.isPresent()) {
                filtered.add(FilteredRecommendation.of(item, PipelineStage.SAFETY_GATE, veto.get()));
            } else {
                safe.add(item);
            }
        }
        return new BatchOutcome(safe, filtered, report.build());
    }

    /**
     * Survivors of all five stages, the removed items, and the validation counters.
     */
    public record BatchOutcome(List<Recommendation> kept,
                               List<FilteredRecommendation> filtered,
                               ValidationReport report) {

        public BatchOutcome {
            kept = List.copyOf(kept);
            filtered = List.copyOf(filtered);
        }
    }
}
