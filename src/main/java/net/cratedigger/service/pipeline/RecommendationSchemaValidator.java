package net.cratedigger.service.pipeline;

import java.util.ArrayList;
import java.util.List;
import net.cratedigger.domain.recommendation.Recommendation;
import net.cratedigger.domain.recommendation.RecommendationMode;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Second pipeline stage: enforces the record shape.
 *
 * <p>Drops null items, items without an artist and, in album mode, items without
 * an album. Trims text fields and clamps confidence into {@code [0, 1]}. Never
 * throws for malformed input.</p>
 */
@Component
public class RecommendationSchemaValidator {

    StageOutcome validate(List<Recommendation> items, RecommendationMode mode, ValidationReportBuilder report) {
        List<Recommendation> kept = new ArrayList<>(items.size());
        List<FilteredRecommendation> filtered = new ArrayList<>();
        for (Recommendation item : items) {
            if (item == null) {
                report.dropped("Dropped null recommendation");
                filtered.add(FilteredRecommendation.of(null, PipelineStage.SCHEMA_VALIDATE, "null item"));
                continue;
            }
            if (!StringUtils.hasText(item.artist())) {
                report.dropped("Dropped recommendation without artist");
                filtered.add(FilteredRecommendation.of(item, PipelineStage.SCHEMA_VALIDATE, "missing artist"));
                continue;
            }
            if (mode.requiresAlbum() && !StringUtils.hasText(item.album())) {
                report.dropped("Dropped '%s': album required in album mode".formatted(item.artist().trim()));
                filtered.add(FilteredRecommendation.of(item, PipelineStage.SCHEMA_VALIDATE, "missing album"));
                continue;
            }
            kept.add(normalize(item, report));
        }
        return new StageOutcome(kept, filtered);
    }

    private Recommendation normalize(Recommendation item, ValidationReportBuilder report) {
        double confidence = item.confidence();
        if (confidence < 0.0 || confidence > 1.0) {
            confidence = Math.max(0.0, Math.min(1.0, confidence));
            report.clamped();
        }
        return new Recommendation(
            trim(item.artist(), report),
            trim(item.album(), report),
            trim(item.genre(), report),
            trim(item.reason(), report),
            confidence,
            item.year(),
            item.source()
        );
    }

    private static String trim(String value, ValidationReportBuilder report) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.length() != value.length()) {
            report.trimmed();
        }
        return trimmed;
    }
}
