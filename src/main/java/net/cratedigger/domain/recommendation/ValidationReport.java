package net.cratedigger.domain.recommendation;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-batch counters collected while sanitizing and validating provider output.
 *
 * @param totalItems items received from the provider
 * @param droppedItems items removed by sanitizing or schema checks
 * @param clampedConfidences confidences forced into {@code [0, 1]}
 * @param trimmedFields text fields that carried surrounding whitespace
 * @param warnings human-readable notes in the order they were raised
 */
public record ValidationReport(
    int totalItems,
    int droppedItems,
    int clampedConfidences,
    int trimmedFields,
    List<String> warnings
) {

    public ValidationReport {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static ValidationReport empty() {
        return new ValidationReport(0, 0, 0, 0, List.of());
    }

    /**
     * Combines two reports, keeping warning order.
     */
    public ValidationReport merge(ValidationReport other) {
        if (other == null) {
            return this;
        }
        List<String> combined = new ArrayList<>(warnings);
        combined.addAll(other.warnings());
        return new ValidationReport(
            totalItems + other.totalItems(),
            droppedItems + other.droppedItems(),
            clampedConfidences + other.clampedConfidences(),
            trimmedFields + other.trimmedFields(),
            combined
        );
    }
}
