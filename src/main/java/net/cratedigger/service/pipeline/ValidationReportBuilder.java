package net.cratedigger.service.pipeline;

import java.util.ArrayList;
import java.util.List;
import net.cratedigger.domain.recommendation.ValidationReport;

/**
 * Mutable accumulator shared by the sanitize and schema-validate stages of one batch.
 * Not thread-safe; a batch is validated on one thread.
 */
final class ValidationReportBuilder {

    private final int totalItems;
    private int droppedItems;
    private int clampedConfidences;
    private int trimmedFields;
    private final List<String> warnings = new ArrayList<>();

    ValidationReportBuilder(int totalItems) {
        this.totalItems = totalItems;
    }

    void dropped(String warning) {
        droppedItems++;
        warnings.add(warning);
    }

    void clamped() {
        clampedConfidences++;
    }

    void trimmed() {
        trimmedFields++;
    }

    void warn(String warning) {
        warnings.add(warning);
    }

    ValidationReport build() {
        return new ValidationReport(totalItems, droppedItems, clampedConfidences, trimmedFields, warnings);
    }
}
