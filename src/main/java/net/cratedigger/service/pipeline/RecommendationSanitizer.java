package net.cratedigger.service.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import net.cratedigger.domain.recommendation.Recommendation;
import net.cratedigger.domain.recommendation.RecommendationMode;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * First pipeline stage: removes injection payloads from provider text.
 *
 * <p>Null bytes, script and markup, SQL meta sequences, path traversal and
 * control characters are stripped from every text field. Items whose artist (or
 * album, in album mode) is left empty, or whose raw fields exceed the length
 * limits, are dropped. Out-of-range confidence is flagged here and clamped later
 * by schema validation; non-finite confidence is dropped.</p>
 */
@Component
public class RecommendationSanitizer {

    static final int MAX_NAME_LENGTH = 500;
    static final int MAX_GENRE_LENGTH = 100;
    static final int MAX_REASON_LENGTH = 1000;

    private static final Pattern NULL_BYTES = Pattern.compile("(\\x00|%00|\\\\0)");
    private static final Pattern SCRIPT_ELEMENTS = Pattern.compile(
        "<(script|iframe|object|embed|form|input|button|style)[^>]*>.*?</\\1\\s*>|<[^>]*(img|svg|on\\w+\\s*=)[^>]*>",
        Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern SQL_META = Pattern.compile(
        ";\\s*(drop|delete|insert|update|exec(ute)?|truncate|alter)\\b|\\bunion\\s+(all\\s+)?select\\b|--|/\\*|\\*/|';",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern PATH_TRAVERSAL = Pattern.compile("(\\.\\./|\\.\\.\\\\|%2e%2e|%252e%252e)",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern DANGEROUS_PATHS = Pattern.compile("(/etc/passwd|windows\\\\system32|system32\\\\)",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern HTML_TAGS = Pattern.compile("<[^>]*>");
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final Pattern DANGEROUS = Pattern.compile(
        NULL_BYTES.pattern() + "|" + PATH_TRAVERSAL.pattern() + "|" + DANGEROUS_PATHS.pattern(),
        Pattern.CASE_INSENSITIVE);

    /**
     * Sanitizes a raw batch. {@code null} entries pass through for schema validation to count.
     */
    StageOutcome sanitize(List<Recommendation> raw, RecommendationMode mode, ValidationReportBuilder report) {
        List<Recommendation> kept = new ArrayList<>(raw.size());
        List<FilteredRecommendation> filtered = new ArrayList<>();
        for (Recommendation item : raw) {
            if (item == null) {
                kept.add(null);
                continue;
            }
            String rejection = rejectionReason(item);
            if (rejection != null) {
                report.dropped("Dropped '%s': %s".formatted(abbreviate(item.artist()), rejection));
                filtered.add(FilteredRecommendation.of(item, PipelineStage.SANITIZE, rejection));
                continue;
            }
            Recommendation cleaned = new Recommendation(
                sanitizeText(item.artist()),
                sanitizeText(item.album()),
                sanitizeText(item.genre()),
                sanitizeText(item.reason()),
                item.confidence(),
                item.year(),
                item.source()
            );
            if (!StringUtils.hasText(cleaned.artist())
                || (mode.requiresAlbum() && StringUtils.hasText(item.album()) && !StringUtils.hasText(cleaned.album()))) {
                String reason = "essential field empty after sanitizing";
                report.dropped("Dropped '%s': %s".formatted(abbreviate(item.artist()), reason));
                filtered.add(FilteredRecommendation.of(item, PipelineStage.SANITIZE, reason));
                continue;
            }
            if (cleaned.confidence() < 0.0 || cleaned.confidence() > 1.0) {
                report.warn("Invalid raw confidence %s for '%s'".formatted(cleaned.confidence(), cleaned.displayName()));
            }
            kept.add(cleaned);
        }
        return new StageOutcome(kept, filtered);
    }

    /**
     * Strict check for items entering the import path without schema validation.
     * Out-of-range confidence counts as invalid here.
     */
    public boolean isValid(Recommendation item) {
        if (item == null || !StringUtils.hasText(item.artist())) {
            return false;
        }
        if (rejectionReason(item) != null) {
            return false;
        }
        if (containsDangerousContent(item.artist()) || containsDangerousContent(item.album())
            || containsDangerousContent(item.genre()) || containsDangerousContent(item.reason())) {
            return false;
        }
        return item.confidence() >= 0.0 && item.confidence() <= 1.0;
    }

    /**
     * Strips dangerous payloads from one text value. Returns {@code null} for {@code null}.
     */
    public String sanitizeText(String input) {
        if (input == null) {
            return null;
        }
        String sanitized = NULL_BYTES.matcher(input).replaceAll("");
        sanitized = SCRIPT_ELEMENTS.matcher(sanitized).replaceAll("");
        sanitized = SQL_META.matcher(sanitized).replaceAll("");
        sanitized = PATH_TRAVERSAL.matcher(sanitized).replaceAll("");
        sanitized = DANGEROUS_PATHS.matcher(sanitized).replaceAll("");
        sanitized = HTML_TAGS.matcher(sanitized).replaceAll("");
        sanitized = sanitized.replace("\"", "");
        return CONTROL_CHARS.matcher(sanitized).replaceAll("");
    }

    boolean containsDangerousContent(String input) {
        if (input == null || input.isEmpty()) {
            return false;
        }
        return DANGEROUS.matcher(input).find()
            || SCRIPT_ELEMENTS.matcher(input).find()
            || SQL_META.matcher(input).find();
    }

    private String rejectionReason(Recommendation item) {
        if (!Double.isFinite(item.confidence())) {
            return "non-finite confidence";
        }
        if (length(item.artist()) > MAX_NAME_LENGTH || length(item.album()) > MAX_NAME_LENGTH) {
            return "artist or album longer than " + MAX_NAME_LENGTH + " characters";
        }
        if (length(item.genre()) > MAX_GENRE_LENGTH) {
            return "genre longer than " + MAX_GENRE_LENGTH + " characters";
        }
        if (length(item.reason()) > MAX_REASON_LENGTH) {
            return "reason longer than " + MAX_REASON_LENGTH + " characters";
        }
        return null;
    }

    private static int length(String value) {
        return value == null ? 0 : value.length();
    }

    private static String abbreviate(String value) {
        if (value == null) {
            return "<null>";
        }
        return value.length() <= 40 ? value : value.substring(0, 40) + "...";
    }
}
