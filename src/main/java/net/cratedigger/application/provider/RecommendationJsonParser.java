package net.cratedigger.application.provider;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import net.cratedigger.domain.recommendation.Recommendation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

/**
 * Parses raw model output into candidate recommendations.
 *
 * <p>Handles markdown fences, a bare array or an object wrapping the array, brace
 * extraction when the model adds prose, and common field aliases. Entries that are
 * not objects are skipped; field-level validation is left to the pipeline.</p>
 */
class RecommendationJsonParser {

    private static final Logger log = LoggerFactory.getLogger(RecommendationJsonParser.class);
    static final double DEFAULT_CONFIDENCE = 0.7;

    private final ObjectMapper objectMapper;
    private final String source;

    RecommendationJsonParser(ObjectMapper objectMapper, String source) {
        this.objectMapper = objectMapper;
        this.source = source;
    }

    /**
     * @param responseText raw model output
     * @return parsed candidates, possibly empty
     * @throws IllegalStateException when the text holds no parseable JSON
     */
    List<Recommendation> parse(String responseText) {
        if (!StringUtils.hasText(responseText)) {
            throw new IllegalStateException("Recommendation response was empty");
        }
        JsonNode payload = parseJsonPayload(responseText);
        JsonNode entries = payload.isArray() ? payload : resolveJsonNode(payload, "recommendations", "items", "albums", "artists")
            .orElse(null);
        if (entries == null || !entries.isArray()) {
            throw new IllegalStateException("Recommendation response did not contain a recommendations array");
        }

        List<Recommendation> recommendations = new ArrayList<>();
        for (JsonNode entry : entries) {
            if (entry == null || !entry.isObject()) {
                continue;
            }
            recommendations.add(new Recommendation(
                optionalText(entry, "artist", "artistName", "artist_name").orElse(null),
                optionalText(entry, "album", "albumTitle", "album_title", "title").orElse(null),
                optionalText(entry, "genre", "style", "genres").orElse(null),
                optionalText(entry, "reason", "why", "explanation").orElse(null),
                confidence(entry),
                year(entry),
                source
            ));
        }
        if (recommendations.isEmpty()) {
            log.warn("Recommendation response parsed but contained no usable entries");
        }
        return recommendations;
    }

    private JsonNode parseJsonPayload(String responseText) {
        String cleaned = responseText.replace("```json", "").replace("```", "").trim();
        try {
            return objectMapper.readTree(cleaned);
        } catch (JacksonException initialParseException) {
            int open = firstIndex(cleaned, '{', '[');
            int close = Math.max(cleaned.lastIndexOf('}'), cleaned.lastIndexOf(']'));
            if (open < 0 || close <= open) {
                throw new IllegalStateException("Recommendation response did not include valid JSON");
            }
            log.warn("Recommendation response required bracket extraction (initial parse failed: {})",
                initialParseException.getMessage());
            try {
                return objectMapper.readTree(cleaned.substring(open, close + 1));
            } catch (JacksonException exception) {
                throw new IllegalStateException("Recommendation response JSON parsing failed", exception);
            }
        }
    }

    private static int firstIndex(String text, char first, char second) {
        int a = text.indexOf(first);
        int b = text.indexOf(second);
        if (a < 0) {
            return b;
        }
        return b < 0 ? a : Math.min(a, b);
    }

    private double confidence(JsonNode entry) {
        Optional<JsonNode> node = resolveJsonNode(entry, "confidence", "score");
        if (node.isEmpty()) {
            return DEFAULT_CONFIDENCE;
        }
        if (node.get().isNumber()) {
            return node.get().asDouble();
        }
        String text = node.get().asString(null);
        if (!StringUtils.hasText(text)) {
            return DEFAULT_CONFIDENCE;
        }
        try {
            return Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric confidence '{}'", text);
            return DEFAULT_CONFIDENCE;
        }
    }

    private Integer year(JsonNode entry) {
        Optional<JsonNode> node = resolveJsonNode(entry, "year", "releaseYear", "release_year");
        if (node.isEmpty()) {
            return null;
        }
        if (node.get().isInt()) {
            return node.get().asInt();
        }
        String text = node.get().asString(null);
        if (text == null || !text.trim().matches("\\d{4}")) {
            return null;
        }
        return Integer.valueOf(text.trim());
    }

    private Optional<String> optionalText(JsonNode payload, String field, String... aliases) {
        return resolveJsonNode(payload, field, aliases)
            .map(node -> node.isArray() ? joinArray(node) : node.asString(null))
            .filter(StringUtils::hasText);
    }

    private static String joinArray(JsonNode array) {
        List<String> parts = new ArrayList<>();
        for (JsonNode element : array) {
            String text = element.asString(null);
            if (StringUtils.hasText(text)) {
                parts.add(text.trim());
            }
        }
        return String.join(", ", parts);
    }

    private Optional<JsonNode> resolveJsonNode(JsonNode payload, String field, String... aliases) {
        JsonNode node = payload.get(field);
        if (node != null && !node.isNull()) {
            return Optional.of(node);
        }
        for (String alias : aliases) {
            JsonNode aliasNode = payload.get(alias);
            if (aliasNode != null && !aliasNode.isNull()) {
                return Optional.of(aliasNode);
            }
        }
        return Optional.empty();
    }
}
