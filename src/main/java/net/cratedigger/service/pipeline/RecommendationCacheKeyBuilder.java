package net.cratedigger.service.pipeline;

import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.stream.Collectors;
import net.cratedigger.util.HashUtils;
import net.cratedigger.util.StyleSlugs;
import org.springframework.stereotype.Component;

/**
 * Derives the result cache key for a run.
 *
 * <p>The key is a SHA-256 over provider identity, requested count, library
 * fingerprint, configuration version and the remaining request settings. Style
 * filters are slugged and sorted, so their order and spelling do not matter.
 * Any other change yields a new key, which retires old entries without an
 * explicit clear.</p>
 */
@Component
public class RecommendationCacheKeyBuilder {

    private final ConfigVersionProvider configVersionProvider;

    public RecommendationCacheKeyBuilder(ConfigVersionProvider configVersionProvider) {
        this.configVersionProvider = Objects.requireNonNull(configVersionProvider, "configVersionProvider must not be null");
    }

    public String build(String providerName, PipelineRequest request, String libraryFingerprint) {
        Objects.requireNonNull(request, "request must not be null");
        String material = String.join(":",
            nullToEmpty(providerName),
            Integer.toString(request.maxRecommendations()),
            nullToEmpty(libraryFingerprint),
            nullToEmpty(configVersionProvider.configVersion()),
            request.mode().name(),
            request.backfillStrategy().name(),
            Integer.toString(request.maxTopUpIterations()),
            canonicalFilters(request.styleFilters()),
            Boolean.toString(request.relaxStyleMatching())
        );
        return HashUtils.sha256Hex(material);
    }

    private static String canonicalFilters(List<String> filters) {
        return filters.stream()
            .map(StyleSlugs::slugify)
            .filter(slug -> !slug.isEmpty())
            .collect(Collectors.toCollection(TreeSet::new))
            .stream()
            .collect(Collectors.joining(","));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
