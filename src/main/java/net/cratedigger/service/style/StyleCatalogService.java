package net.cratedigger.service.style;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import net.cratedigger.domain.style.StyleDefinition;
import net.cratedigger.util.LoggingUtils;
import net.cratedigger.util.StyleSlugs;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * Catalog of known musical styles used to canonicalize genre tags and style filters.
 *
 * <p>Labels resolve to the canonical slug of the style whose name or alias matches.
 * Labels the catalog does not know resolve to their own slug, so ad-hoc filters
 * such as "Krautrock" still match items tagged "krautrock".</p>
 */
@Slf4j
@Service
public class StyleCatalogService {

    static final String CATALOG_RESOURCE = "styles.json";
    private static final long RESOLUTION_CACHE_SIZE = 2_000L;

    private final Map<String, StyleDefinition> stylesBySlug = new LinkedHashMap<>();
    private final Map<String, String> aliasToSlug = new HashMap<>();
    private final Cache<String, String> resolutions = Caffeine.newBuilder()
        .maximumSize(RESOLUTION_CACHE_SIZE)
        .build();

    @Autowired
    public StyleCatalogService(ObjectMapper objectMapper) {
        this(loadBundledCatalog(objectMapper));
    }

    public StyleCatalogService(List<StyleDefinition> definitions) {
        for (StyleDefinition definition : definitions) {
            String slug = definition.slug();
            if (slug.isEmpty() || stylesBySlug.putIfAbsent(slug, definition) != null) {
                continue;
            }
            aliasToSlug.putIfAbsent(slug, slug);
            for (String alias : definition.aliases()) {
                String aliasSlug = StyleSlugs.slugify(alias);
                if (!aliasSlug.isEmpty()) {
                    aliasToSlug.putIfAbsent(aliasSlug, slug);
                }
            }
        }
        log.info("Style catalog ready with {} styles and {} aliases", stylesBySlug.size(), aliasToSlug.size());
    }

    /**
     * Resolves a style or genre label to its canonical slug.
     *
     * @return canonical slug, or an empty string for blank labels
     */
    public String canonicalSlug(String label) {
        String slug = StyleSlugs.slugify(label);
        if (slug.isEmpty()) {
            return slug;
        }
        return resolutions.get(slug, key -> aliasToSlug.getOrDefault(key, key));
    }

    public Set<String> canonicalSlugs(Collection<String> labels) {
        Set<String> slugs = new LinkedHashSet<>();
        if (labels == null) {
            return slugs;
        }
        for (String label : labels) {
            String slug = canonicalSlug(label);
            if (!slug.isEmpty()) {
                slugs.add(slug);
            }
        }
        return slugs;
    }

    /**
     * Returns the canonical slugs of every tag in a compound genre field.
     */
    public Set<String> tagSlugs(String genreField) {
        return canonicalSlugs(StyleSlugs.splitTags(genreField));
    }

    /**
     * Parent and child styles of a slug, excluding the slug itself.
     */
    public Set<String> relatedSlugs(String slug) {
        Set<String> related = new LinkedHashSet<>();
        StyleDefinition definition = stylesBySlug.get(slug);
        if (definition != null && StringUtils.hasText(definition.parent())) {
            related.add(canonicalSlug(definition.parent()));
        }
        for (StyleDefinition candidate : stylesBySlug.values()) {
            if (StringUtils.hasText(candidate.parent()) && slug.equals(canonicalSlug(candidate.parent()))) {
                related.add(candidate.slug());
            }
        }
        related.remove(slug);
        return related;
    }

    public Optional<StyleDefinition> find(String slug) {
        return Optional.ofNullable(stylesBySlug.get(canonicalSlug(slug)));
    }

    /**
     * Searches styles by name or alias prefix, case-insensitively.
     *
     * @param query text to match, blank returns every style
     * @param limit maximum results
     */
    public List<StyleDefinition> search(String query, int limit) {
        String needle = query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
        return stylesBySlug.values().stream()
            .filter(definition -> needle.isEmpty() || matches(definition, needle))
            .sorted(Comparator.comparing(StyleDefinition::name, String.CASE_INSENSITIVE_ORDER))
            .limit(Math.max(0, limit))
            .toList();
    }

    private static boolean matches(StyleDefinition definition, String needle) {
        if (definition.name().toLowerCase(Locale.ROOT).contains(needle)) {
            return true;
        }
        return definition.aliases().stream().anyMatch(alias -> alias.toLowerCase(Locale.ROOT).contains(needle));
    }

    private static List<StyleDefinition> loadBundledCatalog(ObjectMapper objectMapper) {
        ClassPathResource resource = new ClassPathResource(CATALOG_RESOURCE);
        if (!resource.exists()) {
            log.warn("Style catalog resource {} not found; style filters will match raw slugs only", CATALOG_RESOURCE);
            return List.of();
        }
        try (InputStream input = resource.getInputStream()) {
            List<StyleDefinition> definitions = objectMapper.readValue(input, new TypeReference<List<StyleDefinition>>() { });
            return definitions == null ? List.of() : definitions;
        } catch (IOException | JacksonException e) {
            LoggingUtils.warn(log, e, "Failed to load style catalog {}", CATALOG_RESOURCE);
            return List.of();
        }
    }
}
