package net.cratedigger.service.pipeline;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import net.cratedigger.domain.recommendation.Recommendation;
import net.cratedigger.service.style.StyleCatalogService;
import org.springframework.stereotype.Component;

/**
 * Fourth pipeline stage: restricts a batch to the configured styles.
 *
 * <p>Genre fields are split into tags and each tag is resolved to a canonical
 * style slug. Strict matching drops items whose tags share no slug with the filter
 * set. Relaxed matching drops nothing and reorders the batch: exact matches first,
 * then items tagged with a parent or child of a filter style, then the rest, each
 * group keeping its original order.</p>
 */
@Component
public class StyleGuard {

    private static final int EXACT = 0;
    private static final int RELATED = 1;
    private static final int UNMATCHED = 2;

    private final StyleCatalogService styleCatalog;

    public StyleGuard(StyleCatalogService styleCatalog) {
        this.styleCatalog = Objects.requireNonNull(styleCatalog, "styleCatalog must not be null");
    }

    StageOutcome apply(List<Recommendation> items, Collection<String> styleFilters, boolean relaxed) {
        Set<String> filterSlugs = styleCatalog.canonicalSlugs(styleFilters);
        if (filterSlugs.isEmpty()) {
            return StageOutcome.passThrough(items);
        }
        if (!relaxed) {
            List<Recommendation> kept = new ArrayList<>(items.size());
            List<FilteredRecommendation> filtered = new ArrayList<>();
            for (Recommendation item : items) {
                if (tier(item, filterSlugs, Set.of()) == EXACT) {
                    kept.add(item);
                } else {
                    filtered.add(FilteredRecommendation.of(item, PipelineStage.STYLE_GUARD,
                        "genre '%s' outside style filters".formatted(item.genre())));
                }
            }
            return new StageOutcome(kept, filtered);
        }

        Set<String> relatedSlugs = new LinkedHashSet<>();
        for (String slug : filterSlugs) {
            relatedSlugs.addAll(styleCatalog.relatedSlugs(slug));
        }
        List<List<Recommendation>> tiers = List.of(new ArrayList<>(), new ArrayList<>(), new ArrayList<>());
        for (Recommendation item : items) {
            tiers.get(tier(item, filterSlugs, relatedSlugs)).add(item);
        }
        List<Recommendation> ordered = new ArrayList<>(items.size());
        tiers.forEach(ordered::addAll);
        return StageOutcome.passThrough(ordered);
    }

    private int tier(Recommendation item, Set<String> filterSlugs, Set<String> relatedSlugs) {
        Set<String> tags = styleCatalog.tagSlugs(item.genre());
        if (!Collections.disjoint(tags, filterSlugs)) {
            return EXACT;
        }
        if (!Collections.disjoint(tags, relatedSlugs)) {
            return RELATED;
        }
        return UNMATCHED;
    }
}
