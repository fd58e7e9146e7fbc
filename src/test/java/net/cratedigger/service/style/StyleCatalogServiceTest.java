package net.cratedigger.service.style;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import net.cratedigger.domain.style.StyleDefinition;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.json.JsonMapper;

class StyleCatalogServiceTest {

    private final StyleCatalogService catalog = new StyleCatalogService(JsonMapper.builder().build());

    @Test
    void should_ResolveAliasesToCanonicalSlug_When_BundledCatalogLoaded() {
        assertThat(catalog.canonicalSlug("Prog Rock")).isEqualTo("progressive-rock");
        assertThat(catalog.canonicalSlug("PROG")).isEqualTo("progressive-rock");
        assertThat(catalog.canonicalSlug("Progressive Rock")).isEqualTo("progressive-rock");
    }

    @Test
    void should_KeepOwnSlug_When_LabelUnknown() {
        assertThat(catalog.canonicalSlug("Zeuhl Fusion")).isEqualTo("zeuhl-fusion");
    }

    @Test
    void should_SplitCompoundGenres_When_ResolvingTags() {
        assertThat(catalog.tagSlugs("Prog / Jazz; Rock")).containsExactly("progressive-rock", "jazz", "rock");
    }

    @Test
    void should_ListParentAndChildren_When_RelatedSlugsRequested() {
        StyleCatalogService small = new StyleCatalogService(List.of(
            new StyleDefinition("Rock", List.of(), null),
            new StyleDefinition("Progressive Rock", List.of(), "rock"),
            new StyleDefinition("Krautrock", List.of(), "rock")));

        assertThat(small.relatedSlugs("rock")).containsExactlyInAnyOrder("progressive-rock", "krautrock");
        assertThat(small.relatedSlugs("krautrock")).containsExactly("rock");
    }

    @Test
    void should_FindStyleByAlias_When_Searching() {
        assertThat(catalog.search("prog", 5)).extracting(StyleDefinition::name).contains("Progressive Rock");
        assertThat(catalog.find("prog")).map(StyleDefinition::name).contains("Progressive Rock");
    }
}
