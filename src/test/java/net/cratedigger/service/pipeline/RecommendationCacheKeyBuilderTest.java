package net.cratedigger.service.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import net.cratedigger.domain.recommendation.BackfillStrategy;
import net.cratedigger.domain.recommendation.RecommendationMode;
import org.junit.jupiter.api.Test;

class RecommendationCacheKeyBuilderTest {

    private static PipelineRequest request(int max, List<String> styles, boolean relaxed) {
        return new PipelineRequest(max, RecommendationMode.ALBUMS, BackfillStrategy.STANDARD, 3, styles, relaxed);
    }

    @Test
    void should_ProduceDifferentKeys_When_OnlyConfigVersionDiffers() {
        RecommendationCacheKeyBuilder v1 = new RecommendationCacheKeyBuilder(() -> "1");
        RecommendationCacheKeyBuilder v2 = new RecommendationCacheKeyBuilder(() -> "2");
        PipelineRequest request = request(10, List.of("rock"), false);

        assertThat(v1.build("openai:gpt", request, "fp")).isNotEqualTo(v2.build("openai:gpt", request, "fp"));
    }

    @Test
    void should_ProduceSameKey_When_FiltersDifferOnlyInOrderAndSpelling() {
        RecommendationCacheKeyBuilder builder = new RecommendationCacheKeyBuilder(() -> "1");

        String first = builder.build("openai:gpt", request(10, List.of("Jazz", "Progressive Rock"), false), "fp");
        String second = builder.build("openai:gpt", request(10, List.of("progressive-rock", "jazz"), false), "fp");

        assertThat(first).isEqualTo(second).hasSize(64);
    }

    @Test
    void should_ProduceDifferentKeys_When_RequestOrLibraryChanges() {
        RecommendationCacheKeyBuilder builder = new RecommendationCacheKeyBuilder(() -> "1");
        String base = builder.build("openai:gpt", request(10, List.of(), false), "fp");

        assertThat(builder.build("openai:gpt", request(11, List.of(), false), "fp")).isNotEqualTo(base);
        assertThat(builder.build("openai:gpt", request(10, List.of(), false), "fp-2")).isNotEqualTo(base);
        assertThat(builder.build("other", request(10, List.of(), false), "fp")).isNotEqualTo(base);
        assertThat(builder.build("openai:gpt", request(10, List.of(), true), "fp")).isNotEqualTo(base);
    }
}
