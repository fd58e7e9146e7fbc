package net.cratedigger.service.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import net.cratedigger.domain.recommendation.Recommendation;
import org.junit.jupiter.api.Test;

class RecommendationSanitizerTest {

    private final RecommendationSanitizer sanitizer = new RecommendationSanitizer();

    @Test
    void should_RemoveInjectionSequences_When_SanitizingText() {
        assertThat(sanitizer.sanitizeText("Rock'; DROP TABLE albums; --")).doesNotContain("--").doesNotContain("';");
        assertThat(sanitizer.sanitizeText("Jazz\0Fusion")).isEqualTo("JazzFusion");
        assertThat(sanitizer.sanitizeText("<i>Blue</i> Train")).isEqualTo("Blue Train");
        assertThat(sanitizer.sanitizeText("say \"hi\"")).isEqualTo("say hi");
        assertThat(sanitizer.sanitizeText(null)).isNull();
    }

    @Test
    void should_DetectDangerousContent_When_RawTextCarriesPayload() {
        assertThat(sanitizer.containsDangerousContent("../../secret")).isTrue();
        assertThat(sanitizer.containsDangerousContent("<script>alert(1)</script>")).isTrue();
        assertThat(sanitizer.containsDangerousContent("1 UNION SELECT password")).isTrue();
        assertThat(sanitizer.containsDangerousContent("Close to the Edge")).isFalse();
    }

    @Test
    void should_RejectOutOfRangeConfidence_When_CheckingImportValidity() {
        assertThat(sanitizer.isValid(Recommendation.of("Yes", "Fragile", "Rock", 0.8))).isTrue();
        assertThat(sanitizer.isValid(Recommendation.of("Yes", "Fragile", "Rock", 1.2))).isFalse();
        assertThat(sanitizer.isValid(Recommendation.of("Yes", "Fragile", "Rock", Double.NaN))).isFalse();
        assertThat(sanitizer.isValid(Recommendation.of("Yes", "../etc", "Rock", 0.8))).isFalse();
        assertThat(sanitizer.isValid(Recommendation.of(" ", "Fragile", "Rock", 0.8))).isFalse();
        assertThat(sanitizer.isValid(null)).isFalse();
    }
}
