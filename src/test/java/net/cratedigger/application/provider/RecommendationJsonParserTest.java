package net.cratedigger.application.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import net.cratedigger.domain.recommendation.Recommendation;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.json.JsonMapper;

class RecommendationJsonParserTest {

    private final RecommendationJsonParser parser = new RecommendationJsonParser(JsonMapper.builder().build(), "openai:test");

    @Test
    void should_ParseWrappedArray_When_ResponseIsFencedJson() {
        String response = """
            ```json
            {"recommendations": [
              {"artist": "Yes", "album": "Close to the Edge", "genre": "Progressive Rock",
               "year": 1972, "confidence": 0.92, "reason": "Side-long suites"}
            ]}
            ```
            """;

        List<Recommendation> parsed = parser.parse(response);

        assertThat(parsed).containsExactly(new Recommendation(
            "Yes", "Close to the Edge", "Progressive Rock", "Side-long suites", 0.92, 1972, "openai:test"));
    }

    @Test
    void should_ExtractJson_When_ModelAddsProse() {
        String response = "Here you go: [{\"artistName\": \"Can\", \"title\": \"Tago Mago\", \"genres\": [\"Krautrock\", \"Jazz\"]}] Enjoy!";

        List<Recommendation> parsed = parser.parse(response);

        assertThat(parsed).singleElement().satisfies(item -> {
            assertThat(item.artist()).isEqualTo("Can");
            assertThat(item.album()).isEqualTo("Tago Mago");
            assertThat(item.genre()).isEqualTo("Krautrock, Jazz");
            assertThat(item.confidence()).isEqualTo(RecommendationJsonParser.DEFAULT_CONFIDENCE);
            assertThat(item.year()).isNull();
        });
    }

    @Test
    void should_ParseTextualNumbers_When_ConfidenceAndYearAreStrings() {
        List<Recommendation> parsed = parser.parse(
            "{\"items\": [{\"artist\": \"Faust\", \"album\": \"IV\", \"confidence\": \"0.4\", \"year\": \"1973\"}, 42]}");

        assertThat(parsed).singleElement().satisfies(item -> {
            assertThat(item.confidence()).isEqualTo(0.4);
            assertThat(item.year()).isEqualTo(1973);
        });
    }

    @Test
    void should_Throw_When_ResponseHasNoJson() {
        assertThatThrownBy(() -> parser.parse("I cannot help with that."))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("valid JSON");
        assertThatThrownBy(() -> parser.parse("{\"message\": \"none\"}"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("recommendations array");
    }
}
