package net.cratedigger.application.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import net.cratedigger.config.ProviderProperties;
import net.cratedigger.service.provider.RecommendationProviderException;
import net.cratedigger.service.provider.RecommendationProviderException.ErrorCode;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.json.JsonMapper;

class OpenAiRecommendationProviderTest {

    @Test
    void should_ReportNotConfigured_When_ApiKeyMissing() {
        ProviderProperties properties = new ProviderProperties();
        properties.setModel("gpt-test");
        OpenAiRecommendationProvider provider = new OpenAiRecommendationProvider(properties, JsonMapper.builder().build());

        assertThat(provider.providerName()).isEqualTo("openai:gpt-test");
        assertThat(provider.testConnection()).isFalse();
        assertThatThrownBy(() -> provider.getRecommendations("prompt"))
            .isInstanceOf(RecommendationProviderException.class)
            .satisfies(failure -> assertThat(((RecommendationProviderException) failure).errorCode())
                .isEqualTo(ErrorCode.NOT_CONFIGURED));
    }
}
