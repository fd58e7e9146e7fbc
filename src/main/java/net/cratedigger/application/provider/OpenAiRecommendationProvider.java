package net.cratedigger.application.provider;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.core.RequestOptions;
import com.openai.core.Timeout;
import com.openai.errors.OpenAIException;
import com.openai.errors.OpenAIIoException;
import com.openai.errors.OpenAIServiceException;
import com.openai.models.ChatModel;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.openai.models.chat.completions.ChatCompletionMessageParam;
import com.openai.models.chat.completions.ChatCompletionSystemMessageParam;
import com.openai.models.chat.completions.ChatCompletionUserMessageParam;
import java.util.List;
import net.cratedigger.config.ProviderProperties;
import net.cratedigger.domain.recommendation.Recommendation;
import net.cratedigger.service.provider.RecommendationProvider;
import net.cratedigger.service.provider.RecommendationProviderException;
import net.cratedigger.service.provider.RecommendationProviderException.ErrorCode;
import net.cratedigger.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;
import tools.jackson.databind.ObjectMapper;

/**
 * {@link RecommendationProvider} backed by an OpenAI-compatible chat completion endpoint.
 *
 * <p>Without an API key the provider stays disabled: calls fail with
 * {@link ErrorCode#NOT_CONFIGURED} and {@link #testConnection()} reports {@code false}.</p>
 */
public class OpenAiRecommendationProvider implements RecommendationProvider {

    private static final Logger log = LoggerFactory.getLogger(OpenAiRecommendationProvider.class);
    private static final String SYSTEM_PROMPT = """
        You are a music curator. Reply with JSON only, no prose and no markdown.
        Recommend real, released music. Never invent artists or albums.
        """;
    private static final long MAX_COMPLETION_TOKENS = 4_000L;
    private static final String PROVIDER_PREFIX = "openai:";

    private final OpenAIClient openAiClient;
    private final RecommendationJsonParser parser;
    private final String model;
    private final RequestOptions requestOptions;

    public OpenAiRecommendationProvider(ProviderProperties properties, ObjectMapper objectMapper) {
        this.model = StringUtils.hasText(properties.getModel()) ? properties.getModel().trim() : "gpt-4o-mini";
        this.parser = new RecommendationJsonParser(objectMapper, providerName());
        this.requestOptions = RequestOptions.builder()
            .timeout(Timeout.builder()
                .request(properties.getRequestTimeout())
                .read(properties.getReadTimeout())
                .build())
            .build();

        if (StringUtils.hasText(properties.getApiKey())) {
            this.openAiClient = OpenAIOkHttpClient.builder()
                .apiKey(properties.getApiKey().trim())
                .baseUrl(properties.getBaseUrl())
                .maxRetries(0)
                .build();
            log.info("OpenAI recommendation provider configured (model={}, baseUrl={})", model, properties.getBaseUrl());
        } else {
            this.openAiClient = null;
            log.warn("OpenAI recommendation provider is disabled: no API key configured");
        }
    }

    OpenAiRecommendationProvider(OpenAIClient openAiClient, String model, ObjectMapper objectMapper) {
        this.openAiClient = openAiClient;
        this.model = model;
        this.parser = new RecommendationJsonParser(objectMapper, providerName());
        this.requestOptions = RequestOptions.none();
    }

    @Override
    public String providerName() {
        return PROVIDER_PREFIX + model;
    }

    @Override
    public List<Recommendation> getRecommendations(String prompt) {
        if (openAiClient == null) {
            throw new RecommendationProviderException(ErrorCode.NOT_CONFIGURED, "OpenAI provider has no API key");
        }
        ChatCompletionCreateParams params = ChatCompletionCreateParams.builder()
            .model(ChatModel.of(model))
            .messages(List.of(
                ChatCompletionMessageParam.ofSystem(ChatCompletionSystemMessageParam.builder().content(SYSTEM_PROMPT).build()),
                ChatCompletionMessageParam.ofUser(ChatCompletionUserMessageParam.builder().content(prompt).build())
            ))
            .maxCompletionTokens(MAX_COMPLETION_TOKENS)
            .build();

        String response;
        try {
            ChatCompletion completion = openAiClient.chat().completions().create(params, requestOptions);
            if (completion.choices().isEmpty()) {
                throw new RecommendationProviderException(ErrorCode.MALFORMED_RESPONSE, "Completion contained no choices");
            }
            response = completion.choices().get(0).message().content().orElse("");
        } catch (OpenAIException openAiException) {
            String detail = describeApiError(openAiException);
            log.error("Recommendation API call failed (model={}): {}", model, detail);
            throw new RecommendationProviderException(ErrorCode.REQUEST_FAILED,
                "Recommendation request failed (%s): %s".formatted(model, detail), openAiException);
        }

        try {
            return parser.parse(response);
        } catch (IllegalStateException parseFailure) {
            throw new RecommendationProviderException(ErrorCode.MALFORMED_RESPONSE, parseFailure.getMessage(), parseFailure);
        }
    }

    @Override
    public boolean testConnection() {
        if (openAiClient == null) {
            return false;
        }
        try {
            openAiClient.models().list();
            return true;
        } catch (OpenAIException e) {
            LoggingUtils.warn(log, e, "OpenAI connection test failed: {}", describeApiError(e));
            return false;
        }
    }

    static String describeApiError(OpenAIException ex) {
        if (ex instanceof OpenAIServiceException serviceException) {
            int status = serviceException.statusCode();
            String explanation = switch (status) {
                case 401 -> "unauthorized, check API key";
                case 404 -> "not found, check base URL and model name";
                case 429 -> "rate limited";
                case 500, 502, 503 -> "server error";
                default -> "unexpected status";
            };
            return "HTTP %d %s".formatted(status, explanation);
        }
        if (ex instanceof OpenAIIoException) {
            return "network error: " + ex.getMessage();
        }
        return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
    }
}
