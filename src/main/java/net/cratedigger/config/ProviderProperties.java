package net.cratedigger.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Connection and protection settings for the OpenAI-compatible recommendation provider.
 */
@Component
@ConfigurationProperties(prefix = "cratedigger.provider")
public class ProviderProperties {

    private String apiKey = "";
    private String baseUrl = "https://api.openai.com/v1";
    private String model = "gpt-4o-mini";
    private Duration requestTimeout = Duration.ofSeconds(120);
    private Duration readTimeout = Duration.ofSeconds(75);

    /**
     * Calls admitted per minute before the rate limiter rejects.
     */
    private int requestsPerMinute = 20;

    /**
     * Failure percentage that opens the circuit.
     */
    private float failureRateThreshold = 50f;

    /**
     * How long the circuit stays open before probing again.
     */
    private Duration openStateWait = Duration.ofSeconds(60);

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public void setReadTimeout(Duration readTimeout) {
        this.readTimeout = readTimeout;
    }

    public int getRequestsPerMinute() {
        return requestsPerMinute;
    }

    public void setRequestsPerMinute(int requestsPerMinute) {
        this.requestsPerMinute = requestsPerMinute;
    }

    public float getFailureRateThreshold() {
        return failureRateThreshold;
    }

    public void setFailureRateThreshold(float failureRateThreshold) {
        this.failureRateThreshold = failureRateThreshold;
    }

    public Duration getOpenStateWait() {
        return openStateWait;
    }

    public void setOpenStateWait(Duration openStateWait) {
        this.openStateWait = openStateWait;
    }
}
