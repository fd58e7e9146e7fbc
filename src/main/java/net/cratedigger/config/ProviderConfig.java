package net.cratedigger.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import java.time.Duration;
import java.util.concurrent.Executor;
import net.cratedigger.application.provider.OpenAiRecommendationProvider;
import net.cratedigger.application.provider.ResilientRecommendationProvider;
import net.cratedigger.service.provider.RecommendationProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import tools.jackson.databind.ObjectMapper;

/**
 * Wires the recommendation provider with its rate limiter, circuit breaker and call executor.
 */
@Configuration
public class ProviderConfig {

    private static final Logger logger = LoggerFactory.getLogger(ProviderConfig.class);
    private static final int PROVIDER_EXECUTOR_POOL_SIZE = 4;

    /**
     * Rate limiter for provider calls, refilled every minute.
     */
    @Bean
    public RateLimiter providerRateLimiter(ProviderProperties properties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
            .limitRefreshPeriod(Duration.ofMinutes(1))
            .limitForPeriod(Math.max(1, properties.getRequestsPerMinute()))
            .timeoutDuration(Duration.ZERO)
            .build();
        logger.info("Provider rate limiter initialized with limit of {} requests/minute", properties.getRequestsPerMinute());
        return RateLimiter.of("recommendationProviderRateLimiter", config);
    }

    /**
     * Circuit breaker that stops hammering a failing provider.
     */
    @Bean
    public CircuitBreaker providerCircuitBreaker(ProviderProperties properties) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
            .failureRateThreshold(properties.getFailureRateThreshold())
            .waitDurationInOpenState(properties.getOpenStateWait())
            .slidingWindowSize(10)
            .minimumNumberOfCalls(5)
            .build();
        return CircuitBreaker.of("recommendationProviderCircuitBreaker", config);
    }

    @Bean
    public RecommendationProvider recommendationProvider(ProviderProperties properties,
                                                         ObjectMapper objectMapper,
                                                         CircuitBreaker providerCircuitBreaker,
                                                         RateLimiter providerRateLimiter) {
        return new ResilientRecommendationProvider(
            new OpenAiRecommendationProvider(properties, objectMapper),
            providerCircuitBreaker,
            providerRateLimiter
        );
    }

    /**
     * Executor for blocking provider calls, so a waiting run can honour cancellation.
     */
    @Bean(name = "providerExecutor")
    public Executor providerExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(PROVIDER_EXECUTOR_POOL_SIZE);
        executor.setMaxPoolSize(PROVIDER_EXECUTOR_POOL_SIZE);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("ProviderCall-");
        executor.initialize();
        return executor;
    }
}
