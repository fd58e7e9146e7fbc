package net.cratedigger.application.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import java.time.Duration;
import java.util.List;
import net.cratedigger.domain.recommendation.Recommendation;
import net.cratedigger.service.provider.RecommendationProvider;
import net.cratedigger.service.provider.RecommendationProviderException;
import net.cratedigger.service.provider.RecommendationProviderException.ErrorCode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ResilientRecommendationProviderTest {

    @Mock
    private RecommendationProvider delegate;

    private static RateLimiter limiter(int permits) {
        return RateLimiter.of("test", RateLimiterConfig.custom()
            .limitForPeriod(permits)
            .limitRefreshPeriod(Duration.ofHours(1))
            .timeoutDuration(Duration.ZERO)
            .build());
    }

    @Test
    void should_DelegateCall_When_GuardsPermit() {
        List<Recommendation> batch = List.of(Recommendation.of("Yes", "Fragile", "Rock", 0.8));
        when(delegate.getRecommendations("prompt")).thenReturn(batch);
        ResilientRecommendationProvider provider =
            new ResilientRecommendationProvider(delegate, CircuitBreaker.ofDefaults("test"), limiter(5));

        assertThat(provider.getRecommendations("prompt")).isEqualTo(batch);
    }

    @Test
    void should_ReportRateLimited_When_PermitsExhausted() {
        when(delegate.providerName()).thenReturn("openai:test");
        when(delegate.getRecommendations(anyString())).thenReturn(List.of());
        ResilientRecommendationProvider provider =
            new ResilientRecommendationProvider(delegate, CircuitBreaker.ofDefaults("test"), limiter(1));
        provider.getRecommendations("first");

        assertThatThrownBy(() -> provider.getRecommendations("second"))
            .isInstanceOf(RecommendationProviderException.class)
            .satisfies(failure -> assertThat(((RecommendationProviderException) failure).errorCode())
                .isEqualTo(ErrorCode.RATE_LIMITED));
    }

    @Test
    void should_ReportCircuitOpen_When_BreakerIsOpen() {
        when(delegate.providerName()).thenReturn("openai:test");
        CircuitBreaker breaker = CircuitBreaker.ofDefaults("test");
        breaker.transitionToOpenState();
        ResilientRecommendationProvider provider = new ResilientRecommendationProvider(delegate, breaker, limiter(5));

        assertThatThrownBy(() -> provider.getRecommendations("prompt"))
            .isInstanceOf(RecommendationProviderException.class)
            .satisfies(failure -> assertThat(((RecommendationProviderException) failure).errorCode())
                .isEqualTo(ErrorCode.CIRCUIT_OPEN));
        verify(delegate, never()).getRecommendations(anyString());
    }
}
