package net.cratedigger.application.provider;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import net.cratedigger.domain.recommendation.Recommendation;
import net.cratedigger.service.provider.RecommendationProvider;
import net.cratedigger.service.provider.RecommendationProviderException;
import net.cratedigger.service.provider.RecommendationProviderException.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guards a provider with a rate limiter and a circuit breaker.
 *
 * <p>Rejections by either guard surface as {@link RecommendationProviderException}
 * with {@link ErrorCode#RATE_LIMITED} or {@link ErrorCode#CIRCUIT_OPEN}.</p>
 */
public class ResilientRecommendationProvider implements RecommendationProvider {

    private static final Logger log = LoggerFactory.getLogger(ResilientRecommendationProvider.class);

    private final RecommendationProvider delegate;
    private final CircuitBreaker circuitBreaker;
    private final RateLimiter rateLimiter;

    public ResilientRecommendationProvider(RecommendationProvider delegate,
                                           CircuitBreaker circuitBreaker,
                                           RateLimiter rateLimiter) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.circuitBreaker = Objects.requireNonNull(circuitBreaker, "circuitBreaker must not be null");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter must not be null");
    }

    @Override
    public String providerName() {
        return delegate.providerName();
    }

    @Override
    public List<Recommendation> getRecommendations(String prompt) {
        Supplier<List<Recommendation>> call = () -> delegate.getRecommendations(prompt);
        Supplier<List<Recommendation>> guarded =
            CircuitBreaker.decorateSupplier(circuitBreaker, RateLimiter.decorateSupplier(rateLimiter, call));
        try {
            return guarded.get();
        } catch (RequestNotPermitted limited) {
            log.warn("Provider {} call rejected by rate limiter {}", providerName(), rateLimiter.getName());
            throw new RecommendationProviderException(ErrorCode.RATE_LIMITED,
                "Provider rate limit reached for " + providerName(), limited);
        } catch (CallNotPermittedException open) {
            log.warn("Provider {} call rejected: circuit {} is {}", providerName(), circuitBreaker.getName(),
                circuitBreaker.getState());
            throw new RecommendationProviderException(ErrorCode.CIRCUIT_OPEN,
                "Provider circuit open for " + providerName(), open);
        }
    }

    @Override
    public boolean testConnection() {
        return delegate.testConnection();
    }
}
