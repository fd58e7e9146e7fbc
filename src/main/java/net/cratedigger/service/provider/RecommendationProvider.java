package net.cratedigger.service.provider;

import java.util.List;
import net.cratedigger.domain.recommendation.Recommendation;

/**
 * Source of raw candidate recommendations, typically a generative model.
 *
 * <p>Implementations may block on network I/O. Failures surface as
 * {@link RecommendationProviderException}.</p>
 */
public interface RecommendationProvider {

    /**
     * Stable identity used in cache keys, such as {@code openai:gpt-4o-mini}.
     */
    String providerName();

    List<Recommendation> getRecommendations(String prompt);

    /**
     * Probes the provider. Never throws.
     */
    boolean testConnection();
}
