package net.cratedigger.config;

import java.time.Clock;
import java.util.List;
import net.cratedigger.domain.recommendation.Recommendation;
import net.cratedigger.support.cache.BoundedCache;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Result cache shared by all pipeline runs.
 */
@Configuration
public class CacheConfig {

    @Bean
    public BoundedCache<String, List<Recommendation>> recommendationResultCache(CacheProperties properties, Clock clock) {
        return new BoundedCache<>("recommendation-results", properties.getMaxSize(), properties.getDefaultTtl(), clock);
    }
}
