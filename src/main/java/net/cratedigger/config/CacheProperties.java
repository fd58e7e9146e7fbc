package net.cratedigger.config;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

/**
 * Sizing and expiry for the recommendation result cache.
 */
@Component
@ConfigurationProperties(prefix = "cratedigger.cache")
public class CacheProperties {

    /**
     * Maximum number of cached pipeline results.
     */
    private int maxSize = 200;

    /**
     * Lifetime of a cached pipeline result.
     */
    private Duration defaultTtl = Duration.ofMinutes(30);

    /**
     * Delay between background sweeps of expired entries.
     */
    private Duration sweepInterval = Duration.ofMinutes(1);

    @PostConstruct
    void validate() {
        Assert.isTrue(maxSize > 0, "cratedigger.cache.max-size must be positive");
        Assert.isTrue(defaultTtl != null && !defaultTtl.isZero() && !defaultTtl.isNegative(),
            "cratedigger.cache.default-ttl must be positive");
        Assert.isTrue(sweepInterval != null && !sweepInterval.isNegative(),
            "cratedigger.cache.sweep-interval must be non-negative");
    }

    public int getMaxSize() {
        return maxSize;
    }

    public void setMaxSize(int maxSize) {
        this.maxSize = maxSize;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public void setDefaultTtl(Duration defaultTtl) {
        this.defaultTtl = defaultTtl;
    }

    public Duration getSweepInterval() {
        return sweepInterval;
    }

    public void setSweepInterval(Duration sweepInterval) {
        this.sweepInterval = sweepInterval;
    }
}
