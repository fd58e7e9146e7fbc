package net.cratedigger.config;

import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.List;
import net.cratedigger.domain.recommendation.BackfillStrategy;
import net.cratedigger.domain.recommendation.RecommendationMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

/**
 * Strongly typed settings for recommendation runs.
 *
 * <p>Every field except {@code configVersion} also feeds the result cache key
 * through the pipeline request, so changing a setting naturally misses the cache.
 * Bump {@code configVersion} to invalidate cached results after changes that are
 * not part of the request, such as provider prompts.</p>
 */
@Component
@ConfigurationProperties(prefix = "cratedigger.recommendations")
public class RecommendationProperties {

    /**
     * Number of items a run delivers at most.
     */
    private int maxRecommendations = 10;

    /**
     * Whether runs recommend albums or artists.
     */
    private RecommendationMode mode = RecommendationMode.ALBUMS;

    /**
     * How aggressively short batches are topped up.
     */
    private BackfillStrategy backfillStrategy = BackfillStrategy.STANDARD;

    /**
     * Provider rounds allowed for top-up under {@link BackfillStrategy#STANDARD}.
     */
    private int maxTopUpIterations = 3;

    /**
     * Items below this confidence are held for review instead of delivered.
     */
    private double minConfidence = 0.3;

    /**
     * Keep items outside the style filters, ordered after matching ones.
     */
    private boolean relaxStyleMatching = false;

    /**
     * Style names, aliases or slugs that delivered items must match.
     */
    private List<String> styleFilters = new ArrayList<>();

    /**
     * Case-insensitive terms that send an item to review when found in any text field.
     */
    private List<String> blockedTerms = new ArrayList<>();

    /**
     * Opaque version mixed into the cache key.
     */
    private String configVersion = "1";

    @PostConstruct
    void validate() {
        Assert.isTrue(maxRecommendations > 0, "cratedigger.recommendations.max-recommendations must be positive");
        Assert.isTrue(maxTopUpIterations >= 0, "cratedigger.recommendations.max-top-up-iterations must be non-negative");
        Assert.isTrue(minConfidence >= 0.0 && minConfidence <= 1.0,
            "cratedigger.recommendations.min-confidence must be within [0, 1]");
        Assert.notNull(mode, "cratedigger.recommendations.mode must be set");
        Assert.notNull(backfillStrategy, "cratedigger.recommendations.backfill-strategy must be set");
    }

    public int getMaxRecommendations() {
        return maxRecommendations;
    }

    public void setMaxRecommendations(int maxRecommendations) {
        this.maxRecommendations = maxRecommendations;
    }

    public RecommendationMode getMode() {
        return mode;
    }

    public void setMode(RecommendationMode mode) {
        this.mode = mode;
    }

    public BackfillStrategy getBackfillStrategy() {
        return backfillStrategy;
    }

    public void setBackfillStrategy(BackfillStrategy backfillStrategy) {
        this.backfillStrategy = backfillStrategy;
    }

    public int getMaxTopUpIterations() {
        return maxTopUpIterations;
    }

    public void setMaxTopUpIterations(int maxTopUpIterations) {
        this.maxTopUpIterations = maxTopUpIterations;
    }

    public double getMinConfidence() {
        return minConfidence;
    }

    public void setMinConfidence(double minConfidence) {
        this.minConfidence = minConfidence;
    }

    public boolean isRelaxStyleMatching() {
        return relaxStyleMatching;
    }

    public void setRelaxStyleMatching(boolean relaxStyleMatching) {
        this.relaxStyleMatching = relaxStyleMatching;
    }

    public List<String> getStyleFilters() {
        return styleFilters;
    }

    public void setStyleFilters(List<String> styleFilters) {
        this.styleFilters = styleFilters == null ? new ArrayList<>() : styleFilters;
    }

    public List<String> getBlockedTerms() {
        return blockedTerms;
    }

    public void setBlockedTerms(List<String> blockedTerms) {
        this.blockedTerms = blockedTerms == null ? new ArrayList<>() : blockedTerms;
    }

    public String getConfigVersion() {
        return configVersion;
    }

    public void setConfigVersion(String configVersion) {
        this.configVersion = configVersion;
    }
}
