package net.cratedigger.config;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

/**
 * Time windows applied by the suggestion history.
 */
@Component
@ConfigurationProperties(prefix = "cratedigger.history")
public class HistoryProperties {

    /**
     * Minimum age of the latest suggestion before a rejection or dislike is recorded.
     */
    private Duration rejectionGuard = Duration.ofHours(24);

    /**
     * How long a plain rejection keeps an item out of new batches.
     */
    private Duration rejectionMemory = Duration.ofDays(30);

    /**
     * Suggestion count at which an item is listed as over-suggested in exclusion prompts.
     */
    private int overSuggestedThreshold = 3;

    @PostConstruct
    void validate() {
        Assert.isTrue(rejectionGuard != null && !rejectionGuard.isNegative(),
            "cratedigger.history.rejection-guard must be non-negative");
        Assert.isTrue(rejectionMemory != null && !rejectionMemory.isNegative(),
            "cratedigger.history.rejection-memory must be non-negative");
        Assert.isTrue(overSuggestedThreshold > 0, "cratedigger.history.over-suggested-threshold must be positive");
    }

    public Duration getRejectionGuard() {
        return rejectionGuard;
    }

    public void setRejectionGuard(Duration rejectionGuard) {
        this.rejectionGuard = rejectionGuard;
    }

    public Duration getRejectionMemory() {
        return rejectionMemory;
    }

    public void setRejectionMemory(Duration rejectionMemory) {
        this.rejectionMemory = rejectionMemory;
    }

    public int getOverSuggestedThreshold() {
        return overSuggestedThreshold;
    }

    public void setOverSuggestedThreshold(int overSuggestedThreshold) {
        this.overSuggestedThreshold = overSuggestedThreshold;
    }
}
