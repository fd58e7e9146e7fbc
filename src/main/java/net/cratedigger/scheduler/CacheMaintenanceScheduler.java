package net.cratedigger.scheduler;

import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import net.cratedigger.domain.recommendation.Recommendation;
import net.cratedigger.support.cache.BoundedCache;
import net.cratedigger.support.cache.CacheStatistics;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Sweeps expired entries out of the recommendation result cache.
 */
@Component
@Slf4j
public class CacheMaintenanceScheduler {

    private final BoundedCache<String, List<Recommendation>> resultCache;

    public CacheMaintenanceScheduler(BoundedCache<String, List<Recommendation>> resultCache) {
        this.resultCache = resultCache;
    }

    @Scheduled(fixedDelayString = "${cratedigger.cache.sweep-interval:PT1M}",
               initialDelayString = "${cratedigger.cache.sweep-interval:PT1M}")
    public void sweepExpiredEntries() {
        int removed = resultCache.cleanupExpired();
        if (removed > 0) {
            CacheStatistics stats = resultCache.statistics();
            log.info("Cache {} swept {} expired entries; size={}/{} hitRate={}",
                stats.name(), removed, stats.size(), stats.maxSize(), String.format(Locale.ROOT, "%.2f", stats.hitRate()));
        } else {
            log.debug("Cache {} sweep found nothing expired", resultCache.name());
        }
    }
}
