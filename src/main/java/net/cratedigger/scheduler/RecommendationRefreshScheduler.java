package net.cratedigger.scheduler;

import lombok.extern.slf4j.Slf4j;
import net.cratedigger.adapters.library.JsonLibraryCatalog;
import net.cratedigger.config.RecommendationProperties;
import net.cratedigger.service.pipeline.PipelineRequest;
import net.cratedigger.service.pipeline.PipelineResult;
import net.cratedigger.service.pipeline.RecommendationPipeline;
import net.cratedigger.service.provider.RecommendationProviderException;
import net.cratedigger.util.LoggingUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically reloads the library and runs the pipeline with configured defaults
 * so new suggestions land in the result cache and the review queue without a request.
 *
 * <p>Disabled unless {@code cratedigger.refresh.enabled=true}.</p>
 */
@Component
@Slf4j
public class RecommendationRefreshScheduler {

    private final RecommendationPipeline pipeline;
    private final RecommendationProperties properties;
    private final JsonLibraryCatalog libraryCatalog;
    private final boolean enabled;

    public RecommendationRefreshScheduler(RecommendationPipeline pipeline,
                                          RecommendationProperties properties,
                                          JsonLibraryCatalog libraryCatalog,
                                          @Value("${cratedigger.refresh.enabled:false}") boolean enabled) {
        this.pipeline = pipeline;
        this.properties = properties;
        this.libraryCatalog = libraryCatalog;
        this.enabled = enabled;
    }

    @Scheduled(fixedDelayString = "${cratedigger.refresh.interval:PT6H}",
               initialDelayString = "${cratedigger.refresh.interval:PT6H}")
    public void refresh() {
        if (!enabled) {
            log.debug("Scheduled recommendation refresh is disabled");
            return;
        }
        int entries = libraryCatalog.reload();
        log.info("Starting scheduled recommendation refresh over {} library entries", entries);
        try {
            PipelineResult result = pipeline.run(PipelineRequest.from(properties));
            log.info("Scheduled refresh delivered {} recommendations ({} filtered, cacheHit={})",
                result.recommendations().size(), result.filtered().size(), result.cacheHit());
        } catch (RecommendationProviderException failure) {
            LoggingUtils.warn(log, failure, "Scheduled recommendation refresh failed ({})", failure.errorCode());
        }
    }
}
