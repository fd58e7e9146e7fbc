package net.cratedigger.service.pipeline;

import java.util.Objects;
import net.cratedigger.config.RecommendationProperties;
import org.springframework.stereotype.Component;

/**
 * Reads the version from {@code cratedigger.recommendations.config-version}.
 */
@Component
public class PropertiesConfigVersionProvider implements ConfigVersionProvider {

    private final RecommendationProperties properties;

    public PropertiesConfigVersionProvider(RecommendationProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
    }

    @Override
    public String configVersion() {
        String version = properties.getConfigVersion();
        return version == null ? "" : version.trim();
    }
}
