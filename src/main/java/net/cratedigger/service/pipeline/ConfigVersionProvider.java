package net.cratedigger.service.pipeline;

/**
 * Supplies the configuration version mixed into result cache keys.
 */
@FunctionalInterface
public interface ConfigVersionProvider {

    String configVersion();
}
