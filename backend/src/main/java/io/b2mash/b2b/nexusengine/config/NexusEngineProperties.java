package io.b2mash.b2b.nexusengine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Engine settings.
 *
 * @param parallelism number of jurisdictions evaluated concurrently
 * @param packLocation resource pattern of the jurisdiction packs to load
 */
@ConfigurationProperties(prefix = "nexus.engine")
public record NexusEngineProperties(int parallelism, String packLocation) {}
