package com.openforge.toolrelay.tool.deployment;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * agent:
 *   tools:
 *     image-generation:
 *       enabled: true
 *       endpoint: http://localhost:8080
 *       deployment-name: dall-e-3
 *       api-key:                  # used when the request carries no key of its own
 */
@ConfigurationProperties(prefix = "agent.tools.image-generation")
public record ImageGenerationProperties(
        @DefaultValue("false")    boolean enabled,
        @DefaultValue("http://localhost:8080") String endpoint,
        @DefaultValue("dall-e-3") String deploymentName,
        String apiKey,
        @DefaultValue("120")      int timeoutSeconds
) {}
