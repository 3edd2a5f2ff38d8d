package com.openforge.toolrelay.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Externalised LLM provider configuration.
 *
 * Reads from application.yml under the "agent.llm" prefix:
 *
 * agent:
 *   llm:
 *     primary:
 *       name: dial
 *       base-url: http://localhost:8080/openai/deployments/gpt-4o
 *       api-key: dial-...
 *       model: gpt-4o
 *       timeout-seconds: 120
 *     fallback:
 *       name: deepseek-chat
 *       base-url: https://api.deepseek.com/v1
 *       api-key: sk-...
 *       model: deepseek-chat
 *       timeout-seconds: 120
 */
@ConfigurationProperties(prefix = "agent.llm")
public record LlmProperties(
        ProviderConfig primary,
        ProviderConfig fallback
) {

    public record ProviderConfig(
            String name,
            String baseUrl,
            String apiKey,
            String model,
            @DefaultValue("120") int timeoutSeconds
    ) {

        public ProviderConfig withApiKey(String newApiKey) {
            return new ProviderConfig(name, baseUrl, newApiKey, model, timeoutSeconds);
        }
    }
}
