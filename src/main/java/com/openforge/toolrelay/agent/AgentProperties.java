package com.openforge.toolrelay.agent;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Loop limits and prompt, under "agent.orchestrator":
 *
 * agent:
 *   orchestrator:
 *     max-rounds: 10
 *     tool-timeout-seconds: 120
 *     system-prompt:            # optional, replaces the built-in prompt
 */
@ConfigurationProperties(prefix = "agent.orchestrator")
public record AgentProperties(
        @DefaultValue("10")  int maxRounds,
        @DefaultValue("120") int toolTimeoutSeconds,
        String systemPrompt
) {

    public AgentProperties {
        if (maxRounds < 1) {
            throw new IllegalArgumentException("agent.orchestrator.max-rounds must be at least 1");
        }
        if (toolTimeoutSeconds < 1) {
            throw new IllegalArgumentException("agent.orchestrator.tool-timeout-seconds must be at least 1");
        }
    }

    public String effectiveSystemPrompt() {
        return systemPrompt == null || systemPrompt.isBlank() ? SystemPrompt.DEFAULT : systemPrompt;
    }
}
