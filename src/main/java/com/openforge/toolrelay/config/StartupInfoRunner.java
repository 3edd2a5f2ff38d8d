package com.openforge.toolrelay.config;

import com.openforge.toolrelay.agent.AgentProperties;
import com.openforge.toolrelay.llm.LlmProperties;
import com.openforge.toolrelay.tool.mcp.McpProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Prints a structured startup summary after the application context is fully ready.
 *
 * Reported:
 *   - Runtime: Java version, server port
 *   - LLM providers: primary + fallback config (API key is masked)
 *   - Loop limits: max rounds, tool timeout
 *   - Tools: image generation and code interpreter switches, configured MCP servers (contacted lazily)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final LlmProperties   llmProperties;
    private final AgentProperties agentProperties;
    private final McpProperties   mcpProperties;
    private final Environment     env;

    @Override
    public void run(ApplicationArguments args) {
        String port        = env.getProperty("server.port", "8080");
        String javaVersion = System.getProperty("java.version");
        String imageTool   = env.getProperty("agent.tools.image-generation.enabled", "false");
        String interpreter = env.getProperty("agent.tools.python-interpreter.enabled", "false");

        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║                ToolRelay Startup Summary                 ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  LLM Providers                                           ║
                ║    Primary        : {}
                ║    Fallback       : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Orchestrator                                            ║
                ║    Max rounds     : {}
                ║    Tool timeout   : {}s
                ╠══════════════════════════════════════════════════════════╣
                ║  Tools                                                   ║
                ║    Image gen      : {}
                ║    Python interp. : {}
                ║    MCP servers    : {}
                ╚══════════════════════════════════════════════════════════╝
                """,
                port,
                javaVersion,
                describe(llmProperties.primary()),
                describe(llmProperties.fallback()),
                agentProperties.maxRounds(),
                agentProperties.toolTimeoutSeconds(),
                imageTool,
                interpreter,
                mcpProperties.servers().isEmpty() ? "(none)" : mcpProperties.servers()
        );
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static String describe(LlmProperties.ProviderConfig config) {
        if (config == null || config.baseUrl() == null || config.baseUrl().isBlank()) {
            return "(not configured)";
        }
        return "%s  [%s]  key=%s".formatted(config.name(), config.model(), maskKey(config.apiKey()));
    }

    /**
     * Masks an API key: shows first 6 chars + "..." + last 4 chars.
     * Returns "(not set)" if the key looks like a placeholder.
     */
    static String maskKey(String key) {
        if (key == null || key.isBlank() || key.startsWith("sk-placeholder")) {
            return "(not set)";
        }
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}
