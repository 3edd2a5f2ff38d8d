package com.openforge.toolrelay.tool.mcp;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/**
 * Remote MCP servers whose tools are offered to the model.
 *
 * agent:
 *   tools:
 *     mcp:
 *       timeout-seconds: 60
 *       servers:
 *         - name: ddg-search
 *           url: http://localhost:8051/mcp
 */
@ConfigurationProperties(prefix = "agent.tools.mcp")
public record McpProperties(
        List<Server> servers,
        @DefaultValue("60") int timeoutSeconds
) {

    public McpProperties {
        servers = servers == null ? List.of() : List.copyOf(servers);
    }

    public record Server(String name, String url) {

        @Override
        public String toString() {
            return name + "=" + url;
        }
    }
}
