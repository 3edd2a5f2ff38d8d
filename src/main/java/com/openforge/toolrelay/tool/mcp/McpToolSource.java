package com.openforge.toolrelay.tool.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.toolrelay.tool.AgentTool;
import com.openforge.toolrelay.tool.ToolSource;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Connects to every configured MCP server and turns its remote tools into
 * {@link McpTool}s.  A server that cannot be reached is skipped with a
 * warning; the remaining tools are still offered.
 */
@Slf4j
@Component
public class McpToolSource implements ToolSource {

    private final McpProperties properties;
    private final HttpClient    httpClient;
    private final ObjectMapper  objectMapper;

    private final List<McpClient> clients = new CopyOnWriteArrayList<>();

    public McpToolSource(McpProperties properties, HttpClient httpClient, ObjectMapper objectMapper) {
        this.properties   = properties;
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<AgentTool> loadTools() {
        List<AgentTool> tools = new ArrayList<>();
        for (McpProperties.Server server : properties.servers()) {
            tools.addAll(connect(server));
        }
        return tools;
    }

    @PreDestroy
    public void closeAll() {
        clients.forEach(McpClient::close);
        clients.clear();
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private List<AgentTool> connect(McpProperties.Server server) {
        McpClient client = createClient(server);
        try {
            client.connect();
            List<AgentTool> tools = new ArrayList<>();
            for (McpToolDescriptor descriptor : client.listTools()) {
                tools.add(new McpTool(client, descriptor, objectMapper));
            }
            clients.add(client);
            return tools;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[MCP:{}] Interrupted while connecting, skipping server", server.name());
        } catch (IOException | McpClient.McpException | RuntimeException e) {
            log.warn("[MCP:{}] Failed to connect to {}, skipping server: {}",
                    server.name(), server.url(), e.getMessage());
        }
        client.close();
        return List.of();
    }

    McpClient createClient(McpProperties.Server server) {
        return new McpClient(server.name(), server.url(), httpClient, objectMapper,
                Duration.ofSeconds(properties.timeoutSeconds()));
    }
}
