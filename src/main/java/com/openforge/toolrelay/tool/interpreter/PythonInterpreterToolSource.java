package com.openforge.toolrelay.tool.interpreter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.toolrelay.tool.AgentTool;
import com.openforge.toolrelay.tool.ToolSource;
import com.openforge.toolrelay.tool.mcp.McpClient;
import com.openforge.toolrelay.tool.mcp.McpToolDescriptor;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Connects to the code-interpreter MCP server and offers its code-execution
 * tool (configured by name) as a {@link PythonCodeInterpreterTool}.  The
 * server's other tools are not exposed.  An unreachable server, or one
 * without that tool, is skipped with a warning.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "agent.tools.python-interpreter", name = "enabled", havingValue = "true")
public class PythonInterpreterToolSource implements ToolSource {

    static final String SERVER_NAME = "python-interpreter";

    private final PythonInterpreterProperties properties;
    private final HttpClient                  httpClient;
    private final ObjectMapper                objectMapper;

    private volatile McpClient client;

    public PythonInterpreterToolSource(PythonInterpreterProperties properties,
                                       HttpClient httpClient,
                                       ObjectMapper objectMapper) {
        this.properties   = properties;
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<AgentTool> loadTools() {
        McpClient candidate = createClient();
        try {
            candidate.connect();
            Optional<McpToolDescriptor> executeTool = candidate.listTools().stream()
                    .filter(descriptor -> properties.toolName().equals(descriptor.name()))
                    .findFirst();
            if (executeTool.isPresent()) {
                client = candidate;
                return List.of(new PythonCodeInterpreterTool(
                        candidate, executeTool.get(), createFileStorage(), objectMapper));
            }
            log.warn("[MCP:{}] Server {} has no `{}` tool, interpreter disabled",
                    SERVER_NAME, properties.url(), properties.toolName());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[MCP:{}] Interrupted while connecting, interpreter disabled", SERVER_NAME);
        } catch (IOException | McpClient.McpException | RuntimeException e) {
            log.warn("[MCP:{}] Failed to connect to {}, interpreter disabled: {}",
                    SERVER_NAME, properties.url(), e.getMessage());
        }
        candidate.close();
        return List.of();
    }

    @PreDestroy
    public void close() {
        McpClient current = client;
        client = null;
        if (current != null) {
            current.close();
        }
    }

    McpClient createClient() {
        return new McpClient(SERVER_NAME, properties.url(), httpClient, objectMapper,
                Duration.ofSeconds(properties.timeoutSeconds()));
    }

    DialFileStorage createFileStorage() {
        return new DialFileStorage(httpClient, objectMapper, properties.filesEndpoint(), properties.apiKey(),
                Duration.ofSeconds(properties.timeoutSeconds()));
    }
}
