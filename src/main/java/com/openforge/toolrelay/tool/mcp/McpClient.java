package com.openforge.toolrelay.tool.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * JSON-RPC 2.0 client for a single MCP server over streamable HTTP.
 *
 * Lifecycle:
 *   1. initialize                 : handshake; the server may assign a session id
 *   2. notifications/initialized  : no response expected
 *   3. tools/list                 : remote tool descriptors
 *   4. tools/call                 : any number of times, from any thread
 *   5. resources/read             : files a tool produced, by resource uri
 *   6. close                      : ends the session (DELETE), best effort
 *
 * Every request is one POST.  The server answers either with a JSON body or
 * with a short SSE stream whose data lines carry the JSON-RPC response.
 *
 * Not a Spring bean; McpToolSource creates one per configured server.
 */
@Slf4j
public class McpClient implements Closeable {

    static final String SESSION_HEADER       = "Mcp-Session-Id";
    static final String MCP_PROTOCOL_VERSION = "2025-03-26";
    private static final String JSONRPC_VERSION = "2.0";

    private final String       serverName;
    private final URI          serverUri;
    private final HttpClient   httpClient;
    private final ObjectMapper objectMapper;
    private final Duration     timeout;

    private final AtomicInteger nextId = new AtomicInteger(1);
    private volatile String sessionId;

    public McpClient(String serverName,
                     String serverUrl,
                     HttpClient httpClient,
                     ObjectMapper objectMapper,
                     Duration timeout) {
        this.serverName   = serverName;
        this.serverUri    = URI.create(serverUrl);
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.timeout      = timeout;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /** Handshake.  Must succeed before tools are listed or called. */
    public void connect() throws IOException, InterruptedException, McpException {
        ObjectNode params = objectMapper.createObjectNode();
        params.put("protocolVersion", MCP_PROTOCOL_VERSION);
        params.putObject("capabilities");
        params.putObject("clientInfo")
                .put("name", "toolrelay")
                .put("version", "0.1.0");

        JsonNode result = request("initialize", params);
        log.info("[MCP:{}] Initialized: server={} session={}",
                serverName, result.path("serverInfo").path("name").asText("?"), sessionId);

        notify("notifications/initialized");
    }

    public List<McpToolDescriptor> listTools() throws IOException, InterruptedException, McpException {
        JsonNode result = request("tools/list", objectMapper.createObjectNode());
        JsonNode toolsNode = result.path("tools");

        List<McpToolDescriptor> tools = new ArrayList<>();
        for (JsonNode toolNode : toolsNode) {
            String name = toolNode.path("name").asText(null);
            if (name == null) {
                continue;
            }
            JsonNode schema = toolNode.has("inputSchema")
                    ? toolNode.get("inputSchema")
                    : objectMapper.createObjectNode().put("type", "object");
            tools.add(new McpToolDescriptor(name, toolNode.path("description").asText(""), schema));
        }
        log.info("[MCP:{}] Available tools: {}", serverName,
                tools.stream().map(McpToolDescriptor::name).toList());
        return List.copyOf(tools);
    }

    /**
     * Calls a remote tool.  Returns the first text content item, the JSON of
     * the first non-text item, or null when the result has no content.
     *
     * @throws McpException when the server reports a JSON-RPC error or sets isError
     */
    public String callTool(String name, JsonNode arguments)
            throws IOException, InterruptedException, McpException {
        ObjectNode params = objectMapper.createObjectNode();
        params.put("name", name);
        params.set("arguments", arguments == null ? objectMapper.createObjectNode() : arguments);

        JsonNode result = request("tools/call", params);
        JsonNode content = result.path("content");
        String first = content.isArray() && !content.isEmpty() ? describeContent(content.get(0)) : null;

        if (result.path("isError").asBoolean(false)) {
            throw new McpException(-1, first == null ? "MCP tool error" : first);
        }
        return first;
    }

    /**
     * Reads a resource published by the server.  Only the first content
     * item is returned, either as text or as a base64 blob.
     *
     * @throws McpException when the server reports an error or returns no contents
     */
    public McpResource readResource(String uri) throws IOException, InterruptedException, McpException {
        ObjectNode params = objectMapper.createObjectNode();
        params.put("uri", uri);

        JsonNode contents = request("resources/read", params).path("contents");
        if (!contents.isArray() || contents.isEmpty()) {
            throw new McpException(-32002, "No content in resource %s from %s".formatted(uri, serverName));
        }
        JsonNode first = contents.get(0);
        return new McpResource(
                first.path("uri").asText(uri),
                first.path("mimeType").asText(null),
                first.hasNonNull("text") ? first.get("text").asText() : null,
                first.hasNonNull("blob") ? first.get("blob").asText() : null);
    }

    public String serverName() {
        return serverName;
    }

    @Override
    public void close() {
        String session = sessionId;
        if (session == null) {
            return;
        }
        log.info("[MCP:{}] Closing session {}", serverName, session);
        HttpRequest request = HttpRequest.newBuilder(serverUri)
                .header(SESSION_HEADER, session)
                .timeout(timeout)
                .DELETE()
                .build();
        try {
            httpClient.send(request, HttpResponse.BodyHandlers.discarding());
        } catch (IOException e) {
            log.debug("[MCP:{}] Error ending session: {}", serverName, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            sessionId = null;
        }
    }

    // ── JSON-RPC ─────────────────────────────────────────────────────────────

    JsonNode request(String method, JsonNode params) throws IOException, InterruptedException, McpException {
        int id = nextId.getAndIncrement();
        ObjectNode message = objectMapper.createObjectNode();
        message.put("jsonrpc", JSONRPC_VERSION);
        message.put("id", id);
        message.put("method", method);
        message.set("params", params);

        String json = objectMapper.writeValueAsString(message);
        log.debug("[MCP:{}] → {}", serverName, json);

        HttpResponse<String> response = httpClient.send(post(json), HttpResponse.BodyHandlers.ofString());
        response.headers().firstValue(SESSION_HEADER).ifPresent(value -> sessionId = value);

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new McpException(response.statusCode(),
                    "HTTP %d from %s for %s".formatted(response.statusCode(), serverName, method));
        }

        JsonNode reply = findResponse(response, id);
        log.debug("[MCP:{}] ← {}", serverName, reply);

        JsonNode error = reply.get("error");
        if (error != null && !error.isNull()) {
            throw new McpException(error.path("code").asInt(-1),
                    error.path("message").asText("Unknown MCP error"));
        }
        JsonNode result = reply.get("result");
        return result == null ? objectMapper.createObjectNode() : result;
    }

    private void notify(String method) throws IOException, InterruptedException {
        ObjectNode message = objectMapper.createObjectNode();
        message.put("jsonrpc", JSONRPC_VERSION);
        message.put("method", method);

        String json = objectMapper.writeValueAsString(message);
        log.debug("[MCP:{}] → (notification) {}", serverName, json);
        HttpResponse<Void> response = httpClient.send(post(json), HttpResponse.BodyHandlers.discarding());
        if (response.statusCode() >= 400) {
            log.warn("[MCP:{}] Notification {} rejected with HTTP {}", serverName, method, response.statusCode());
        }
    }

    private HttpRequest post(String json) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(serverUri)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json, text/event-stream")
                .timeout(timeout)
                .POST(HttpRequest.BodyPublishers.ofString(json));
        String session = sessionId;
        if (session != null) {
            builder.header(SESSION_HEADER, session);
        }
        return builder.build();
    }

    /** Picks the JSON-RPC response with the given id out of a JSON or SSE body. */
    private JsonNode findResponse(HttpResponse<String> response, int id) throws McpException {
        String contentType = response.headers().firstValue("Content-Type").orElse("");
        String body = response.body() == null ? "" : response.body();
        try {
            if (!contentType.startsWith("text/event-stream")) {
                return objectMapper.readTree(body);
            }
            for (String line : body.split("\\R")) {
                if (!line.startsWith("data:")) {
                    continue;
                }
                JsonNode candidate = objectMapper.readTree(line.substring("data:".length()).trim());
                if (candidate.path("id").asInt(-1) == id) {
                    return candidate;
                }
            }
        } catch (JsonProcessingException e) {
            throw new McpException(-32700, "Unparsable response from %s: %s".formatted(serverName, e.getOriginalMessage()));
        }
        throw new McpException(-32603, "No response with id %d from %s".formatted(id, serverName));
    }

    private String describeContent(JsonNode item) throws JsonProcessingException {
        if ("text".equals(item.path("type").asText()) && item.has("text")) {
            return item.get("text").asText();
        }
        return objectMapper.writeValueAsString(item);
    }

    // ── Exception type ───────────────────────────────────────────────────────

    /**
     * Exception for MCP JSON-RPC errors and tool-reported failures.
     */
    public static class McpException extends Exception {

        private final int code;

        public McpException(int code, String message) {
            super(message);
            this.code = code;
        }

        public int getCode() {
            return code;
        }
    }
}
