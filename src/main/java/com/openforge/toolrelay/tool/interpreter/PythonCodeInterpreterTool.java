package com.openforge.toolrelay.tool.interpreter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.openforge.toolrelay.agent.channel.Stage;
import com.openforge.toolrelay.llm.model.Attachment;
import com.openforge.toolrelay.tool.AgentTool;
import com.openforge.toolrelay.tool.ToolCallContext;
import com.openforge.toolrelay.tool.ToolOutput;
import com.openforge.toolrelay.tool.mcp.McpClient;
import com.openforge.toolrelay.tool.mcp.McpResource;
import com.openforge.toolrelay.tool.mcp.McpToolDescriptor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs Python code on a code-interpreter MCP server.
 *
 * The stage shows the code as a python block and the session it runs in,
 * instead of the raw JSON arguments.  The execution result is JSON:
 *
 *   { "success": …, "output": ["…"], "error": …, "session_id": …,
 *     "files": [ { "name": …, "mime_type": …, "uri": … } ] }
 *
 * Each output entry is cut to {@value #OUTPUT_LIMIT} characters before the
 * result goes back to the model.  Files are read from the server, uploaded
 * to DIAL and attached to both the stage and the visible answer.
 */
@Slf4j
public class PythonCodeInterpreterTool implements AgentTool {

    static final int    OUTPUT_LIMIT = 200;
    static final String FILES_SHOWN  =
            "Generated files have been provided to user, DON'T include links to them in response!";

    private static final String DEFAULT_MIME_TYPE = "application/octet-stream";

    private final McpClient         client;
    private final McpToolDescriptor descriptor;
    private final DialFileStorage   fileStorage;
    private final ObjectMapper      objectMapper;

    public PythonCodeInterpreterTool(McpClient client,
                                     McpToolDescriptor descriptor,
                                     DialFileStorage fileStorage,
                                     ObjectMapper objectMapper) {
        this.client       = client;
        this.descriptor   = descriptor;
        this.fileStorage  = fileStorage;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return descriptor.name();
    }

    @Override
    public String description() {
        return descriptor.description();
    }

    @Override
    public JsonNode parameters() {
        return descriptor.inputSchema();
    }

    @Override
    public boolean showInStage() {
        return false;
    }

    @Override
    public ToolOutput execute(ToolCallContext context) throws Exception {
        JsonNode arguments = context.arguments(objectMapper);
        JsonNode code = arguments.path("code");
        if (!code.isTextual()) {
            throw new IllegalArgumentException("Missing required argument: code");
        }
        long sessionId = arguments.path("session_id").asLong(0);

        Stage stage = context.stage();
        stage.appendContent("## Request arguments: \n");
        stage.appendContent("```python\n" + code.asText() + "\n```\n");
        stage.appendContent(sessionId != 0
                ? "**session_id**: " + sessionId + "\n\r"
                : "New session will be created\n");
        stage.appendContent("## Response: \n");

        String content = client.callTool(name(), arguments);
        if (content == null) {
            throw new IllegalStateException("Interpreter returned no result");
        }
        JsonNode parsed = objectMapper.readTree(content);
        if (!parsed.isObject()) {
            throw new IllegalStateException("Interpreter returned an unexpected result: " + content);
        }
        ObjectNode result = (ObjectNode) parsed;

        JsonNode files = result.path("files");
        if (files.isArray() && !files.isEmpty()) {
            for (JsonNode file : files) {
                Attachment attachment = publish(file, context.apiKey());
                stage.addAttachment(attachment);
                context.channel().addAttachment(attachment);
            }
            result.put("instructions", FILES_SHOWN);
        }
        capOutput(result.path("output"));

        stage.appendContent("```json\n\r" + objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result)
                + "\n\r```\n\r");
        return ToolOutput.ofText(objectMapper.writeValueAsString(result));
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private Attachment publish(JsonNode file, String apiKey) throws Exception {
        String fileName = file.path("name").asText("");
        String uri = file.path("uri").asText("");
        if (fileName.isBlank() || uri.isBlank()) {
            throw new IllegalStateException("Interpreter listed a file without name or uri: " + file);
        }
        McpResource resource = client.readResource(uri);
        String mimeType = file.path("mime_type").asText(
                resource.mimeType() != null ? resource.mimeType() : DEFAULT_MIME_TYPE);

        log.debug("[PyInterpreter] Publishing {} ({}) from {}", fileName, mimeType, uri);
        return fileStorage.upload(fileName, mimeType, resource.bytes(), apiKey);
    }

    private static void capOutput(JsonNode output) {
        if (!output.isArray()) {
            return;
        }
        ArrayNode entries = (ArrayNode) output;
        for (int i = 0; i < entries.size(); i++) {
            JsonNode entry = entries.get(i);
            if (entry.isTextual() && entry.asText().length() > OUTPUT_LIMIT) {
                entries.set(i, TextNode.valueOf(entry.asText().substring(0, OUTPUT_LIMIT)));
            }
        }
    }
}
