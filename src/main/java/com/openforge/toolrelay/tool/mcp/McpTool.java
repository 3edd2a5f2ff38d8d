package com.openforge.toolrelay.tool.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.toolrelay.tool.AgentTool;
import com.openforge.toolrelay.tool.ToolCallContext;
import com.openforge.toolrelay.tool.ToolOutput;

/**
 * Exposes one remote MCP tool to the model.  Name, description and schema
 * come straight from the server's tools/list entry.
 */
public class McpTool implements AgentTool {

    static final String NO_OUTPUT = "(no output)";

    private final McpClient         client;
    private final McpToolDescriptor descriptor;
    private final ObjectMapper      objectMapper;

    public McpTool(McpClient client, McpToolDescriptor descriptor, ObjectMapper objectMapper) {
        this.client       = client;
        this.descriptor   = descriptor;
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
    public ToolOutput execute(ToolCallContext context) throws Exception {
        JsonNode arguments = context.arguments(objectMapper);
        String content = client.callTool(name(), arguments);
        if (content == null || content.isEmpty()) {
            content = NO_OUTPUT;
        }
        context.stage().appendContent(content);
        return ToolOutput.ofText(content);
    }
}
