package com.openforge.toolrelay.tool.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.toolrelay.agent.channel.RecordingResponseChannel;
import com.openforge.toolrelay.agent.channel.RecordingResponseChannel.RecordingStage;
import com.openforge.toolrelay.llm.model.Message;
import com.openforge.toolrelay.llm.model.ToolCall;
import com.openforge.toolrelay.tool.GuardedTool;
import com.openforge.toolrelay.tool.ToolCallContext;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class McpToolTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final McpClient client = mock(McpClient.class);
    private final RecordingResponseChannel channel = new RecordingResponseChannel();

    private McpTool tool() throws Exception {
        JsonNode schema = objectMapper.readTree("{\"type\":\"object\",\"properties\":{\"query\":{\"type\":\"string\"}}}");
        return new McpTool(client, new McpToolDescriptor("search", "Web search", schema), objectMapper);
    }

    private ToolCallContext context(String arguments) {
        return new ToolCallContext(ToolCall.function("c1", "search", arguments), null, "conv",
                channel.openStage("search"), channel);
    }

    @Test
    void definition_shouldExposeRemoteDescriptor() throws Exception {
        McpTool tool = tool();

        assertEquals("search", tool.definition().function().name());
        assertEquals("Web search", tool.definition().function().description());
        assertSame(tool.parameters(), tool.definition().function().parameters());
    }

    @Test
    void execute_shouldForwardArgumentsAndMirrorResultIntoStage() throws Exception {
        when(client.callTool(eq("search"), any())).thenReturn("1. Java");

        String text = tool().execute(context("{\"query\":\"java\"}")).text();

        ArgumentCaptor<JsonNode> captor = ArgumentCaptor.forClass(JsonNode.class);
        verify(client).callTool(eq("search"), captor.capture());
        assertEquals("java", captor.getValue().path("query").asText());
        assertEquals("1. Java", text);
        assertEquals("1. Java", channel.stages().get(0).content());
    }

    @Test
    void execute_shouldReportPlaceholderForEmptyResult() throws Exception {
        when(client.callTool(eq("search"), any())).thenReturn(null);

        assertEquals(McpTool.NO_OUTPUT, tool().execute(context("")).text());
    }

    @Test
    void call_shouldTurnRemoteFailureIntoErrorResult() throws Exception {
        when(client.callTool(eq("search"), any())).thenThrow(new McpClient.McpException(-1, "rate limited"));
        GuardedTool guarded = new GuardedTool(tool());
        ToolCallContext context = context("{}");

        Message result = guarded.call(context);

        assertEquals("Error during tool execution: rate limited", result.content());
        assertTrue(GuardedTool.isError(result));
        assertEquals(RecordingStage.Status.OPEN, channel.stages().get(0).status());
    }
}
