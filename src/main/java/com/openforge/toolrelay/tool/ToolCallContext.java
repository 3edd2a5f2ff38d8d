package com.openforge.toolrelay.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.toolrelay.agent.channel.ResponseChannel;
import com.openforge.toolrelay.agent.channel.Stage;
import com.openforge.toolrelay.llm.model.ToolCall;

/**
 * Everything one tool execution gets to see.
 *
 * @param toolCall       the finished call (raw JSON arguments)
 * @param apiKey         per-request credential, may be null
 * @param conversationId conversation the call belongs to
 * @param stage          progress section opened for this call
 * @param channel        the visible answer, for tools that show their output directly
 */
public record ToolCallContext(
        ToolCall toolCall,
        String apiKey,
        String conversationId,
        Stage stage,
        ResponseChannel channel
) {

    /** Parses the call's arguments; blank arguments mean an empty object. */
    public JsonNode arguments(ObjectMapper objectMapper) throws JsonProcessingException {
        String raw = toolCall.arguments();
        if (raw == null || raw.isBlank()) {
            return objectMapper.createObjectNode();
        }
        return objectMapper.readTree(raw);
    }
}
