package com.openforge.toolrelay.agent;

import com.openforge.toolrelay.llm.model.Message;

import java.util.List;

/**
 * One user request as received from the client.
 *
 * @param conversationId identifies the conversation in logs, events and tool calls
 * @param apiKey         per-request credential; null means the configured provider key
 * @param messages       the visible conversation, oldest first
 */
public record AgentRequest(
        String conversationId,
        String apiKey,
        List<Message> messages
) {

    public AgentRequest {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }
}
