package com.openforge.toolrelay.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.toolrelay.llm.model.Message;
import com.openforge.toolrelay.llm.model.ToolCall;

import java.util.ArrayList;
import java.util.List;

/**
 * The hidden tool rounds of one user request, in order:
 *
 *   assistant(tool_calls=[c1, c2]), tool(c1), tool(c2), assistant(tool_calls=[c3]), tool(c3), ...
 *
 * Append-only and owned by a single in-flight request.  At the end of the
 * request it is written into the response state under {@value #STATE_KEY}
 * so the client can send it back with the next request.
 */
public final class RoundHistory {

    public static final String STATE_KEY = "tool_round_history";

    private final List<Message> messages = new ArrayList<>();
    private int rounds;

    /**
     * Appends one complete round.  The results must answer the assistant's
     * tool calls one-to-one, in call order.
     */
    public void appendRound(Message assistant, List<Message> toolResults) {
        if (assistant == null || !assistant.hasToolCalls()) {
            throw new IllegalArgumentException("A round starts with an assistant message carrying tool calls");
        }
        List<ToolCall> calls = assistant.toolCalls();
        if (toolResults == null || toolResults.size() != calls.size()) {
            throw new IllegalArgumentException("Expected %d tool result(s), got %d"
                    .formatted(calls.size(), toolResults == null ? 0 : toolResults.size()));
        }
        for (int i = 0; i < calls.size(); i++) {
            String expectedId = calls.get(i).id();
            String actualId   = toolResults.get(i).toolCallId();
            if (expectedId == null ? actualId != null : !expectedId.equals(actualId)) {
                throw new IllegalArgumentException("Tool result %d answers call '%s', expected '%s'"
                        .formatted(i, actualId, expectedId));
            }
        }
        messages.add(assistant);
        messages.addAll(toolResults);
        rounds++;
    }

    /** Snapshot of the accumulated messages. */
    public List<Message> messages() {
        return List.copyOf(messages);
    }

    public int size() {
        return messages.size();
    }

    public int rounds() {
        return rounds;
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }

    /** {"tool_round_history": [...]}, null fields omitted. */
    public ObjectNode toState(ObjectMapper objectMapper) {
        ObjectNode state = objectMapper.createObjectNode();
        ArrayNode history = state.putArray(STATE_KEY);
        for (Message message : messages) {
            history.add(objectMapper.valueToTree(message));
        }
        return state;
    }

    /**
     * Reads the history persisted in a message state.  Missing or malformed
     * state yields an empty list.
     */
    public static List<Message> fromState(JsonNode state, ObjectMapper objectMapper) {
        if (state == null || !state.path(STATE_KEY).isArray()) {
            return List.of();
        }
        List<Message> restored = new ArrayList<>();
        for (JsonNode node : state.get(STATE_KEY)) {
            restored.add(objectMapper.convertValue(node, Message.class));
        }
        return List.copyOf(restored);
    }
}
