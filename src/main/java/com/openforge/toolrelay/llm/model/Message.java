package com.openforge.toolrelay.llm.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;

import java.util.List;

/**
 * A single entry in the LLM conversation.
 *
 * role variants:
 *   "system"    : hidden instructions, always first
 *   "user"      : human turn
 *   "assistant" : model reply; may carry tool_calls instead of (or next to) content
 *   "tool"      : result of one tool call, linked back by tool_call_id
 *
 * Null fields are omitted on the wire, so a serialized history never carries
 * "content": null placeholders.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Message(
        @NotBlank(message = "message role must not be blank")
        String role,

        /** Text content. Null for assistant messages that only contain tool_calls. */
        String content,

        /** Attachments and opaque state riding along with the message. */
        CustomContent customContent,

        /** Present only in assistant messages that request tool execution. */
        List<ToolCall> toolCalls,

        /** Present only in tool-result messages; must match the originating ToolCall id. */
        String toolCallId,

        /** Tool name, present only in tool-result messages. */
        String name
) {

    public static final String ROLE_SYSTEM    = "system";
    public static final String ROLE_USER      = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_TOOL      = "tool";

    public Message {
        toolCalls = toolCalls == null ? null : List.copyOf(toolCalls);
    }

    // ── Static factory helpers ──────────────────────────────────────────────

    public static Message system(String content) {
        return Message.builder().role(ROLE_SYSTEM).content(content).build();
    }

    public static Message user(String content) {
        return Message.builder().role(ROLE_USER).content(content).build();
    }

    public static Message assistantText(String content) {
        return Message.builder().role(ROLE_ASSISTANT).content(content).build();
    }

    public static Message assistant(String content, List<ToolCall> toolCalls) {
        return Message.builder().role(ROLE_ASSISTANT).content(content).toolCalls(toolCalls).build();
    }

    public static Message toolResult(String toolCallId, String toolName, String result) {
        return Message.builder()
                .role(ROLE_TOOL)
                .toolCallId(toolCallId)
                .name(toolName)
                .content(result)
                .build();
    }

    // ── Derived views ───────────────────────────────────────────────────────

    @JsonIgnore
    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    /** The persisted state carried in custom_content, or null. */
    @JsonIgnore
    public JsonNode state() {
        return customContent == null ? null : customContent.state();
    }

    /** Copy of this message with the given custom content. */
    public Message withCustomContent(CustomContent newCustomContent) {
        return new Message(role, content, newCustomContent, toolCalls, toolCallId, name);
    }

    /** Copy of this message with any persisted state removed; attachments are kept. */
    public Message withoutState() {
        if (customContent == null || customContent.state() == null) {
            return this;
        }
        CustomContent stripped = customContent.attachments() == null || customContent.attachments().isEmpty()
                ? null
                : new CustomContent(customContent.attachments(), null);
        return withCustomContent(stripped);
    }
}
