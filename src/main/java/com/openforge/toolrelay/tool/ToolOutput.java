package com.openforge.toolrelay.tool;

import com.openforge.toolrelay.llm.model.Message;
import com.openforge.toolrelay.llm.model.ToolCall;

/**
 * What a tool hands back: either plain text or a complete tool message
 * (for tools that also return attachments).
 */
public record ToolOutput(String text, Message message) {

    public static ToolOutput ofText(String text) {
        return new ToolOutput(text, null);
    }

    public static ToolOutput ofMessage(Message message) {
        return new ToolOutput(null, message);
    }

    /**
     * The tool-role message answering {@code call}.  A message supplied by
     * the tool keeps its content and custom content, but role, call id and
     * name always come from the call it answers.
     */
    public Message toMessage(ToolCall call) {
        if (message == null) {
            return Message.toolResult(call.id(), call.name(), text == null ? "" : text);
        }
        return Message.builder()
                .role(Message.ROLE_TOOL)
                .toolCallId(call.id())
                .name(call.name())
                .content(message.content() == null ? "" : message.content())
                .customContent(message.customContent())
                .build();
    }
}
