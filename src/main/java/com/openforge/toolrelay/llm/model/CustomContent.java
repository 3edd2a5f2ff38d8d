package com.openforge.toolrelay.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * The "custom_content" extension of a message or a streamed delta.
 *
 * attachments : files and images shown next to the message text
 * state       : opaque structure the client stores and sends back with the
 *               next request (carries tool_round_history)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CustomContent(
        List<Attachment> attachments,
        JsonNode state
) {

    public static CustomContent ofState(JsonNode state) {
        return new CustomContent(null, state);
    }

    public static CustomContent ofAttachments(List<Attachment> attachments) {
        return new CustomContent(List.copyOf(attachments), null);
    }
}
