package com.openforge.toolrelay.agent.channel;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.toolrelay.llm.model.Attachment;

/**
 * The visible output of one request: answer text, answer attachments,
 * progress stages and the final state blob.
 *
 * Implementations must tolerate calls from tool worker threads.
 */
public interface ResponseChannel {

    void appendContent(String text);

    void addAttachment(Attachment attachment);

    Stage openStage(String name);

    /** Emits the state the client stores and sends back with its next request. */
    void setState(JsonNode state);
}
