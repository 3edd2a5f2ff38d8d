package com.openforge.toolrelay.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.toolrelay.agent.channel.ResponseChannel;
import com.openforge.toolrelay.agent.channel.Stage;
import com.openforge.toolrelay.llm.model.Attachment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Writes the visible response as chat-completion chunks over SSE.
 *
 * Every event is one chunk with a single choice whose delta carries either
 * text, stage updates, attachments or the final state:
 *
 *   data: {"choices":[{"index":0,"delta":{"role":"assistant"}}]}
 *   data: {"choices":[{"index":0,"delta":{"content":"Let me check"}}]}
 *   data: {"choices":[{"index":0,"delta":{"custom_content":{"stages":[{"index":0,"name":"get_weather"}]}}}]}
 *   data: {"choices":[{"index":0,"delta":{"custom_content":{"state":{…}}},"finish_reason":"stop"}]}
 *   data: [DONE]
 *
 * Sends are serialized, since tools write to their stages from worker
 * threads.  A client that went away only stops delivery; the request loop
 * is never interrupted by a failed send.
 */
@Slf4j
public class SseResponseChannel implements ResponseChannel {

    static final String DONE = "[DONE]";

    private final SseEmitter    emitter;
    private final ObjectMapper  objectMapper;
    private final String        conversationId;
    private final AtomicInteger stageIndex = new AtomicInteger();

    private volatile boolean disconnected;

    public SseResponseChannel(SseEmitter emitter, ObjectMapper objectMapper, String conversationId) {
        this.emitter        = emitter;
        this.objectMapper   = objectMapper;
        this.conversationId = conversationId;
    }

    // ── Response lifecycle ───────────────────────────────────────────────────

    public void begin() {
        ObjectNode delta = objectMapper.createObjectNode().put("role", "assistant");
        sendDelta(delta, null);
    }

    public void complete() {
        sendRaw(DONE);
        emitter.complete();
    }

    public void fail(Throwable error) {
        ObjectNode body = objectMapper.createObjectNode();
        body.putObject("error").put("message", String.valueOf(error.getMessage()));
        send(SseEmitter.event().name("error").data(toJson(body)));
        emitter.complete();
    }

    // ── ResponseChannel ──────────────────────────────────────────────────────

    @Override
    public void appendContent(String text) {
        if (text == null || text.isEmpty()) {
            return;
        }
        sendDelta(objectMapper.createObjectNode().put("content", text), null);
    }

    @Override
    public void addAttachment(Attachment attachment) {
        ObjectNode delta = objectMapper.createObjectNode();
        delta.putObject("custom_content").putArray("attachments").add(objectMapper.valueToTree(attachment));
        sendDelta(delta, null);
    }

    @Override
    public Stage openStage(String name) {
        SseStage stage = new SseStage(stageIndex.getAndIncrement(), name);
        ObjectNode update = stageUpdate(stage.index);
        update.put("name", name);
        sendStage(update);
        return stage;
    }

    @Override
    public void setState(JsonNode state) {
        ObjectNode delta = objectMapper.createObjectNode();
        delta.putObject("custom_content").set("state", state);
        sendDelta(delta, "stop");
    }

    // ── Wire helpers ─────────────────────────────────────────────────────────

    private ObjectNode stageUpdate(int index) {
        return objectMapper.createObjectNode().put("index", index);
    }

    private void sendStage(ObjectNode stageUpdate) {
        ObjectNode delta = objectMapper.createObjectNode();
        ArrayNode stages = delta.putObject("custom_content").putArray("stages");
        stages.add(stageUpdate);
        sendDelta(delta, null);
    }

    private void sendDelta(ObjectNode delta, String finishReason) {
        ObjectNode chunk = objectMapper.createObjectNode();
        chunk.put("object", "chat.completion.chunk");
        ObjectNode choice = chunk.putArray("choices").addObject();
        choice.put("index", 0);
        choice.set("delta", delta);
        if (finishReason != null) {
            choice.put("finish_reason", finishReason);
        }
        sendRaw(toJson(chunk));
    }

    private void sendRaw(String data) {
        send(SseEmitter.event().data(data));
    }

    private synchronized void send(SseEmitter.SseEventBuilder event) {
        if (disconnected) {
            return;
        }
        try {
            emitter.send(event);
        } catch (IOException | IllegalStateException e) {
            disconnected = true;
            log.warn("[SSE:{}] Client no longer receiving: {}", conversationId, e.getMessage());
        }
    }

    private String toJson(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize SSE chunk", e);
        }
    }

    // ── Stage ────────────────────────────────────────────────────────────────

    private final class SseStage implements Stage {

        private final int    index;
        private final String name;
        private final AtomicBoolean finished = new AtomicBoolean();

        private SseStage(int index, String name) {
            this.index = index;
            this.name  = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public void appendContent(String text) {
            if (finished.get() || text == null || text.isEmpty()) {
                return;
            }
            sendStage(stageUpdate(index).put("content", text));
        }

        @Override
        public void addAttachment(Attachment attachment) {
            if (finished.get() || attachment == null) {
                return;
            }
            ObjectNode update = stageUpdate(index);
            update.putArray("attachments").add(objectMapper.valueToTree(attachment));
            sendStage(update);
        }

        @Override
        public void close() {
            finish("completed");
        }

        @Override
        public void fail() {
            finish("failed");
        }

        private void finish(String status) {
            if (finished.compareAndSet(false, true)) {
                sendStage(stageUpdate(index).put("status", status));
            }
        }
    }
}
