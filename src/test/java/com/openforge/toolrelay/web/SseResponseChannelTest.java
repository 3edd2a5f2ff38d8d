package com.openforge.toolrelay.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.toolrelay.agent.channel.Stage;
import com.openforge.toolrelay.llm.model.Attachment;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SseResponseChannelTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final RecordingEmitter emitter = new RecordingEmitter();
    private final SseResponseChannel channel = new SseResponseChannel(emitter, objectMapper, "conv-1");

    private JsonNode chunk(int i) throws Exception {
        return objectMapper.readTree(emitter.data(i));
    }

    private JsonNode delta(int i) throws Exception {
        return chunk(i).at("/choices/0/delta");
    }

    @Test
    void begin_shouldAnnounceAssistantRole() throws Exception {
        channel.begin();

        JsonNode first = chunk(0);
        assertEquals("chat.completion.chunk", first.path("object").asText());
        assertEquals(0, first.at("/choices/0/index").asInt());
        assertEquals("assistant", delta(0).path("role").asText());
    }

    @Test
    void appendContent_shouldSendTextDeltasAndSkipEmptyOnes() throws Exception {
        channel.appendContent("Hel");
        channel.appendContent("");
        channel.appendContent("lo");

        assertEquals(2, emitter.events.size());
        assertEquals("Hel", delta(0).path("content").asText());
        assertEquals("lo", delta(1).path("content").asText());
    }

    @Test
    void openStage_shouldNumberStagesAndReportLifecycle() throws Exception {
        Stage first = channel.openStage("search");
        Stage second = channel.openStage("weather");
        second.appendContent("sunny");
        first.close();
        second.fail();
        second.appendContent("ignored after finish");
        second.close();

        assertEquals(5, emitter.events.size());
        assertEquals("search", delta(0).at("/custom_content/stages/0/name").asText());
        assertEquals(1, delta(1).at("/custom_content/stages/0/index").asInt());
        assertEquals("sunny", delta(2).at("/custom_content/stages/0/content").asText());
        assertEquals(0, delta(3).at("/custom_content/stages/0/index").asInt());
        assertEquals("completed", delta(3).at("/custom_content/stages/0/status").asText());
        assertEquals("failed", delta(4).at("/custom_content/stages/0/status").asText());
    }

    @Test
    void addAttachment_shouldSendAttachmentDelta() throws Exception {
        channel.addAttachment(Attachment.ofUrl("image/png", "cat", "files/cat.png"));

        JsonNode attachment = delta(0).at("/custom_content/attachments/0");
        assertEquals("files/cat.png", attachment.path("url").asText());
        assertFalse(attachment.has("data"));
    }

    @Test
    void setState_shouldFinishChoiceWithState() throws Exception {
        channel.appendContent("answer");
        channel.setState(objectMapper.readTree("{\"tool_round_history\":[]}"));

        assertTrue(chunk(0).at("/choices/0/finish_reason").isMissingNode());
        assertEquals("stop", chunk(1).at("/choices/0/finish_reason").asText());
        assertTrue(delta(1).at("/custom_content/state/tool_round_history").isArray());
    }

    @Test
    void complete_shouldSendDoneMarkerAndCloseEmitter() {
        channel.complete();

        assertEquals(SseResponseChannel.DONE, emitter.data(0));
        assertTrue(emitter.completed);
    }

    @Test
    void fail_shouldSendNamedErrorEvent() throws Exception {
        channel.fail(new IllegalStateException("Max rounds (10) reached without final answer."));

        assertTrue(emitter.events.get(0).contains("event:error"));
        assertEquals("Max rounds (10) reached without final answer.",
                chunk(0).at("/error/message").asText());
        assertTrue(emitter.completed);
    }

    @Test
    void send_shouldStopQuietlyAfterClientDisconnects() {
        emitter.broken = true;

        channel.appendContent("lost");
        emitter.broken = false;
        channel.appendContent("also dropped");

        assertTrue(emitter.events.isEmpty());
        assertEquals(1, emitter.attempts);
    }

    /**
     * Captures the serialized events instead of writing to a response.
     */
    private static final class RecordingEmitter extends SseEmitter {

        private final List<String> events = new ArrayList<>();
        private volatile boolean completed;
        private volatile boolean broken;
        private int attempts;

        @Override
        public void send(SseEventBuilder builder) throws IOException {
            attempts++;
            if (broken) {
                throw new IOException("Broken pipe");
            }
            StringBuilder raw = new StringBuilder();
            for (DataWithMediaType part : builder.build()) {
                raw.append(part.getData());
            }
            events.add(raw.toString());
        }

        @Override
        public void complete() {
            completed = true;
        }

        /** The payload of the data line of the i-th event. */
        String data(int i) {
            for (String line : events.get(i).split("\n")) {
                if (line.startsWith("data:")) {
                    return line.substring("data:".length());
                }
            }
            throw new IllegalStateException("No data line in event " + i);
        }
    }
}
