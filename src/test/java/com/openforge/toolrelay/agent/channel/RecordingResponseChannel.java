package com.openforge.toolrelay.agent.channel;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.toolrelay.llm.model.Attachment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * In-memory channel that records everything written to it.
 */
public class RecordingResponseChannel implements ResponseChannel {

    private final StringBuffer content = new StringBuffer();
    private final List<Attachment> attachments = Collections.synchronizedList(new ArrayList<>());
    private final List<RecordingStage> stages = Collections.synchronizedList(new ArrayList<>());
    private volatile JsonNode state;

    @Override
    public void appendContent(String text) {
        content.append(text);
    }

    @Override
    public void addAttachment(Attachment attachment) {
        attachments.add(attachment);
    }

    @Override
    public Stage openStage(String name) {
        RecordingStage stage = new RecordingStage(name);
        stages.add(stage);
        return stage;
    }

    @Override
    public void setState(JsonNode state) {
        this.state = state;
    }

    public String content() {
        return content.toString();
    }

    public List<Attachment> attachments() {
        return List.copyOf(attachments);
    }

    public List<RecordingStage> stages() {
        return List.copyOf(stages);
    }

    public JsonNode state() {
        return state;
    }

    public static class RecordingStage implements Stage {

        public enum Status { OPEN, COMPLETED, FAILED }

        private final String name;
        private final StringBuffer content = new StringBuffer();
        private final List<Attachment> attachments = Collections.synchronizedList(new ArrayList<>());
        private volatile Status status = Status.OPEN;

        RecordingStage(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public synchronized void appendContent(String text) {
            if (status == Status.OPEN) {
                content.append(text);
            }
        }

        @Override
        public synchronized void addAttachment(Attachment attachment) {
            if (status == Status.OPEN) {
                attachments.add(attachment);
            }
        }

        @Override
        public synchronized void close() {
            if (status == Status.OPEN) {
                status = Status.COMPLETED;
            }
        }

        @Override
        public synchronized void fail() {
            if (status == Status.OPEN) {
                status = Status.FAILED;
            }
        }

        public String content() {
            return content.toString();
        }

        public List<Attachment> attachments() {
            return List.copyOf(attachments);
        }

        public Status status() {
            return status;
        }
    }
}
