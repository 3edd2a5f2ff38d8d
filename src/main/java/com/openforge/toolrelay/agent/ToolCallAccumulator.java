package com.openforge.toolrelay.agent;

import com.openforge.toolrelay.llm.model.StreamingChunk.FunctionDelta;
import com.openforge.toolrelay.llm.model.StreamingChunk.ToolCallDelta;
import com.openforge.toolrelay.llm.model.ToolCall;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds complete tool calls out of the fragments of one streamed round.
 *
 * Fragment rules:
 *   - a fragment with a non-blank id opens the call at its index; a call
 *     already sitting at that index is replaced, but keeps its position
 *   - a fragment without id appends its argument text to the call at its index
 *   - a fragment without id at an index nobody opened is a protocol violation
 *   - a missing index means index 0 (single-call providers omit it)
 *
 * {@link #finish()} returns the calls in the order their indices were first
 * opened.  Not thread-safe; one instance per round, fed in arrival order.
 */
public class ToolCallAccumulator {

    private static final String DEFAULT_TYPE = "function";

    private final Map<Integer, PendingCall> pending = new LinkedHashMap<>();

    public void accept(List<ToolCallDelta> deltas) {
        if (deltas == null) {
            return;
        }
        for (ToolCallDelta delta : deltas) {
            accept(delta);
        }
    }

    public void accept(ToolCallDelta delta) {
        if (delta == null) {
            return;
        }
        int index = delta.index() == null ? 0 : delta.index();
        FunctionDelta function = delta.function();
        String argumentsChunk = function == null ? null : function.arguments();

        if (delta.id() != null && !delta.id().isBlank()) {
            String name = function == null ? null : function.name();
            // LinkedHashMap.put on an existing key leaves its iteration position untouched
            PendingCall opened = new PendingCall(delta.id(), delta.type(), name);
            pending.put(index, opened);
            opened.append(argumentsChunk);
            return;
        }

        PendingCall current = pending.get(index);
        if (current == null) {
            throw new ToolCallProtocolException(index,
                    "Tool call fragment at index %d arrived before any call was opened there"
                            .formatted(index));
        }
        current.append(argumentsChunk);
    }

    public boolean isEmpty() {
        return pending.isEmpty();
    }

    /** The completed calls, in first-seen order.  Call only after the stream ended. */
    public List<ToolCall> finish() {
        List<ToolCall> calls = new ArrayList<>(pending.size());
        for (PendingCall call : pending.values()) {
            calls.add(call.toToolCall());
        }
        return List.copyOf(calls);
    }

    private static final class PendingCall {

        private final String id;
        private final String type;
        private final String name;
        private final StringBuilder arguments = new StringBuilder();

        private PendingCall(String id, String type, String name) {
            this.id = id;
            this.type = type == null || type.isBlank() ? DEFAULT_TYPE : type;
            this.name = name;
        }

        private void append(String chunk) {
            if (chunk != null && !chunk.isEmpty()) {
                arguments.append(chunk);
            }
        }

        private ToolCall toToolCall() {
            ToolCall call = ToolCall.function(id, name, arguments.toString());
            return DEFAULT_TYPE.equals(type) ? call : new ToolCall(id, type, call.function());
        }
    }
}
