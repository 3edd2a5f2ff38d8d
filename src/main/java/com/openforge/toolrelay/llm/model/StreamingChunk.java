package com.openforge.toolrelay.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * One SSE data frame from a streaming /chat/completions response.
 *
 * Wire format (one line from the SSE stream):
 *   data: {"id":"chatcmpl-xxx","object":"chat.completion.chunk",
 *           "choices":[{"index":0,"delta":{"content":"Hello"},"finish_reason":null}]}
 *
 * Last frame:
 *   data: [DONE]
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StreamingChunk(
        String id,
        String object,
        Long created,
        String model,
        List<ChunkChoice> choices
) {

    /** The delta of the first choice, or null when the chunk carries none. */
    public DeltaMessage firstDelta() {
        if (choices == null || choices.isEmpty() || choices.get(0) == null) {
            return null;
        }
        return choices.get(0).delta();
    }

    public record ChunkChoice(
            int index,
            DeltaMessage delta,
            String finishReason
    ) {}

    /**
     * Sparse message delta: only the fields that changed in this chunk
     * are non-null.  The first chunk usually carries {"role":"assistant"},
     * subsequent chunks carry {"content":"token"} or {"tool_calls":[...]}.
     */
    public record DeltaMessage(
            String role,
            String content,
            List<ToolCallDelta> toolCalls,
            CustomContent customContent
    ) {}

    /**
     * Incremental tool-call fragment.  The fragment that opens a call carries
     * id + function.name; later fragments for the same index carry only
     * pieces of function.arguments.
     */
    public record ToolCallDelta(
            Integer index,
            String id,
            String type,
            FunctionDelta function
    ) {}

    public record FunctionDelta(
            String name,
            String arguments
    ) {}
}
