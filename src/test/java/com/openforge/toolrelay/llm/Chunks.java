package com.openforge.toolrelay.llm;

import com.openforge.toolrelay.llm.model.Attachment;
import com.openforge.toolrelay.llm.model.CustomContent;
import com.openforge.toolrelay.llm.model.StreamingChunk;
import com.openforge.toolrelay.llm.model.StreamingChunk.ChunkChoice;
import com.openforge.toolrelay.llm.model.StreamingChunk.DeltaMessage;
import com.openforge.toolrelay.llm.model.StreamingChunk.FunctionDelta;
import com.openforge.toolrelay.llm.model.StreamingChunk.ToolCallDelta;

import java.util.List;

/**
 * Builders for streamed chunks used across tests.
 */
public final class Chunks {

    private Chunks() {
    }

    public static StreamingChunk text(String content) {
        return of(new DeltaMessage(null, content, null, null));
    }

    public static StreamingChunk attachments(Attachment... attachments) {
        return of(new DeltaMessage(null, null, null, CustomContent.ofAttachments(List.of(attachments))));
    }

    public static StreamingChunk toolCalls(ToolCallDelta... deltas) {
        return of(new DeltaMessage(null, null, List.of(deltas), null));
    }

    /** Fragment that opens a call. */
    public static ToolCallDelta open(int index, String id, String name, String arguments) {
        return new ToolCallDelta(index, id, "function", new FunctionDelta(name, arguments));
    }

    /** Fragment that continues a call. */
    public static ToolCallDelta args(int index, String arguments) {
        return new ToolCallDelta(index, null, null, new FunctionDelta(null, arguments));
    }

    public static StreamingChunk of(DeltaMessage delta) {
        return new StreamingChunk("chatcmpl-test", "chat.completion.chunk", 0L, "test-model",
                List.of(new ChunkChoice(0, delta, null)));
    }
}
