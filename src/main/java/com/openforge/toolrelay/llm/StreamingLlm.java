package com.openforge.toolrelay.llm;

import com.openforge.toolrelay.llm.model.ChatRequest;
import com.openforge.toolrelay.llm.model.StreamingChunk;

import java.util.stream.Stream;

/**
 * Opens a streaming chat completion.
 *
 * The returned stream yields chunks in arrival order and ends when the
 * provider closes the response.  It is single-use and must be closed by the
 * caller (try-with-resources) to release the underlying connection.
 * Failures while opening are thrown from this method; failures while reading
 * surface from the stream's terminal operation.
 */
@FunctionalInterface
public interface StreamingLlm {

    Stream<StreamingChunk> openStream(ChatRequest request);

    /**
     * A variant that authenticates with the caller's own credential.
     * Implementations without per-request keys return themselves.
     */
    default StreamingLlm withApiKey(String apiKey) {
        return this;
    }
}
