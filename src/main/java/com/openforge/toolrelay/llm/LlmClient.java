package com.openforge.toolrelay.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.toolrelay.llm.model.ChatRequest;
import com.openforge.toolrelay.llm.model.StreamingChunk;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Stateless, SDK-free client for an OpenAI-compatible /chat/completions
 * endpoint in streaming (SSE) mode.
 *
 * {@link #openStream} performs the HTTP exchange up to the response headers
 * and returns a lazy stream of parsed chunks.  Everything that can be
 * retried safely (connect errors, 429, 5xx on open) is thrown from
 * openStream itself; once the first chunk has been handed out, a broken
 * connection surfaces from the stream and must not be retried, because the
 * caller has already acted on part of the output.
 *
 * Interpretation of the chunks (text deltas, tool-call fragments) is left to
 * the caller (ConversationOrchestrator).
 */
@Slf4j
public class LlmClient implements StreamingLlm {

    private static final String SSE_DATA_PREFIX = "data:";
    private static final String SSE_DONE        = "[DONE]";
    private static final int    ERROR_BODY_LIMIT = 2048;

    private final HttpClient   httpClient;
    private final ObjectMapper objectMapper;
    private final LlmProperties.ProviderConfig config;

    public LlmClient(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     LlmProperties.ProviderConfig config) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.config       = config;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * Streaming chat completion via SSE.
     *
     * @param request ChatRequest (stream flag is injected internally)
     * @return lazy, single-use stream of chunks; close it to release the connection
     */
    @Override
    public Stream<StreamingChunk> openStream(ChatRequest request) {
        if (request == null) {
            throw new LlmException("ChatRequest must not be null for provider [%s]"
                    .formatted(config.name()), false);
        }

        // Fall back to the provider's configured model when the caller left it blank.
        ChatRequest effectiveRequest = request;
        if (request.model() == null || request.model().isBlank()) {
            effectiveRequest = request.toBuilder().model(config.model()).build();
        }

        String requestBody = serializeWithStream(effectiveRequest);
        log.debug("[LlmClient:{}] → stream POST body-length={}", config.name(), requestBody.length());

        HttpResponse<Stream<String>> httpResponse;
        try {
            httpResponse = httpClient.send(buildHttpRequest(requestBody),
                    HttpResponse.BodyHandlers.ofLines());
        } catch (IOException e) {
            throw new LlmException("Network error (streaming) calling provider [%s]"
                    .formatted(config.name()), e, true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException("Interrupted while calling provider [%s]"
                    .formatted(config.name()), e, false);
        }

        int status = httpResponse.statusCode();
        if (status == 429) {
            closeQuietly(httpResponse.body());
            throw new LlmRateLimitException(
                    "Rate-limited by provider [%s].".formatted(config.name()));
        }
        if (status < 200 || status >= 300) {
            String bodySnippet = readErrorBody(httpResponse.body());
            throw new LlmException(
                    "Provider [%s] returned HTTP %d on stream open: %s"
                            .formatted(config.name(), status, bodySnippet),
                    status >= 500);
        }

        log.debug("[LlmClient:{}] ← HTTP {} stream opened", config.name(), status);
        return toChunks(httpResponse.body());
    }

    @Override
    public StreamingLlm withApiKey(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            return this;
        }
        return new LlmClient(httpClient, objectMapper, config.withApiKey(apiKey));
    }

    /** The model name configured for this provider (e.g. "gpt-4o"). */
    public String modelName() {
        return config.model();
    }

    public String providerName() {
        return config.name();
    }

    // ── SSE parsing ──────────────────────────────────────────────────────────

    /**
     * Maps raw SSE lines to chunks.  Comment lines, event names and blank
     * keep-alive lines are skipped; "data: [DONE]" ends the stream early
     * and a malformed data line fails it.
     * The returned stream shares the close handler of the line stream.
     */
    private Stream<StreamingChunk> toChunks(Stream<String> lines) {
        return lines
                .map(LlmClient::sseData)
                .filter(Objects::nonNull)
                .takeWhile(data -> !SSE_DONE.equals(data))
                .map(this::parseChunk);
    }

    /** Payload of a "data:" line, or null for any other SSE line. */
    static String sseData(String line) {
        if (line == null || !line.startsWith(SSE_DATA_PREFIX)) {
            return null;
        }
        String data = line.substring(SSE_DATA_PREFIX.length()).trim();
        return data.isEmpty() ? null : data;
    }

    /**
     * A chunk that cannot be parsed may carry a tool-call fragment, so it
     * fails the stream instead of being skipped.  Not retryable: earlier
     * chunks have already been consumed.
     */
    private StreamingChunk parseChunk(String json) {
        try {
            return objectMapper.readValue(json, StreamingChunk.class);
        } catch (JsonProcessingException e) {
            log.warn("[LlmClient:{}] Malformed SSE chunk: {}", config.name(), json);
            throw new LlmException("Malformed chunk from provider [%s]: %s"
                    .formatted(config.name(), e.getOriginalMessage()), e, false);
        }
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private HttpRequest buildHttpRequest(String body) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(config.baseUrl() + "/chat/completions"))
                .header("Content-Type", "application/json")
                .header("Accept", "text/event-stream")
                // Streaming responses can take a long time to complete
                .timeout(Duration.ofSeconds(config.timeoutSeconds() * 2L))
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (config.apiKey() != null && !config.apiKey().isBlank()) {
            // OpenAI-style providers read the bearer token, DIAL reads Api-Key
            builder.header("Authorization", "Bearer " + config.apiKey())
                   .header("Api-Key", config.apiKey());
        }
        return builder.build();
    }

    /** Serializes a ChatRequest with "stream": true injected into the JSON. */
    private String serializeWithStream(ChatRequest request) {
        try {
            ObjectNode node = objectMapper.valueToTree(request);
            node.put("stream", true);
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new LlmException("Failed to serialize streaming request", e, false);
        }
    }

    private static String readErrorBody(Stream<String> lines) {
        if (lines == null) {
            return "";
        }
        try (lines) {
            String body = lines.limit(20).collect(Collectors.joining("\n"));
            return body.length() > ERROR_BODY_LIMIT ? body.substring(0, ERROR_BODY_LIMIT) : body;
        } catch (RuntimeException e) {
            return "<unreadable body: " + e.getMessage() + ">";
        }
    }

    private static void closeQuietly(Stream<String> lines) {
        if (lines != null) {
            lines.close();
        }
    }

    // ── Exception types ──────────────────────────────────────────────────────

    /**
     * Upstream model failure.  {@code retryable} marks failures that happened
     * before any output was produced and may succeed on another attempt.
     */
    public static class LlmException extends RuntimeException {

        private final boolean retryable;

        public LlmException(String message, boolean retryable) {
            super(message);
            this.retryable = retryable;
        }

        public LlmException(String message, Throwable cause, boolean retryable) {
            super(message, cause);
            this.retryable = retryable;
        }

        public boolean isRetryable() {
            return retryable;
        }
    }

    public static class LlmRateLimitException extends LlmException {
        public LlmRateLimitException(String message) { super(message, true); }
    }
}
