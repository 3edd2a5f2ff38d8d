package com.openforge.toolrelay.llm;

import com.openforge.toolrelay.llm.model.ChatRequest;
import com.openforge.toolrelay.llm.model.StreamingChunk;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * High-availability LLM request router.
 *
 * Call graph:
 *
 *   openStream(request)
 *     └─ primaryCircuitBreaker + primaryRetry
 *           └─ primaryClient.openStream(request)
 *                 ↓ (on CallNotPermittedException or any exception)
 *     └─ fallbackCircuitBreaker + fallbackRetry
 *           └─ fallbackClient.openStream(request)
 *
 *   withApiKey(key).openStream(request)
 *     └─ primaryCircuitBreaker + primaryRetry
 *           └─ primaryClient(key).openStream(request)
 *
 * Only the stream-open phase is guarded.  Once a stream has been handed to
 * the caller, its chunks are consumed exactly once; a connection dropped
 * mid-stream propagates to the caller and is never replayed here, since the
 * caller may already have forwarded part of the output.
 */
@Slf4j
@Component
@EnableConfigurationProperties(LlmProperties.class)
public class LlmRouter implements StreamingLlm {

    private final LlmClient      primaryClient;
    private final LlmClient      fallbackClient;
    private final CircuitBreaker primaryCb;
    private final CircuitBreaker fallbackCb;
    private final Retry          primaryRetry;
    private final Retry          fallbackRetry;

    public LlmRouter(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     LlmProperties properties,
                     CircuitBreaker primaryLlmCircuitBreaker,
                     CircuitBreaker fallbackLlmCircuitBreaker,
                     Retry primaryLlmRetry,
                     Retry fallbackLlmRetry) {
        this.primaryClient  = new LlmClient(httpClient, objectMapper, properties.primary());
        // The fallback provider is optional; without it the primary failure is final.
        this.fallbackClient = isConfigured(properties.fallback())
                ? new LlmClient(httpClient, objectMapper, properties.fallback())
                : null;
        this.primaryCb      = primaryLlmCircuitBreaker;
        this.fallbackCb     = fallbackLlmCircuitBreaker;
        this.primaryRetry   = primaryLlmRetry;
        this.fallbackRetry  = fallbackLlmRetry;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * Opens a stream on the primary provider, falling back to the secondary
     * one when the primary cannot be opened.
     *
     * The model field in ChatRequest is overridden by each provider's own
     * configured model name, so callers only need to pass messages and tools.
     */
    @Override
    public Stream<StreamingChunk> openStream(ChatRequest request) {
        try {
            ChatRequest primaryRequest = overrideModel(request, primaryClient.modelName());
            return executeWithResilience(primaryCb, primaryRetry,
                    () -> primaryClient.openStream(primaryRequest), "primary");
        } catch (RuntimeException primaryException) {
            if (fallbackClient == null) {
                throw primaryException;
            }
            log.warn("[LlmRouter] Primary stream failed ({}), engaging fallback. Cause: {}",
                    primaryException.getClass().getSimpleName(), primaryException.getMessage());

            ChatRequest fallbackRequest = overrideModel(request, fallbackClient.modelName());
            return executeWithResilience(fallbackCb, fallbackRetry,
                    () -> fallbackClient.openStream(fallbackRequest), "fallback");
        }
    }

    /**
     * A caller-supplied key is only valid for the primary provider, so the
     * per-request variant never falls back.  It still goes through the
     * primary circuit breaker and retry.
     */
    @Override
    public StreamingLlm withApiKey(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            return this;
        }
        log.debug("[LlmRouter] Using per-request key for provider {}", primaryClient.providerName());
        StreamingLlm keyedPrimary = primaryClient.withApiKey(apiKey);
        return request -> {
            ChatRequest primaryRequest = overrideModel(request, primaryClient.modelName());
            return executeWithResilience(primaryCb, primaryRetry,
                    () -> keyedPrimary.openStream(primaryRequest), "primary");
        };
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    /**
     * Decorates a supplier with circuit-breaker + retry, then executes it.
     * Programmatic decoration, without AOP proxies.
     */
    private Stream<StreamingChunk> executeWithResilience(CircuitBreaker cb,
                                                         Retry retry,
                                                         Supplier<Stream<StreamingChunk>> call,
                                                         String label) {
        Supplier<Stream<StreamingChunk>> decorated =
                CircuitBreaker.decorateSupplier(cb,
                        Retry.decorateSupplier(retry, call));
        try {
            return decorated.get();
        } catch (LlmClient.LlmException e) {
            throw e;
        } catch (Exception e) {
            throw new LlmClient.LlmException(
                    "[LlmRouter] %s provider ultimately failed: %s".formatted(label, e.getMessage()), e, false);
        }
    }

    private static boolean isConfigured(LlmProperties.ProviderConfig config) {
        return config != null && config.baseUrl() != null && !config.baseUrl().isBlank();
    }

    private ChatRequest overrideModel(ChatRequest original, String modelName) {
        return original.toBuilder().model(modelName).build();
    }
}
