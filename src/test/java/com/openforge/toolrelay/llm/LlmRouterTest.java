package com.openforge.toolrelay.llm;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.openforge.toolrelay.llm.LlmClient.LlmException;
import com.openforge.toolrelay.llm.model.ChatRequest;
import com.openforge.toolrelay.llm.model.Message;
import com.openforge.toolrelay.llm.model.StreamingChunk;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LlmRouterTest {

    private static final String PRIMARY_URL = "http://primary/v1";
    private static final String FALLBACK_URL = "http://fallback/v1";

    private final ObjectMapper objectMapper = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    private final HttpClient httpClient = mock(HttpClient.class);
    private final Map<String, Integer> statusByHost = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> callsByHost = new ConcurrentHashMap<>();
    private final CircuitBreaker primaryCb = CircuitBreaker.ofDefaults("primary");

    private static LlmProperties.ProviderConfig provider(String name, String url) {
        return new LlmProperties.ProviderConfig(name, url, "key-" + name, name + "-model", 30);
    }

    private static Retry retry(String name) {
        return Retry.of(name, RetryConfig.custom()
                .maxAttempts(2)
                .waitDuration(Duration.ofMillis(1))
                .retryOnException(e -> e instanceof LlmException llm && llm.isRetryable())
                .build());
    }

    @SuppressWarnings("unchecked")
    private LlmRouter router(LlmProperties.ProviderConfig fallback) throws Exception {
        doAnswer(invocation -> {
            HttpRequest request = invocation.getArgument(0);
            String host = request.uri().getHost();
            callsByHost.computeIfAbsent(host, h -> new AtomicInteger()).incrementAndGet();
            HttpResponse<Stream<String>> response = mock(HttpResponse.class);
            when(response.statusCode()).thenReturn(statusByHost.getOrDefault(host, 200));
            when(response.body()).thenReturn(Stream.of(
                    "data: {\"model\":\"" + host + "\",\"choices\":[{\"index\":0,\"delta\":{\"content\":\"" + host + "\"}}]}",
                    "data: [DONE]"));
            return response;
        }).when(httpClient).send(any(HttpRequest.class), any());

        return new LlmRouter(httpClient, objectMapper,
                new LlmProperties(provider("primary", PRIMARY_URL), fallback),
                primaryCb, CircuitBreaker.ofDefaults("fallback"),
                retry("primary"), retry("fallback"));
    }

    private static ChatRequest request() {
        return ChatRequest.withTools(null, List.of(Message.user("hi")), null);
    }

    private static String firstContent(Stream<StreamingChunk> stream) {
        try (stream) {
            return stream.findFirst().orElseThrow().firstDelta().content();
        }
    }

    private int calls(String host) {
        AtomicInteger count = callsByHost.get(host);
        return count == null ? 0 : count.get();
    }

    @Test
    void openStream_shouldUsePrimaryWhenHealthy() throws Exception {
        LlmRouter router = router(provider("fallback", FALLBACK_URL));

        assertEquals("primary", firstContent(router.openStream(request())));
        assertEquals(0, calls("fallback"));
    }

    @Test
    void openStream_shouldRetryThenFallBack() throws Exception {
        statusByHost.put("primary", 503);
        LlmRouter router = router(provider("fallback", FALLBACK_URL));

        assertEquals("fallback", firstContent(router.openStream(request())));
        assertEquals(2, calls("primary"));
        assertEquals(1, calls("fallback"));
    }

    @Test
    void openStream_shouldNotRetryNonRetryableFailure() throws Exception {
        statusByHost.put("primary", 400);
        LlmRouter router = router(provider("fallback", FALLBACK_URL));

        assertEquals("fallback", firstContent(router.openStream(request())));
        assertEquals(1, calls("primary"));
    }

    @Test
    void openStream_shouldRethrowPrimaryFailureWithoutFallback() throws Exception {
        statusByHost.put("primary", 503);
        LlmRouter router = router(null);

        LlmException error = assertThrows(LlmException.class, () -> router.openStream(request()));

        assertTrue(error.getMessage().contains("HTTP 503"));
        assertEquals(2, calls("primary"));
    }

    @Test
    void openStream_shouldTreatBlankFallbackUrlAsAbsent() throws Exception {
        statusByHost.put("primary", 500);
        LlmRouter router = router(provider("fallback", ""));

        assertThrows(LlmException.class, () -> router.openStream(request()));
        assertEquals(0, calls("fallback"));
    }

    @Test
    void withApiKey_shouldRetryPrimaryButNeverFallBackForCallerKey() throws Exception {
        statusByHost.put("primary", 503);
        LlmRouter router = router(provider("fallback", FALLBACK_URL));

        StreamingLlm perRequest = router.withApiKey("caller-key");

        LlmException error = assertThrows(LlmException.class, () -> perRequest.openStream(request()));
        assertTrue(error.getMessage().contains("HTTP 503"));
        assertEquals(2, calls("primary"));
        assertEquals(0, calls("fallback"));
        assertEquals(router, router.withApiKey(null));
    }

    @Test
    void withApiKey_shouldSendCallerKeyThroughPrimaryCircuitBreaker() throws Exception {
        LlmRouter router = router(null);

        assertEquals("primary", firstContent(router.withApiKey("caller-key").openStream(request())));

        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), any());
        assertEquals("caller-key", captor.getValue().headers().firstValue("Api-Key").orElseThrow());
        assertEquals(1, primaryCb.getMetrics().getNumberOfSuccessfulCalls());
    }
}
