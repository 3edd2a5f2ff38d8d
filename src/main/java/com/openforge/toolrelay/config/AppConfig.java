package com.openforge.toolrelay.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.openforge.toolrelay.llm.LlmClient;
import com.openforge.toolrelay.llm.LlmClientFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Core infrastructure beans:
 *  - orchestrationExecutor → one worker per in-flight request loop
 *  - toolExecutor          → fan-out of the tool calls of a round
 *  - Java HttpClient       → the ONLY HTTP engine; no WebClient, no RestTemplate
 *  - Jackson ObjectMapper  → snake_case ↔ camelCase, Java 8 time, tolerant deserialization
 *
 * Both executors are cached pools (request loops and tool calls block on
 * I/O) wrapped so the conversation id in the MDC follows the work.
 */
@Configuration
public class AppConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService orchestrationExecutor() {
        return new MdcPropagatingExecutorService(
                Executors.newCachedThreadPool(new CustomizableThreadFactory("agent-loop-")));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService toolExecutor() {
        return new MdcPropagatingExecutorService(
                Executors.newCachedThreadPool(new CustomizableThreadFactory("agent-tool-")));
    }

    /**
     * Single, shared HttpClient instance.
     * - 30 s connect timeout; per-request read timeouts are set at call site.
     * - HTTP/1.1 keeps SSE streams on plain chunked responses.
     */
    @Bean
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    /**
     * Shared ObjectMapper configured for OpenAI-compatible JSON:
     *  - snake_case property names (tool_calls, finish_reason …)
     *  - ISO-8601 dates, NOT timestamps
     *  - Unknown properties silently ignored (API can add fields without breaking us)
     */
    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /** Ad-hoc clients for deployments addressed by tools (e.g. image generation). */
    @Bean
    public LlmClientFactory llmClientFactory(HttpClient httpClient, ObjectMapper objectMapper) {
        return config -> new LlmClient(httpClient, objectMapper, config);
    }
}
