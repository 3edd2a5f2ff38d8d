package com.openforge.toolrelay.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.toolrelay.agent.AgentRequest;
import com.openforge.toolrelay.agent.ConversationOrchestrator;
import com.openforge.toolrelay.web.dto.ChatCompletionRequest;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Chat-completion endpoint.
 *
 *   POST /api/agent/chat/completions
 *     headers: Api-Key (optional, per-request credential)
 *              X-Conversation-Id (optional, generated when absent)
 *     body:    { "messages": [ … ] }
 *
 * The response is an SSE stream of chat-completion chunks (see
 * SseResponseChannel).  Lifecycle events are additionally published on
 * /topic/agent/{conversationId}.
 *
 * Each request loop runs on the orchestration executor; the HTTP thread
 * returns as soon as the emitter is handed back.
 */
@Slf4j
@RestController
@RequestMapping("/api/agent")
public class AgentController {

    private final ConversationOrchestrator orchestrator;
    private final ObjectMapper             objectMapper;
    private final ExecutorService          orchestrationExecutor;

    public AgentController(ConversationOrchestrator orchestrator,
                           ObjectMapper objectMapper,
                           @Qualifier("orchestrationExecutor") ExecutorService orchestrationExecutor) {
        this.orchestrator          = orchestrator;
        this.objectMapper          = objectMapper;
        this.orchestrationExecutor = orchestrationExecutor;
    }

    @PostMapping(path = "/chat/completions", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter chatCompletions(
            @Valid @RequestBody ChatCompletionRequest body,
            @RequestHeader(value = "Api-Key", required = false) String apiKey,
            @RequestHeader(value = "X-Conversation-Id", required = false) String conversationIdHeader) {

        String conversationId = conversationIdHeader != null && !conversationIdHeader.isBlank()
                ? conversationIdHeader
                : UUID.randomUUID().toString();

        // No emitter timeout: the loop itself is bounded by max rounds and tool deadlines
        SseEmitter emitter = new SseEmitter(0L);
        SseResponseChannel channel = new SseResponseChannel(emitter, objectMapper, conversationId);
        AgentRequest request = new AgentRequest(conversationId, apiKey, body.messages());

        try {
            orchestrationExecutor.execute(() -> {
                channel.begin();
                try {
                    orchestrator.run(request, channel);
                    channel.complete();
                } catch (Throwable e) {
                    // The emitter has no timeout, so every outcome must end the stream
                    channel.fail(e);
                    if (e instanceof Error error) {
                        throw error;
                    }
                }
            });
        } catch (RejectedExecutionException e) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE,
                    "Agent is shutting down", e);
        }

        log.info("[Controller] Accepted conversation {} with {} message(s)",
                conversationId, body.messages().size());
        return emitter;
    }
}
