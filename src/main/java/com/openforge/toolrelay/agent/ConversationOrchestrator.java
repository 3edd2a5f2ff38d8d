package com.openforge.toolrelay.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.toolrelay.agent.channel.ResponseChannel;
import com.openforge.toolrelay.agent.event.AgentEvent;
import com.openforge.toolrelay.agent.event.AgentEventListener;
import com.openforge.toolrelay.llm.StreamingLlm;
import com.openforge.toolrelay.llm.model.Attachment;
import com.openforge.toolrelay.llm.model.ChatRequest;
import com.openforge.toolrelay.llm.model.CustomContent;
import com.openforge.toolrelay.llm.model.Message;
import com.openforge.toolrelay.llm.model.StreamingChunk;
import com.openforge.toolrelay.llm.model.StreamingChunk.DeltaMessage;
import com.openforge.toolrelay.llm.model.ToolCall;
import com.openforge.toolrelay.tool.ExecutionScope;
import com.openforge.toolrelay.tool.ToolExecutionCoordinator;
import com.openforge.toolrelay.tool.ToolRegistry;
import com.openforge.toolrelay.tool.ToolRegistryProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Stream;

/**
 * Drives one user request to its final answer.
 *
 * Loop shape:
 *   for round = 1..maxRounds:
 *     1. ASSEMBLE  : system prompt + visible messages (with persisted rounds) + rounds so far
 *     2. STREAM    : text deltas go live to the channel, tool-call fragments to the accumulator
 *     3. DECIDE    : tool calls? → DISPATCH; none? → DONE
 *     4. DISPATCH  : run the round's calls concurrently, append call + results to RoundHistory
 *     5. DONE      : write RoundHistory into the response state, return the answer
 *
 * A model failure, a malformed fragment sequence or running out of rounds
 * fails the request.  Tool failures never do; they come back as error results.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationOrchestrator {

    public static final String MDC_CONVERSATION_ID = "conversationId";

    private final StreamingLlm             llm;
    private final ToolRegistryProvider     registryProvider;
    private final ToolExecutionCoordinator coordinator;
    private final ConversationAssembler    assembler;
    private final AgentEventListener       events;
    private final ObjectMapper             objectMapper;
    private final AgentProperties          properties;

    private enum RoundPhase { STREAMING, DISPATCHING, DONE }

    // ── Entry point ──────────────────────────────────────────────────────────

    /**
     * Runs the loop on the calling thread and returns the final assistant
     * message, whose custom_content.state carries the accumulated rounds.
     */
    public Message run(AgentRequest request, ResponseChannel channel) {
        String conversationId = request.conversationId();
        String previousMdc = MDC.get(MDC_CONVERSATION_ID);
        MDC.put(MDC_CONVERSATION_ID, conversationId);
        int round = 0;
        try {
            StreamingLlm model    = llm.withApiKey(request.apiKey());
            ToolRegistry registry = registryProvider.get();
            ExecutionScope scope  = new ExecutionScope(request.apiKey(), conversationId, channel);
            RoundHistory history  = new RoundHistory();
            int maxRounds = properties.maxRounds();

            log.info("[Orchestrator:{}] Request started with {} message(s), {} tool(s).",
                    conversationId, request.messages().size(), registry.size());

            while (true) {
                round++;
                events.publish(AgentEvent.roundStart(conversationId, round));
                logPhase(conversationId, round, RoundPhase.STREAMING);

                List<Message> messages = assembler.assemble(
                        properties.effectiveSystemPrompt(), request.messages(), history);
                RoundOutput output = streamRound(model, registry, messages, channel);

                if (output.toolCalls().isEmpty()) {
                    logPhase(conversationId, round, RoundPhase.DONE);
                    return finish(conversationId, round, output.content(), history, channel);
                }
                if (round >= maxRounds) {
                    log.warn("[Orchestrator:{}] Max rounds ({}) reached.", conversationId, maxRounds);
                    throw new RoundLimitExceededException(maxRounds);
                }

                logPhase(conversationId, round, RoundPhase.DISPATCHING);
                Message assistant = Message.assistant(
                        output.content().isEmpty() ? null : output.content(), output.toolCalls());
                for (ToolCall call : output.toolCalls()) {
                    events.publish(AgentEvent.toolCall(conversationId, call, round));
                }

                List<Message> results = coordinator.execute(output.toolCalls(), registry, scope);
                for (Message result : results) {
                    events.publish(AgentEvent.toolResult(conversationId, result.name(), result.content(), round));
                }
                history.appendRound(assistant, results);
            }
        } catch (RuntimeException e) {
            log.error("[Orchestrator:{}] Request failed in round {}: {}",
                    conversationId, round, e.getMessage(), e);
            events.publish(AgentEvent.error(conversationId, e.getMessage(), round));
            throw e;
        } finally {
            if (previousMdc == null) {
                MDC.remove(MDC_CONVERSATION_ID);
            } else {
                MDC.put(MDC_CONVERSATION_ID, previousMdc);
            }
        }
    }

    // ── Streaming ────────────────────────────────────────────────────────────

    /**
     * Consumes the model stream exactly once, in arrival order.  The tool
     * calls are only read from the accumulator after the stream has ended.
     */
    private RoundOutput streamRound(StreamingLlm model,
                                    ToolRegistry registry,
                                    List<Message> messages,
                                    ResponseChannel channel) {
        logMessages(messages);
        ChatRequest request = ChatRequest.withTools(null, messages, registry.definitions());

        ToolCallAccumulator accumulator = new ToolCallAccumulator();
        StringBuilder content = new StringBuilder();

        try (Stream<StreamingChunk> chunks = model.openStream(request)) {
            chunks.forEachOrdered(chunk -> {
                DeltaMessage delta = chunk.firstDelta();
                if (delta == null) {
                    return;
                }
                if (delta.content() != null && !delta.content().isEmpty()) {
                    channel.appendContent(delta.content());
                    content.append(delta.content());
                }
                CustomContent custom = delta.customContent();
                if (custom != null && custom.attachments() != null) {
                    for (Attachment attachment : custom.attachments()) {
                        channel.addAttachment(attachment);
                    }
                }
                accumulator.accept(delta.toolCalls());
            });
        }
        return new RoundOutput(content.toString(), accumulator.finish());
    }

    private Message finish(String conversationId,
                           int round,
                           String content,
                           RoundHistory history,
                           ResponseChannel channel) {
        ObjectNode state = history.toState(objectMapper);
        channel.setState(state);

        Message answer = Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .content(content)
                .customContent(CustomContent.ofState(state))
                .build();

        events.publish(AgentEvent.finalAnswer(conversationId, content, round));
        log.info("[Orchestrator:{}] Completed in {} round(s), {} hidden message(s).",
                conversationId, round, history.size());
        return answer;
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static void logPhase(String conversationId, int round, RoundPhase phase) {
        log.debug("[Orchestrator:{}] Round {} → {}", conversationId, round, phase);
    }

    private void logMessages(List<Message> messages) {
        if (!log.isDebugEnabled()) {
            return;
        }
        for (Message message : messages) {
            try {
                log.debug("[Orchestrator] history: {}", objectMapper.writeValueAsString(message));
            } catch (JsonProcessingException e) {
                log.debug("[Orchestrator] history: {}", message);
            }
        }
    }

    private record RoundOutput(String content, List<ToolCall> toolCalls) {}
}
