package com.openforge.toolrelay.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.toolrelay.agent.AgentProperties;
import com.openforge.toolrelay.agent.channel.Stage;
import com.openforge.toolrelay.llm.model.Message;
import com.openforge.toolrelay.llm.model.ToolCall;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the tool calls of one round concurrently and joins the results.
 *
 * Round shape:
 *   1. OPEN     : one stage per call, in call order, on the caller's thread
 *   2. FAN OUT  : every known tool is submitted to the tool executor
 *   3. JOIN     : results are collected in call order against one deadline
 *   4. CLOSE    : each stage is closed, or failed when its result is an error
 *
 * Exactly one tool message comes back per call, in call order, whatever the
 * completion order.  Unknown tools, failures and timeouts become error
 * results; none of them affects sibling calls.
 */
@Slf4j
@Component
public class ToolExecutionCoordinator {

    private final ExecutorService toolExecutor;
    private final ObjectMapper    objectMapper;
    private final Duration        timeout;

    public ToolExecutionCoordinator(@Qualifier("toolExecutor") ExecutorService toolExecutor,
                                    ObjectMapper objectMapper,
                                    AgentProperties properties) {
        this.toolExecutor = toolExecutor;
        this.objectMapper = objectMapper;
        this.timeout      = Duration.ofSeconds(properties.toolTimeoutSeconds());
    }

    public List<Message> execute(List<ToolCall> calls, ToolRegistry registry, ExecutionScope scope) {
        List<PendingResult> pending = new ArrayList<>(calls.size());
        for (ToolCall call : calls) {
            pending.add(dispatch(call, registry, scope));
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        List<Message> results = new ArrayList<>(pending.size());
        for (PendingResult result : pending) {
            Message message;
            try {
                message = await(result, deadline);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                pending.forEach(PendingResult::abandon);
                throw new CancellationException("Interrupted while waiting for tool results");
            }
            if (GuardedTool.isError(message)) {
                result.stage().fail();
            } else {
                result.stage().close();
            }
            results.add(message);
        }
        return List.copyOf(results);
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private PendingResult dispatch(ToolCall call, ToolRegistry registry, ExecutionScope scope) {
        String toolName = call.name() == null ? "unknown" : call.name();
        Stage stage = scope.channel().openStage(toolName);

        Optional<GuardedTool> found = registry.lookup(call.name());
        if (found.isEmpty()) {
            log.warn("[ToolCoordinator] Unknown tool '{}' requested by call {}", toolName, call.id());
            Message error = GuardedTool.errorResult(call, "Unknown tool: " + toolName);
            return new PendingResult(call, stage, CompletableFuture.completedFuture(error));
        }

        GuardedTool tool = found.get();
        if (tool.showInStage()) {
            stage.appendContent("## Request arguments: \n");
            stage.appendContent("```json\n\r" + prettyArguments(call) + "\n\r```\n\r");
            stage.appendContent("## Response: \n");
        }

        log.info("[ToolCoordinator] Executing tool: {} id={}", toolName, call.id());
        log.debug("[ToolCoordinator] {} args={}", toolName, call.arguments());
        ToolCallContext context = new ToolCallContext(
                call, scope.apiKey(), scope.conversationId(), stage, scope.channel());
        Future<Message> future = toolExecutor.submit(() -> tool.call(context));
        return new PendingResult(call, stage, future);
    }

    private Message await(PendingResult result, long deadline) throws InterruptedException {
        ToolCall call = result.call();
        long remaining = Math.max(0L, deadline - System.nanoTime());
        try {
            return result.future().get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            result.future().cancel(true);
            log.warn("[ToolCoordinator] Tool {} (call {}) timed out after {}s",
                    call.name(), call.id(), timeout.toSeconds());
            return GuardedTool.errorResult(call, "timed out after %ds".formatted(timeout.toSeconds()));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("[ToolCoordinator] Tool {} (call {}) failed outside its guard: {}",
                    call.name(), call.id(), cause.getMessage());
            return GuardedTool.errorResult(call, String.valueOf(cause.getMessage()));
        } catch (CancellationException e) {
            return GuardedTool.errorResult(call, "cancelled");
        }
    }

    /** Pretty-prints the raw arguments; unparsable text is shown as-is. */
    private String prettyArguments(ToolCall call) {
        String raw = call.arguments();
        if (raw == null || raw.isBlank()) {
            return "{}";
        }
        try {
            Object parsed = objectMapper.readTree(raw);
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(parsed);
        } catch (JsonProcessingException e) {
            return raw;
        }
    }

    private record PendingResult(ToolCall call, Stage stage, Future<Message> future) {

        void abandon() {
            future.cancel(true);
            stage.fail();
        }
    }
}
