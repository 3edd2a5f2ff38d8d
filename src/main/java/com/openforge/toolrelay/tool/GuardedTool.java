package com.openforge.toolrelay.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.toolrelay.llm.model.Message;
import com.openforge.toolrelay.llm.model.ToolCall;
import lombok.extern.slf4j.Slf4j;

/**
 * Wraps every registered tool so that no failure escapes a call: whatever
 * the delegate throws becomes a tool message starting with
 * {@value #ERROR_PREFIX}.
 */
@Slf4j
public final class GuardedTool implements AgentTool {

    public static final String ERROR_PREFIX = "Error during tool execution: ";

    private final AgentTool delegate;

    public GuardedTool(AgentTool delegate) {
        this.delegate = delegate;
    }

    @Override
    public String name() {
        return delegate.name();
    }

    @Override
    public String description() {
        return delegate.description();
    }

    @Override
    public JsonNode parameters() {
        return delegate.parameters();
    }

    @Override
    public boolean showInStage() {
        return delegate.showInStage();
    }

    @Override
    public ToolOutput execute(ToolCallContext context) throws Exception {
        return delegate.execute(context);
    }

    /** Runs the delegate and always returns the tool message for the call. */
    public Message call(ToolCallContext context) {
        ToolCall toolCall = context.toolCall();
        try {
            ToolOutput output = delegate.execute(context);
            if (output == null) {
                return errorResult(toolCall, "tool '%s' returned no result".formatted(name()));
            }
            return output.toMessage(toolCall);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(toolCall, "interrupted");
        } catch (Exception e) {
            log.warn("[Tool:{}] Call {} failed: {}", name(), toolCall.id(), e.getMessage());
            log.debug("[Tool:{}] Failure detail", name(), e);
            return errorResult(toolCall, describe(e));
        }
    }

    public static Message errorResult(ToolCall toolCall, String description) {
        return Message.toolResult(toolCall.id(), toolCall.name(), ERROR_PREFIX + description);
    }

    public static boolean isError(Message message) {
        return message != null && message.content() != null
                && message.content().startsWith(ERROR_PREFIX);
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
