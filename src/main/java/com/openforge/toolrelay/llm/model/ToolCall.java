package com.openforge.toolrelay.llm.model;

/**
 * A complete tool invocation requested by the LLM.
 *
 * Only ever built from a finished stream (see
 * {@link com.openforge.toolrelay.agent.ToolCallAccumulator}); partial calls are
 * never dispatched.
 */
public record ToolCall(
        String id,
        String type,
        FunctionCallResult function
) {

    public static ToolCall function(String id, String name, String arguments) {
        return new ToolCall(id, "function", new FunctionCallResult(name, arguments));
    }

    public String name() {
        return function == null ? null : function.name();
    }

    public String arguments() {
        return function == null ? null : function.arguments();
    }
}
