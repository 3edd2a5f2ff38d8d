package com.openforge.toolrelay.llm.model;

/**
 * The "function" sub-object inside a ToolCall.
 *
 * "arguments" is the raw JSON string exactly as the model produced it;
 * tools parse it themselves.
 *
 * Example:
 *   name      = "get_weather"
 *   arguments = "{\"city\":\"Kyiv\"}"
 */
public record FunctionCallResult(
        String name,
        String arguments
) {}
