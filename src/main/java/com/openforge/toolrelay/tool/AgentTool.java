package com.openforge.toolrelay.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.toolrelay.llm.model.Tool;
import com.openforge.toolrelay.llm.model.ToolFunction;

/**
 * A capability the model can invoke by name.
 *
 * Implementations declare a JSON-Schema for their arguments and execute one
 * call at a time; they may be invoked concurrently for different calls of
 * the same round.  Anything thrown from {@link #execute} is turned into an
 * error result by {@link GuardedTool}, so implementations need no
 * try/catch of their own.
 */
public interface AgentTool {

    String name();

    String description();

    JsonNode parameters();

    /** Whether the coordinator prints the request arguments into the tool's stage. */
    default boolean showInStage() {
        return true;
    }

    ToolOutput execute(ToolCallContext context) throws Exception;

    default Tool definition() {
        return Tool.ofFunction(new ToolFunction(name(), description(), parameters()));
    }
}
