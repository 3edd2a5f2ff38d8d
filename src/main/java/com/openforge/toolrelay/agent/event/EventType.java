package com.openforge.toolrelay.agent.event;

/**
 * Classifies every lifecycle event the orchestrator emits over WebSocket.
 *
 * Flow: ROUND_START(1) → TOOL_CALL… → TOOL_RESULT… → ROUND_START(2) → … → FINAL_ANSWER.
 */
public enum EventType {

    /** A new model round is about to stream. */
    ROUND_START,

    /** A tool is about to be invoked. payload = ToolCall. */
    TOOL_CALL,

    /** A tool has returned. payload = ToolResultPayload. */
    TOOL_RESULT,

    /** Final answer; request complete. */
    FINAL_ANSWER,

    /** The request failed. content = message. */
    ERROR
}
