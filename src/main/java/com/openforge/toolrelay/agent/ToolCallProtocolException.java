package com.openforge.toolrelay.agent;

/**
 * The model streamed a tool-call fragment that cannot be attached to any
 * call opened earlier in the same round.  Fatal to the request.
 */
public class ToolCallProtocolException extends RuntimeException {

    private final int index;

    public ToolCallProtocolException(int index, String message) {
        super(message);
        this.index = index;
    }

    /** Round-local index carried by the offending fragment. */
    public int getIndex() {
        return index;
    }
}
