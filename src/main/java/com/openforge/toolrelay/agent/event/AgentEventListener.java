package com.openforge.toolrelay.agent.event;

/**
 * Receives lifecycle events.  Implementations must not throw.
 */
@FunctionalInterface
public interface AgentEventListener {

    void publish(AgentEvent event);
}
