package com.openforge.toolrelay.websocket;

import com.openforge.toolrelay.agent.event.AgentEvent;
import com.openforge.toolrelay.agent.event.AgentEventListener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Routes AgentEvents to the STOMP topic of their conversation:
 *
 *   /topic/agent/{conversationId}
 *
 * SimpMessagingTemplate is thread-safe, so tool threads may publish too.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AgentEventPublisher implements AgentEventListener {

    static final String TOPIC_PREFIX = "/topic/agent/";

    private final SimpMessagingTemplate messagingTemplate;

    /** Fire-and-forget; a delivery failure is logged and never reaches the loop. */
    @Override
    public void publish(AgentEvent event) {
        String destination = TOPIC_PREFIX + event.conversationId();
        try {
            messagingTemplate.convertAndSend(destination, event);
        } catch (Exception e) {
            log.warn("[Publisher] Failed to deliver {} event to {}: {}",
                    event.type(), destination, e.getMessage());
        }
    }
}
