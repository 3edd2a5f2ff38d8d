package com.openforge.toolrelay.tool;

import com.openforge.toolrelay.agent.channel.ResponseChannel;

/**
 * Request-level values shared by every tool call of one request.
 */
public record ExecutionScope(
        String apiKey,
        String conversationId,
        ResponseChannel channel
) {}
