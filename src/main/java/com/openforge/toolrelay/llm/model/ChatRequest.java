package com.openforge.toolrelay.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;

import java.util.List;

/**
 * The request body sent to an OpenAI-compatible /chat/completions endpoint.
 *
 * toolChoice accepts:
 *   "none"     : model will not call any tool
 *   "auto"     : model decides (default when tools are present)
 *   "required" : model MUST call at least one tool
 *
 * customFields is forwarded as "custom_fields" for deployments that accept
 * per-request configuration (image generation and similar passthroughs).
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatRequest(
        String model,
        List<Message> messages,
        List<Tool> tools,
        String toolChoice,
        Double temperature,
        Integer maxTokens,
        JsonNode customFields
) {

    public static ChatRequest withTools(String model, List<Message> messages, List<Tool> tools) {
        boolean hasTools = tools != null && !tools.isEmpty();
        return ChatRequest.builder()
                .model(model)
                .messages(messages)
                .tools(hasTools ? tools : null)
                .toolChoice(hasTools ? "auto" : null)
                .build();
    }
}
