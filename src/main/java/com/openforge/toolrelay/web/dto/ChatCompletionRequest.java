package com.openforge.toolrelay.web.dto;

import com.openforge.toolrelay.llm.model.Message;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Body of POST /api/agent/chat/completions.  Fields other than "messages"
 * (model, stream, temperature …) are accepted and ignored.
 */
public record ChatCompletionRequest(
        @NotEmpty(message = "messages must not be empty")
        List<@NotNull(message = "messages must not contain null entries") @Valid Message> messages
) {}
