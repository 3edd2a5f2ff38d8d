package com.openforge.toolrelay.tool.deployment;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.toolrelay.agent.channel.Stage;
import com.openforge.toolrelay.llm.LlmClientFactory;
import com.openforge.toolrelay.llm.LlmProperties;
import com.openforge.toolrelay.llm.StreamingLlm;
import com.openforge.toolrelay.llm.model.Attachment;
import com.openforge.toolrelay.llm.model.ChatRequest;
import com.openforge.toolrelay.llm.model.CustomContent;
import com.openforge.toolrelay.llm.model.Message;
import com.openforge.toolrelay.llm.model.StreamingChunk;
import com.openforge.toolrelay.llm.model.StreamingChunk.DeltaMessage;
import com.openforge.toolrelay.tool.AgentTool;
import com.openforge.toolrelay.tool.ToolCallContext;
import com.openforge.toolrelay.tool.ToolOutput;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * A tool that forwards the call to another model deployment.
 *
 * The "prompt" argument becomes the single user message; every other
 * argument is passed as custom_fields.configuration.  Streamed text and
 * attachments are mirrored into the stage and returned as the tool message.
 */
@Slf4j
public abstract class DeploymentTool implements AgentTool {

    private static final String PROMPT = "prompt";

    private final LlmClientFactory clientFactory;
    protected final ObjectMapper   objectMapper;

    protected DeploymentTool(LlmClientFactory clientFactory, ObjectMapper objectMapper) {
        this.clientFactory = clientFactory;
        this.objectMapper  = objectMapper;
    }

    protected abstract String deploymentName();

    /** Base URL of the deployment gateway, without the /openai/deployments path. */
    protected abstract String endpoint();

    /** Key used when the request carries none; may be null. */
    protected String defaultApiKey() {
        return null;
    }

    protected int timeoutSeconds() {
        return 120;
    }

    @Override
    public ToolOutput execute(ToolCallContext context) throws Exception {
        JsonNode parsed = context.arguments(objectMapper);
        if (!parsed.isObject()) {
            throw new IllegalArgumentException("arguments must be a JSON object");
        }
        ObjectNode arguments = (ObjectNode) parsed;
        JsonNode prompt = arguments.remove(PROMPT);
        if (prompt == null || prompt.asText().isBlank()) {
            throw new IllegalArgumentException("'prompt' is required");
        }

        ObjectNode customFields = objectMapper.createObjectNode();
        customFields.set("configuration", arguments);
        ChatRequest request = ChatRequest.builder()
                .model(deploymentName())
                .messages(List.of(Message.user(prompt.asText())))
                .customFields(customFields)
                .build();

        log.debug("[Tool:{}] → deployment {} configuration={}", name(), deploymentName(), arguments);

        Stage stage = context.stage();
        StringBuilder content = new StringBuilder();
        List<Attachment> attachments = new ArrayList<>();
        try (Stream<StreamingChunk> chunks = client(context.apiKey()).openStream(request)) {
            chunks.forEachOrdered(chunk -> {
                DeltaMessage delta = chunk.firstDelta();
                if (delta == null) {
                    return;
                }
                if (delta.content() != null && !delta.content().isEmpty()) {
                    stage.appendContent(delta.content());
                    content.append(delta.content());
                }
                CustomContent custom = delta.customContent();
                if (custom != null && custom.attachments() != null) {
                    for (Attachment attachment : custom.attachments()) {
                        stage.addAttachment(attachment);
                        attachments.add(attachment);
                    }
                }
            });
        }

        Message message = Message.builder()
                .role(Message.ROLE_TOOL)
                .content(content.toString())
                .customContent(attachments.isEmpty() ? null : CustomContent.ofAttachments(attachments))
                .build();
        return ToolOutput.ofMessage(message);
    }

    private StreamingLlm client(String requestApiKey) {
        String apiKey = requestApiKey != null && !requestApiKey.isBlank() ? requestApiKey : defaultApiKey();
        String baseUrl = stripTrailingSlash(endpoint()) + "/openai/deployments/" + deploymentName();
        return clientFactory.create(new LlmProperties.ProviderConfig(
                deploymentName(), baseUrl, apiKey, deploymentName(), timeoutSeconds()));
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
