package com.openforge.toolrelay.tool.deployment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.toolrelay.llm.LlmClientFactory;
import com.openforge.toolrelay.llm.model.Attachment;
import com.openforge.toolrelay.llm.model.Message;
import com.openforge.toolrelay.tool.ToolCallContext;
import com.openforge.toolrelay.tool.ToolOutput;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Generates images through an image model deployment (dall-e-3 by default).
 *
 * Generated PNG/JPEG attachments are also shown in the visible answer as
 * markdown images, so the model is told the user has already seen them.
 */
@Component
@ConditionalOnProperty(prefix = "agent.tools.image-generation", name = "enabled", havingValue = "true")
public class ImageGenerationTool extends DeploymentTool {

    static final String SHOWN_TO_USER =
            "The image has been successfully generated according to request and shown to user!";

    private static final String DESCRIPTION = """
            # Image generator
            Generates image based on the provided description.
            ## Instructions:
            - Use that tool when user asks to generate an image based on the description or to visualize some text or information.
            - Choose the best size from available options based on user request or image type. For specific size requests, use the closest supported option.
            - When the tool returns a markdown image URL, always include it in your response and follow it with a brief description.
            ## Restrictions:
            - Never use this tool for data or numerical information visualization.""";

    private static final String PARAMETERS = """
            {
              "type": "object",
              "properties": {
                "prompt": {
                  "type": "string",
                  "description": "Extensive description of the image that should be generated."
                },
                "size": {
                  "type": "string",
                  "description": "The size of the generated image.",
                  "enum": ["1024x1024", "1024x1792", "1792x1024"],
                  "default": "1024x1024"
                },
                "style": {
                  "type": "string",
                  "description": "The style of the generated image. `vivid` leans towards hyperrealistic and dramatic images, `natural` produces more natural, less realistic looking images.",
                  "enum": ["natural", "vivid"],
                  "default": "natural"
                },
                "quality": {
                  "type": "string",
                  "description": "The quality of the image. `hd` creates images with finer details and greater consistency across the image.",
                  "enum": ["standard", "hd"],
                  "default": "standard"
                }
              },
              "required": ["prompt"]
            }
            """;

    private final ImageGenerationProperties properties;
    private final JsonNode parameters;

    public ImageGenerationTool(LlmClientFactory clientFactory,
                               ObjectMapper objectMapper,
                               ImageGenerationProperties properties) {
        super(clientFactory, objectMapper);
        this.properties = properties;
        try {
            this.parameters = objectMapper.readTree(PARAMETERS);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to build image_generation_tool schema", e);
        }
    }

    @Override
    public String name() {
        return "image_generation_tool";
    }

    @Override
    public String description() {
        return DESCRIPTION;
    }

    @Override
    public JsonNode parameters() {
        return parameters;
    }

    @Override
    protected String deploymentName() {
        return properties.deploymentName();
    }

    @Override
    protected String endpoint() {
        return properties.endpoint();
    }

    @Override
    protected String defaultApiKey() {
        return properties.apiKey();
    }

    @Override
    protected int timeoutSeconds() {
        return properties.timeoutSeconds();
    }

    @Override
    public ToolOutput execute(ToolCallContext context) throws Exception {
        ToolOutput output = super.execute(context);
        Message message = output.message();
        if (message.customContent() == null || message.customContent().attachments() == null) {
            return output;
        }

        for (Attachment attachment : message.customContent().attachments()) {
            if (attachment.isImage() && attachment.url() != null) {
                context.channel().appendContent("\n\r![image](" + attachment.url() + ")\n\r");
            }
        }
        if (message.content() == null || message.content().isBlank()) {
            message = Message.builder()
                    .role(message.role())
                    .content(SHOWN_TO_USER)
                    .customContent(message.customContent())
                    .build();
        }
        return ToolOutput.ofMessage(message);
    }
}
