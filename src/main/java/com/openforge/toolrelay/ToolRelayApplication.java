package com.openforge.toolrelay;

import com.openforge.toolrelay.agent.AgentProperties;
import com.openforge.toolrelay.llm.LlmProperties;
import com.openforge.toolrelay.tool.deployment.ImageGenerationProperties;
import com.openforge.toolrelay.tool.interpreter.PythonInterpreterProperties;
import com.openforge.toolrelay.tool.mcp.McpProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

// Registered globally so they bind even when the conditional tool beans are off.
@SpringBootApplication
@EnableConfigurationProperties({
        LlmProperties.class,
        AgentProperties.class,
        ImageGenerationProperties.class,
        McpProperties.class,
        PythonInterpreterProperties.class
})
public class ToolRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(ToolRelayApplication.class, args);
    }
}
