package com.openforge.toolrelay.tool.interpreter;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * agent:
 *   tools:
 *     python-interpreter:
 *       enabled: true
 *       url: http://localhost:8050/mcp
 *       tool-name: execute_code
 *       files-endpoint: http://localhost:8080   # DIAL, receives the files the code produced
 *       api-key:                                # used when the request carries no key of its own
 *       timeout-seconds: 120
 */
@ConfigurationProperties(prefix = "agent.tools.python-interpreter")
public record PythonInterpreterProperties(
        @DefaultValue("false")                     boolean enabled,
        @DefaultValue("http://localhost:8050/mcp") String url,
        @DefaultValue("execute_code")              String toolName,
        @DefaultValue("http://localhost:8080")     String filesEndpoint,
        String apiKey,
        @DefaultValue("120")                       int timeoutSeconds
) {}
