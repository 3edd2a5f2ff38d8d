package com.openforge.toolrelay.tool.mcp;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One entry of a tools/list result.  The input schema is kept verbatim.
 */
public record McpToolDescriptor(
        String name,
        String description,
        JsonNode inputSchema
) {}
