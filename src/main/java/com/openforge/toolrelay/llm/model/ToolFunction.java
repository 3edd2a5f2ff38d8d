package com.openforge.toolrelay.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * The "function" sub-object inside a Tool definition.
 *
 * "parameters" is a JsonNode so that a JSON Schema coming from a remote
 * server is re-serialized verbatim, without an intermediate POJO mapping.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolFunction(
        String name,
        String description,
        JsonNode parameters
) {}
