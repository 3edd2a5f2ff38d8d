package com.openforge.toolrelay.tool;

import java.util.List;

/**
 * Supplies tools that are only known at runtime (e.g. listed by a remote server).
 * Called once, when the registry is first needed.
 */
public interface ToolSource {

    List<AgentTool> loadTools();
}
