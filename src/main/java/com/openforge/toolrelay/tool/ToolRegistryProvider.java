package com.openforge.toolrelay.tool;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the shared {@link ToolRegistry} on first use.
 *
 * Tool beans are registered first, then the tools of every {@link ToolSource}
 * (remote servers are only contacted here, not at startup).  Initialization
 * runs exactly once even when the first requests arrive concurrently.
 */
@Slf4j
@Component
public class ToolRegistryProvider {

    private final ObjectProvider<AgentTool>  toolBeans;
    private final ObjectProvider<ToolSource> toolSources;

    private volatile ToolRegistry registry;

    public ToolRegistryProvider(ObjectProvider<AgentTool> toolBeans,
                                ObjectProvider<ToolSource> toolSources) {
        this.toolBeans   = toolBeans;
        this.toolSources = toolSources;
    }

    public ToolRegistry get() {
        ToolRegistry current = registry;
        if (current != null) {
            return current;
        }
        synchronized (this) {
            if (registry == null) {
                registry = build();
            }
            return registry;
        }
    }

    private ToolRegistry build() {
        List<AgentTool> tools = new ArrayList<>();
        toolBeans.orderedStream().forEach(tools::add);
        toolSources.orderedStream().forEach(source -> tools.addAll(source.loadTools()));

        ToolRegistry built = ToolRegistry.of(tools);
        log.info("[ToolRegistry] Registered {} tool(s): {}", built.size(), built.names());
        return built;
    }
}
