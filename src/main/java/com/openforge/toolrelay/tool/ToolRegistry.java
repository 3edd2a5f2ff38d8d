package com.openforge.toolrelay.tool;

import com.openforge.toolrelay.llm.model.Tool;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only, name-keyed set of tools, each wrapped in a {@link GuardedTool}.
 *
 * Built once; safe to share between requests.  Registration order is kept so
 * the model always sees the tool list in the same order.
 */
public final class ToolRegistry {

    private final Map<String, GuardedTool> tools;

    private ToolRegistry(Map<String, GuardedTool> tools) {
        this.tools = Collections.unmodifiableMap(tools);
    }

    public static ToolRegistry of(Collection<? extends AgentTool> tools) {
        Map<String, GuardedTool> byName = new LinkedHashMap<>();
        for (AgentTool tool : tools) {
            GuardedTool guarded = tool instanceof GuardedTool g ? g : new GuardedTool(tool);
            if (byName.putIfAbsent(guarded.name(), guarded) != null) {
                throw new IllegalStateException("Duplicate tool name: " + guarded.name());
            }
        }
        return new ToolRegistry(byName);
    }

    public static ToolRegistry empty() {
        return new ToolRegistry(new LinkedHashMap<>());
    }

    public Optional<GuardedTool> lookup(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(tools.get(name));
    }

    /** Tool declarations in registration order, for the "tools" request field. */
    public List<Tool> definitions() {
        List<Tool> definitions = new ArrayList<>(tools.size());
        tools.values().forEach(tool -> definitions.add(tool.definition()));
        return List.copyOf(definitions);
    }

    public Set<String> names() {
        return tools.keySet();
    }

    public boolean isEmpty() {
        return tools.isEmpty();
    }

    public int size() {
        return tools.size();
    }
}
