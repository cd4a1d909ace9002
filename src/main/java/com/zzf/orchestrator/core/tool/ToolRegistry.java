package com.zzf.orchestrator.core.tool;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Closed set of handlers keyed by tool name. Filled once at startup.
 */
public final class ToolRegistry {
    private final Map<String, ToolHandler> handlers = new LinkedHashMap<>();

    public void register(ToolHandler handler) {
        if (handler == null) {
            return;
        }
        ToolDescriptor descriptor = handler.descriptor();
        if (descriptor == null || descriptor.getName() == null || descriptor.getName().isBlank()) {
            throw new IllegalArgumentException("Tool handler without a name: " + handler.getClass().getName());
        }
        if (handlers.containsKey(descriptor.getName())) {
            throw new IllegalArgumentException("Duplicate tool name: " + descriptor.getName());
        }
        handlers.put(descriptor.getName(), handler);
    }

    public Optional<ToolHandler> get(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(handlers.get(name.trim()));
    }

    public boolean contains(String name) {
        return get(name).isPresent();
    }

    public List<ToolDescriptor> listDescriptors() {
        List<ToolDescriptor> out = new ArrayList<>();
        for (ToolHandler handler : handlers.values()) {
            out.add(handler.descriptor());
        }
        return out;
    }
}
