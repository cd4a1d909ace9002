package com.zzf.orchestrator.config;

import com.zzf.orchestrator.core.plan.ExecutionMode;
import com.zzf.orchestrator.core.tool.ToolDescriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only configuration snapshot taken at the start of a turn. Toggling a tool while a turn is
 * in flight affects the next turn only.
 */
public final class TurnConfig {
    private final ExecutionMode mode;
    private final Map<String, ToolDescriptor> enabledTools;
    private final Map<String, ToolSettings> settings;
    private final int defaultTimeoutSeconds;
    private final int maxTimeoutSeconds;

    public TurnConfig(ExecutionMode mode,
                      Map<String, ToolDescriptor> enabledTools,
                      Map<String, ToolSettings> settings,
                      int defaultTimeoutSeconds,
                      int maxTimeoutSeconds) {
        this.mode = mode;
        this.enabledTools = Collections.unmodifiableMap(new LinkedHashMap<>(enabledTools));
        Map<String, ToolSettings> copies = new LinkedHashMap<>();
        settings.forEach((name, value) -> copies.put(name, value.copy()));
        this.settings = Collections.unmodifiableMap(copies);
        this.defaultTimeoutSeconds = defaultTimeoutSeconds;
        this.maxTimeoutSeconds = maxTimeoutSeconds;
    }

    public ExecutionMode getMode() {
        return mode;
    }

    public boolean isToolEnabled(String name) {
        return name != null && enabledTools.containsKey(name);
    }

    public boolean hasEnabledTools() {
        return !enabledTools.isEmpty();
    }

    public Optional<ToolDescriptor> descriptor(String name) {
        return Optional.ofNullable(name == null ? null : enabledTools.get(name));
    }

    public List<ToolDescriptor> enabledDescriptors() {
        return new ArrayList<>(enabledTools.values());
    }

    public Set<String> enabledToolNames() {
        return enabledTools.keySet();
    }

    /**
     * Registry settings for a tool; a copy, never null.
     */
    public ToolSettings settings(String name) {
        ToolSettings found = name == null ? null : settings.get(name);
        if (found == null) {
            return ToolSettings.builder().name(name).enabled(isToolEnabled(name)).build();
        }
        return found.copy();
    }

    public int getDefaultTimeoutSeconds() {
        return defaultTimeoutSeconds;
    }

    public int getMaxTimeoutSeconds() {
        return maxTimeoutSeconds;
    }
}
