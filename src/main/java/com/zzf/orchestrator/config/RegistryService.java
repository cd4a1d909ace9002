package com.zzf.orchestrator.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.orchestrator.core.plan.ExecutionMode;
import com.zzf.orchestrator.core.tool.BuiltInToolHandlers;
import com.zzf.orchestrator.core.tool.ToolDescriptor;
import com.zzf.orchestrator.core.tool.ToolRegistry;
import com.zzf.orchestrator.memory.MemoryManager;
import com.zzf.orchestrator.model.ConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the tool registry file and the runtime enable/disable overrides, and hands out immutable
 * {@link TurnConfig} snapshots. Overrides live for the running process only.
 */
@Slf4j
public class RegistryService {
    private final Path registryPath;
    private final ToolRegistry toolRegistry;
    private final MemoryManager memoryManager;
    private final ExecutionMode mode;
    private final OrchestratorProperties.Policy policy;
    private final Map<String, ToolSettings> settings;
    private final Map<String, Boolean> overrides = new ConcurrentHashMap<>();

    public RegistryService(Path registryPath,
                           ToolRegistry toolRegistry,
                           MemoryManager memoryManager,
                           ExecutionMode mode,
                           OrchestratorProperties.Policy policy,
                           ObjectMapper mapper) {
        this.registryPath = registryPath.toAbsolutePath().normalize();
        this.toolRegistry = toolRegistry;
        this.memoryManager = memoryManager;
        this.mode = mode;
        this.policy = policy;
        if (policy.getDefaultTimeoutSeconds() < 1 || policy.getMaxTimeoutSeconds() < 1) {
            throw new ConfigurationException("Policy timeouts must be at least 1 second");
        }
        this.settings = loadRegistry(this.registryPath, mapper);
        log.info("tools.registry path={} configured={} mode={}", this.registryPath, settings.keySet(), mode.configValue());
    }

    public TurnConfig snapshot() {
        Map<String, ToolDescriptor> enabled = new LinkedHashMap<>();
        for (ToolDescriptor descriptor : toolRegistry.listDescriptors()) {
            if (isEnabled(descriptor.getName())) {
                enabled.put(descriptor.getName(), descriptor);
            }
        }
        return new TurnConfig(mode, enabled, settings, policy.getDefaultTimeoutSeconds(), policy.getMaxTimeoutSeconds());
    }

    public ExecutionMode getMode() {
        return mode;
    }

    public boolean enable(String name) {
        return setOverride(name, Boolean.TRUE);
    }

    public boolean disable(String name) {
        return setOverride(name, Boolean.FALSE);
    }

    /**
     * Drops the runtime override so the registry file value applies again.
     */
    public boolean reset(String name) {
        if (!toolRegistry.contains(name)) {
            return false;
        }
        overrides.remove(name.trim());
        log.info("tools.reset name={}", name);
        return true;
    }

    public List<ToolView> listTools() {
        List<ToolView> out = new ArrayList<>();
        for (ToolDescriptor descriptor : toolRegistry.listDescriptors()) {
            out.add(view(descriptor));
        }
        return out;
    }

    public Optional<ToolView> getTool(String name) {
        return toolRegistry.get(name).map(handler -> view(handler.descriptor()));
    }

    private ToolView view(ToolDescriptor descriptor) {
        ToolSettings configured = settings.get(descriptor.getName());
        return ToolView.builder()
                .name(descriptor.getName())
                .description(descriptor.getDescription())
                .category(descriptor.getCategory().name())
                .configuredEnabled(configured != null && configured.isEnabled())
                .override(overrides.get(descriptor.getName()))
                .enabled(isEnabled(descriptor.getName()))
                .requiresApproval(descriptor.isRequiresApproval() || (configured != null && configured.isRequiresApproval()))
                .whitelist(configured == null ? List.of() : List.copyOf(configured.getWhitelist()))
                .rootDirectory(configured == null ? null : configured.getRootDirectory())
                .timeoutSeconds(configured == null ? null : configured.getTimeoutSeconds())
                .mode(configured == null ? null : configured.getMode())
                .build();
    }

    private boolean setOverride(String name, Boolean value) {
        if (!toolRegistry.contains(name)) {
            return false;
        }
        overrides.put(name.trim(), value);
        log.info("tools.override name={} enabled={}", name, value);
        return true;
    }

    private boolean isEnabled(String name) {
        Boolean override = overrides.get(name);
        ToolSettings configured = settings.get(name);
        boolean enabled = override != null ? override : configured != null && configured.isEnabled();
        if (enabled && BuiltInToolHandlers.MEMORY_TOOLS.contains(name) && !memoryManager.hasEnabledMemories()) {
            return false;
        }
        return enabled;
    }

    private Map<String, ToolSettings> loadRegistry(Path path, ObjectMapper mapper) {
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("Tool registry not found: " + path);
        }
        JsonNode root;
        try {
            root = mapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read tool registry " + path, e);
        }
        JsonNode tools = root == null ? null : root.get("tools");
        if (tools == null || !tools.isArray()) {
            throw new ConfigurationException("Tool registry has no 'tools' array: " + path);
        }
        Map<String, ToolSettings> loaded = new LinkedHashMap<>();
        Path base = path.getParent() == null ? Path.of(".") : path.getParent();
        for (JsonNode node : tools) {
            ToolSettings entry;
            try {
                entry = mapper.treeToValue(node, ToolSettings.class);
            } catch (IOException e) {
                throw new ConfigurationException("Invalid tool registry entry in " + path + ": " + node, e);
            }
            if (entry.getName() == null || entry.getName().isBlank()) {
                throw new ConfigurationException("Tool registry entry without a name: " + path);
            }
            entry.setName(entry.getName().trim());
            if (!toolRegistry.contains(entry.getName())) {
                log.warn("tools.registry.unknown name={}", entry.getName());
                continue;
            }
            if (entry.getWhitelist() == null) {
                entry.setWhitelist(new ArrayList<>());
            }
            if (entry.getRootDirectory() != null && !entry.getRootDirectory().isBlank()) {
                Path rootPath = Path.of(entry.getRootDirectory().trim());
                entry.setRootDirectory((rootPath.isAbsolute() ? rootPath : base.resolve(rootPath)).normalize().toString());
            }
            loaded.put(entry.getName(), entry);
        }
        return loaded;
    }
}
