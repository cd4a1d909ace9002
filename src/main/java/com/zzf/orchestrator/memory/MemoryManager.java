package com.zzf.orchestrator.memory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.orchestrator.model.ConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Opens one {@link MemoryStore} per enabled instance of the memory registry. Instance directories
 * are resolved against the registry file's directory.
 */
@Slf4j
public class MemoryManager {
    private final Path registryPath;
    private final List<MemoryInstanceSettings> instances;
    private final Map<String, MemoryStore> stores = new LinkedHashMap<>();

    public MemoryManager(Path registryPath, ObjectMapper mapper) {
        this.registryPath = registryPath.toAbsolutePath().normalize();
        this.instances = Collections.unmodifiableList(loadRegistry(this.registryPath, mapper));
        for (MemoryInstanceSettings instance : instances) {
            if (!instance.isEnabled()) {
                continue;
            }
            Path directory = resolveDirectory(instance);
            try {
                stores.put(instance.getName(), new MemoryStore(instance.getName(), directory, instance.getMaxEntries(), mapper));
            } catch (IOException e) {
                throw new ConfigurationException("Cannot open memory instance '" + instance.getName() + "' at " + directory, e);
            }
        }
        log.info("memory.registry path={} instances={} enabled={}", this.registryPath, instances.size(), stores.keySet());
    }

    public boolean hasEnabledMemories() {
        return !stores.isEmpty();
    }

    /**
     * The first enabled instance in registry order.
     */
    public Optional<MemoryStore> getDefaultStore() {
        return stores.values().stream().findFirst();
    }

    public Optional<MemoryStore> getStore(String name) {
        if (name == null || name.isBlank()) {
            return getDefaultStore();
        }
        return Optional.ofNullable(stores.get(name.trim()));
    }

    public List<MemoryInstanceSettings> listInstances() {
        return instances;
    }

    public Path getRegistryPath() {
        return registryPath;
    }

    private Path resolveDirectory(MemoryInstanceSettings instance) {
        String raw = instance.getDirectory() == null || instance.getDirectory().isBlank()
                ? instance.getName()
                : instance.getDirectory().trim();
        Path path = Path.of(raw);
        if (path.isAbsolute()) {
            return path.normalize();
        }
        Path base = registryPath.getParent() == null ? Path.of(".") : registryPath.getParent();
        return base.resolve(path).normalize();
    }

    private static List<MemoryInstanceSettings> loadRegistry(Path path, ObjectMapper mapper) {
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("Memory registry not found: " + path);
        }
        try {
            JsonNode root = mapper.readTree(path.toFile());
            JsonNode memories = root == null ? null : root.get("memories");
            if (memories == null || !memories.isArray()) {
                throw new ConfigurationException("Memory registry has no 'memories' array: " + path);
            }
            List<MemoryInstanceSettings> out = new ArrayList<>();
            for (JsonNode node : memories) {
                MemoryInstanceSettings settings = mapper.treeToValue(node, MemoryInstanceSettings.class);
                if (settings.getName() == null || settings.getName().isBlank()) {
                    throw new ConfigurationException("Memory registry entry without a name: " + path);
                }
                out.add(settings);
            }
            return out;
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read memory registry " + path, e);
        }
    }
}
