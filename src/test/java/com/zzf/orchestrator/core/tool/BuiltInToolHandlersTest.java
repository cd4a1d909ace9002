package com.zzf.orchestrator.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.orchestrator.memory.MemoryKind;
import com.zzf.orchestrator.memory.MemoryManager;
import com.zzf.orchestrator.memory.MemorySearchQuery;
import com.zzf.orchestrator.memory.MemoryStore;
import com.zzf.orchestrator.shell.ShellService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BuiltInToolHandlersTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ArgumentCoercer coercer = new ArgumentCoercer(mapper);
    private ToolRegistry registry;
    private MemoryStore store;

    @TempDir
    Path dir;

    @BeforeEach
    void setUp() throws Exception {
        Path registryFile = dir.resolve("memory_registry.json");
        Files.writeString(registryFile, "{\"memories\":[{\"name\":\"main_memory\",\"enabled\":true}]}");
        MemoryManager memoryManager = new MemoryManager(registryFile, mapper);
        store = memoryManager.getDefaultStore().orElseThrow();
        registry = new ToolRegistry();
        BuiltInToolHandlers.registerAll(registry, memoryManager, new CommandExecutor(new ShellService(), 1024), mapper);
    }

    @Test
    void shouldRegisterTheClosedToolSet() {
        assertEquals(8, registry.listDescriptors().size());
        for (String name : BuiltInToolHandlers.MEMORY_TOOLS) {
            assertTrue(registry.contains(name), name);
        }
        assertTrue(registry.contains(FileAccessTool.NAME));
        assertTrue(registry.contains(CommandExecTool.NAME));
        assertThrows(IllegalArgumentException.class, () -> registry.register(new FileAccessTool(mapper)));
    }

    @Test
    void addMemoryAcceptsKindAlias() throws Exception {
        ToolResult result = run("add_memory", Map.of("content", "User's name is Matt", "kind", "fact", "tags", "personal,name"));

        assertTrue(result.isSuccess());
        String id = result.getData().get("memory_id").asText();
        assertEquals(MemoryKind.FACT, store.get(id).getValue().orElseThrow().getKind());
        assertEquals(1, store.search(MemorySearchQuery.builder().query("Matt").build()).size());
    }

    @Test
    void addMemoryDefaultsToNoteWithMediumImportance() throws Exception {
        ToolResult result = run("add_memory", Map.of("content", "bring umbrella"));

        String id = result.getData().get("memory_id").asText();
        assertEquals(MemoryKind.NOTE, store.get(id).getValue().orElseThrow().getKind());
        assertEquals(0.5, store.get(id).getValue().orElseThrow().getImportance());
    }

    @Test
    void searchUpdateAndDeleteRoundTrip() throws Exception {
        String id = run("add_memory", Map.of("content", "prefers tea", "memory_type", "preference", "importance", "0.8"))
                .getData().get("memory_id").asText();

        JsonNode found = run("search_memories", Map.of("query", "tea", "kind", "preference")).getData();
        assertEquals(1, found.get("count").asInt());
        assertEquals(id, found.get("memories").get(0).get("id").asText());

        ToolResult updated = run("update_memory", Map.of("memory_id", id, "content", "prefers green tea"));
        assertEquals("prefers green tea", updated.getData().get("memory").get("content").asText());

        ToolResult fetched = run("get_memory", Map.of("memory_id", id));
        assertEquals("preference", fetched.getData().get("kind").asText());

        assertTrue(run("delete_memory", Map.of("memory_id", id)).isSuccess());
        ToolResult missing = run("get_memory", Map.of("memory_id", id));
        assertFalse(missing.isSuccess());
        assertTrue(missing.getHint().contains("search_memories"));
    }

    @Test
    void statsReportStoreContents() throws Exception {
        run("add_memory", Map.of("content", "a", "kind", "task"));

        JsonNode stats = run("get_memory_stats", Map.of()).getData();

        assertEquals("main_memory", stats.get("memory_name").asText());
        assertEquals(1, stats.get("total_entries").asInt());
        assertEquals(1, stats.get("entry_types").get("task").asInt());
    }

    @Test
    void readToolsAreStreamableAndWritesAreNot() {
        assertTrue(registry.get("search_memories").orElseThrow().descriptor().isStreamable());
        assertTrue(registry.get("get_memory_stats").orElseThrow().descriptor().isStreamable());
        assertFalse(registry.get("add_memory").orElseThrow().descriptor().isStreamable());
        assertTrue(registry.get("add_memory").orElseThrow().descriptor().isSideEffecting());
    }

    private ToolResult run(String tool, Map<String, String> raw) throws Exception {
        ToolHandler handler = registry.get(tool).orElseThrow();
        ToolExecution execution = ToolExecution.builder()
                .callId("call_" + tool)
                .toolName(tool)
                .arguments(coercer.coerce(handler.descriptor(), raw))
                .timeout(Duration.ofSeconds(5))
                .build();
        return handler.execute(execution);
    }
}
