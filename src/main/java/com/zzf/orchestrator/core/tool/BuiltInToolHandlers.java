package com.zzf.orchestrator.core.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.orchestrator.memory.MemoryEntry;
import com.zzf.orchestrator.memory.MemoryKind;
import com.zzf.orchestrator.memory.MemoryManager;
import com.zzf.orchestrator.memory.MemoryPatch;
import com.zzf.orchestrator.memory.MemorySearchQuery;
import com.zzf.orchestrator.memory.MemoryStore;
import com.zzf.orchestrator.memory.StoreOutcome;
import com.zzf.orchestrator.core.util.StringUtils;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The closed set of tools this service offers. Memory tools operate on the default memory
 * instance.
 */
public final class BuiltInToolHandlers {
    public static final Set<String> MEMORY_TOOLS = Set.of(
            "add_memory", "search_memories", "get_memory", "update_memory", "delete_memory", "get_memory_stats");
    private static final List<String> KIND_VALUES = List.of("note", "fact", "preference", "task", "context");

    private BuiltInToolHandlers() {}

    public static void registerAll(ToolRegistry registry, MemoryManager memoryManager, CommandExecutor commandExecutor, ObjectMapper mapper) {
        registry.register(new AddMemoryTool(memoryManager, mapper));
        registry.register(new SearchMemoriesTool(memoryManager, mapper));
        registry.register(new GetMemoryTool(memoryManager, mapper));
        registry.register(new UpdateMemoryTool(memoryManager, mapper));
        registry.register(new DeleteMemoryTool(memoryManager, mapper));
        registry.register(new MemoryStatsTool(memoryManager, mapper));
        registry.register(new FileAccessTool(mapper));
        registry.register(new CommandExecTool(commandExecutor, mapper));
    }

    private static ParameterSpec kindParameter(String name, String description) {
        ParameterSpec.ParameterSpecBuilder builder = ParameterSpec.builder()
                .name(name)
                .type(ParameterType.STRING)
                .description(description);
        KIND_VALUES.forEach(builder::allowedValue);
        return builder.build();
    }

    private static ParameterSpec importanceParameter(String description) {
        return ParameterSpec.builder()
                .name("importance")
                .type(ParameterType.NUMBER)
                .description(description)
                .minimum(0.0)
                .maximum(1.0)
                .build();
    }

    private static ToolDescriptor.ToolDescriptorBuilder memoryDescriptor(String name, String description, ToolCategory category) {
        return ToolDescriptor.builder()
                .name(name)
                .description(description)
                .category(category)
                .requiresApproval(false)
                .streamable(false)
                .targetKind(TargetKind.NONE);
    }

    /**
     * Base for the memory tools: resolves the default store and maps store outcomes to results.
     */
    private abstract static class MemoryTool implements ToolHandler {
        protected final MemoryManager memoryManager;
        protected final ObjectMapper mapper;
        private final ToolDescriptor descriptor;

        MemoryTool(MemoryManager memoryManager, ObjectMapper mapper, ToolDescriptor descriptor) {
            this.memoryManager = memoryManager;
            this.mapper = mapper;
            this.descriptor = descriptor;
        }

        @Override
        public ToolDescriptor descriptor() {
            return descriptor;
        }

        @Override
        public ToolResult execute(ToolExecution execution) {
            Optional<MemoryStore> store = memoryManager.getDefaultStore();
            if (store.isEmpty()) {
                return ToolResult.error(descriptor.getName(), "no memory instance is enabled");
            }
            return run(store.get(), execution);
        }

        abstract ToolResult run(MemoryStore store, ToolExecution execution);

        ToolResult failure(StoreOutcome<?> outcome) {
            ToolResult result = ToolResult.error(descriptor.getName(), outcome.getMessage());
            switch (outcome.getStatus()) {
                case NOT_FOUND:
                    return result.withHint("Use search_memories to find valid memory ids.");
                case CAPACITY_EXCEEDED:
                    return result.withHint("Delete obsolete memories or raise max_entries.");
                case IO_ERROR:
                    return result.withHint("Memory storage failed; the entry was not changed.");
                default:
                    return result;
            }
        }

        ObjectNode entryNode(MemoryEntry entry) {
            return mapper.valueToTree(entry);
        }
    }

    private static final class AddMemoryTool extends MemoryTool {
        private AddMemoryTool(MemoryManager memoryManager, ObjectMapper mapper) {
            super(memoryManager, mapper, memoryDescriptor("add_memory",
                    "Store a new piece of information in long-term memory. Use this to remember important facts, "
                            + "preferences, tasks, or context that should be recalled in future conversations.",
                    ToolCategory.SIDE_EFFECTING)
                    .parameter(ParameterSpec.required("content", ParameterType.STRING, "The information to remember. Be specific and clear."))
                    .parameter(kindParameter("memory_type", "Type of memory: note, fact, preference, task or context (default note)"))
                    .parameter(kindParameter("kind", "Alias of memory_type"))
                    .parameter(ParameterSpec.optional("tags", ParameterType.STRING_LIST, "Tags for categorizing and finding this memory later"))
                    .parameter(importanceParameter("Importance from 0.0 (trivial) to 1.0 (critical); default 0.5"))
                    .build());
        }

        @Override
        ToolResult run(MemoryStore store, ToolExecution execution) {
            String kindValue = StringUtils.firstNonBlank(execution.string("memory_type"), execution.string("kind"), "note");
            MemoryKind kind = MemoryKind.fromValue(kindValue).orElse(MemoryKind.NOTE);
            Double importance = execution.number("importance");
            StoreOutcome<MemoryEntry> outcome = store.add(
                    execution.string("content"),
                    kind,
                    new LinkedHashSet<>(execution.stringList("tags")),
                    importance == null ? 0.5 : importance,
                    "llm");
            if (!outcome.isOk()) {
                return failure(outcome);
            }
            MemoryEntry entry = outcome.getValue().orElseThrow();
            ObjectNode out = mapper.createObjectNode();
            out.put("memory_id", entry.getId());
            out.put("message", "Memory stored successfully with ID: " + entry.getId());
            return ToolResult.ok("add_memory", out);
        }
    }

    private static final class SearchMemoriesTool extends MemoryTool {
        private SearchMemoriesTool(MemoryManager memoryManager, ObjectMapper mapper) {
            super(memoryManager, mapper, memoryDescriptor("search_memories",
                    "Search for relevant memories. Use this to recall information from previous conversations "
                            + "or to check if something is already remembered.",
                    ToolCategory.READ_ONLY)
                    .streamable(true)
                    .parameter(ParameterSpec.optional("query", ParameterType.STRING, "Keyword to search for in memory content (case-insensitive)"))
                    .parameter(ParameterSpec.optional("tags", ParameterType.STRING_LIST, "Filter by tags (any match)"))
                    .parameter(kindParameter("memory_type", "Filter by memory type"))
                    .parameter(kindParameter("kind", "Alias of memory_type"))
                    .parameter(ParameterSpec.builder().name("min_importance").type(ParameterType.NUMBER)
                            .description("Only return memories with importance >= this value").minimum(0.0).maximum(1.0).build())
                    .parameter(ParameterSpec.builder().name("limit").type(ParameterType.INTEGER)
                            .description("Maximum number of results (default 10, at most 50)").minimum(1.0).build())
                    .build());
        }

        @Override
        ToolResult run(MemoryStore store, ToolExecution execution) {
            String kindValue = StringUtils.firstNonBlank(execution.string("memory_type"), execution.string("kind"));
            Long limit = execution.integer("limit");
            List<String> tags = execution.stringList("tags");
            MemorySearchQuery query = MemorySearchQuery.builder()
                    .query(execution.string("query"))
                    .tags(tags.isEmpty() ? null : new LinkedHashSet<>(tags))
                    .kind(MemoryKind.fromValue(kindValue).orElse(null))
                    .minImportance(execution.number("min_importance"))
                    .limit(limit == null ? null : (int) Math.min(limit, Integer.MAX_VALUE))
                    .build();
            List<MemoryEntry> found = store.search(query);
            ObjectNode out = mapper.createObjectNode();
            out.put("count", found.size());
            ArrayNode memories = out.putArray("memories");
            for (MemoryEntry entry : found) {
                memories.add(entryNode(entry));
            }
            return ToolResult.ok("search_memories", out);
        }
    }

    private static final class GetMemoryTool extends MemoryTool {
        private GetMemoryTool(MemoryManager memoryManager, ObjectMapper mapper) {
            super(memoryManager, mapper, memoryDescriptor("get_memory",
                    "Retrieve a specific memory by its ID. Use this when you have a memory ID from a previous search.",
                    ToolCategory.READ_ONLY)
                    .streamable(true)
                    .parameter(ParameterSpec.required("memory_id", ParameterType.STRING, "The unique ID of the memory to retrieve"))
                    .build());
        }

        @Override
        ToolResult run(MemoryStore store, ToolExecution execution) {
            StoreOutcome<MemoryEntry> outcome = store.get(execution.string("memory_id"));
            if (!outcome.isOk()) {
                return failure(outcome);
            }
            return ToolResult.ok("get_memory", entryNode(outcome.getValue().orElseThrow()));
        }
    }

    private static final class UpdateMemoryTool extends MemoryTool {
        private UpdateMemoryTool(MemoryManager memoryManager, ObjectMapper mapper) {
            super(memoryManager, mapper, memoryDescriptor("update_memory",
                    "Update an existing memory. Use this to correct outdated information or add details to existing memories.",
                    ToolCategory.SIDE_EFFECTING)
                    .parameter(ParameterSpec.required("memory_id", ParameterType.STRING, "The unique ID of the memory to update"))
                    .parameter(ParameterSpec.optional("content", ParameterType.STRING, "New content (replaces existing content if provided)"))
                    .parameter(ParameterSpec.optional("tags", ParameterType.STRING_LIST, "New tags (replace existing tags if provided)"))
                    .parameter(importanceParameter("New importance (replaces existing if provided)"))
                    .build());
        }

        @Override
        ToolResult run(MemoryStore store, ToolExecution execution) {
            Set<String> tags = execution.has("tags") ? new LinkedHashSet<>(execution.stringList("tags")) : null;
            MemoryPatch patch = MemoryPatch.builder()
                    .content(execution.string("content"))
                    .tags(tags)
                    .importance(execution.number("importance"))
                    .build();
            StoreOutcome<MemoryEntry> outcome = store.update(execution.string("memory_id"), patch);
            if (!outcome.isOk()) {
                return failure(outcome);
            }
            ObjectNode out = mapper.createObjectNode();
            out.put("memory_id", outcome.getValue().orElseThrow().getId());
            out.put("message", "Memory updated successfully");
            out.set("memory", entryNode(outcome.getValue().orElseThrow()));
            return ToolResult.ok("update_memory", out);
        }
    }

    private static final class DeleteMemoryTool extends MemoryTool {
        private DeleteMemoryTool(MemoryManager memoryManager, ObjectMapper mapper) {
            super(memoryManager, mapper, memoryDescriptor("delete_memory",
                    "Delete a memory that is no longer needed or is incorrect. Use this carefully as deletion is permanent.",
                    ToolCategory.SIDE_EFFECTING)
                    .parameter(ParameterSpec.required("memory_id", ParameterType.STRING, "The unique ID of the memory to delete"))
                    .build());
        }

        @Override
        ToolResult run(MemoryStore store, ToolExecution execution) {
            StoreOutcome<String> outcome = store.delete(execution.string("memory_id"));
            if (!outcome.isOk()) {
                return failure(outcome);
            }
            ObjectNode out = mapper.createObjectNode();
            out.put("memory_id", outcome.getValue().orElseThrow());
            out.put("message", "Memory deleted successfully");
            return ToolResult.ok("delete_memory", out);
        }
    }

    private static final class MemoryStatsTool extends MemoryTool {
        private MemoryStatsTool(MemoryManager memoryManager, ObjectMapper mapper) {
            super(memoryManager, mapper, memoryDescriptor("get_memory_stats",
                    "Get statistics about the memory system (total entries, types, etc.).",
                    ToolCategory.READ_ONLY)
                    .streamable(true)
                    .build());
        }

        @Override
        ToolResult run(MemoryStore store, ToolExecution execution) {
            return ToolResult.ok("get_memory_stats", mapper.valueToTree(store.stats()));
        }
    }
}
