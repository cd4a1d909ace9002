package com.zzf.orchestrator.api;

import com.zzf.orchestrator.core.util.StringUtils;
import com.zzf.orchestrator.memory.MemoryEntry;
import com.zzf.orchestrator.memory.MemoryKind;
import com.zzf.orchestrator.memory.MemoryManager;
import com.zzf.orchestrator.memory.MemoryPatch;
import com.zzf.orchestrator.memory.MemorySearchQuery;
import com.zzf.orchestrator.memory.MemoryStats;
import com.zzf.orchestrator.memory.MemoryStore;
import com.zzf.orchestrator.memory.StoreOutcome;
import com.zzf.orchestrator.model.OrchestratorException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Direct access to a memory store, bypassing the model. {@code memory} selects a store by name;
 * the first enabled store is used otherwise.
 */
@RestController
@RequestMapping("/api/memory")
@RequiredArgsConstructor
public class MemoryController {

    private static final double DEFAULT_IMPORTANCE = 0.5;

    private final MemoryManager memoryManager;

    public static class MemoryRequest {
        public String content;
        public String kind;
        public List<String> tags;
        public Double importance;
    }

    @GetMapping
    public List<MemoryEntry> search(@RequestParam(required = false) String memory,
                                    @RequestParam(required = false) String query,
                                    @RequestParam(required = false) List<String> tags,
                                    @RequestParam(required = false) String kind,
                                    @RequestParam(required = false) Double minImportance,
                                    @RequestParam(required = false) Integer limit) {
        MemorySearchQuery search = MemorySearchQuery.builder()
                .query(query)
                .tags(tags == null ? null : new LinkedHashSet<>(tags))
                .kind(parseKind(kind))
                .minImportance(minImportance)
                .limit(limit)
                .build();
        return store(memory).search(search);
    }

    @GetMapping("/stats")
    public MemoryStats stats(@RequestParam(required = false) String memory) {
        return store(memory).stats();
    }

    @GetMapping("/{id}")
    public ResponseEntity<Object> get(@PathVariable String id, @RequestParam(required = false) String memory) {
        return respond(store(memory).get(id), HttpStatus.OK);
    }

    @PostMapping
    public ResponseEntity<Object> add(@RequestBody MemoryRequest request, @RequestParam(required = false) String memory) {
        if (request == null || StringUtils.isBlank(request.content)) {
            throw new OrchestratorException("INVALID_REQUEST", "content is required");
        }
        MemoryKind kind = StringUtils.isBlank(request.kind) ? MemoryKind.NOTE : parseKind(request.kind);
        double importance = request.importance == null ? DEFAULT_IMPORTANCE : request.importance;
        return respond(store(memory).add(request.content, kind, toTags(request.tags), importance, "api"), HttpStatus.CREATED);
    }

    @PatchMapping("/{id}")
    public ResponseEntity<Object> update(@PathVariable String id,
                                         @RequestBody MemoryRequest request,
                                         @RequestParam(required = false) String memory) {
        if (request == null) {
            throw new OrchestratorException("INVALID_REQUEST", "request body is required");
        }
        MemoryPatch patch = MemoryPatch.builder()
                .content(request.content)
                .tags(request.tags == null ? null : toTags(request.tags))
                .importance(request.importance)
                .kind(StringUtils.isBlank(request.kind) ? null : parseKind(request.kind))
                .build();
        return respond(store(memory).update(id, patch), HttpStatus.OK);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Object> delete(@PathVariable String id, @RequestParam(required = false) String memory) {
        return respond(store(memory).delete(id), HttpStatus.OK);
    }

    private MemoryStore store(String name) {
        if (StringUtils.isBlank(name)) {
            return memoryManager.getDefaultStore()
                    .orElseThrow(() -> new OrchestratorException("MEMORY_UNAVAILABLE", "No memory instance is enabled"));
        }
        return memoryManager.getStore(name.trim())
                .orElseThrow(() -> new OrchestratorException("MEMORY_UNAVAILABLE", "Unknown or disabled memory: " + name));
    }

    private static MemoryKind parseKind(String kind) {
        if (StringUtils.isBlank(kind)) {
            return null;
        }
        return MemoryKind.fromValue(kind)
                .orElseThrow(() -> new OrchestratorException("INVALID_REQUEST", "Unknown memory kind: " + kind));
    }

    private static Set<String> toTags(List<String> tags) {
        Set<String> out = new LinkedHashSet<>();
        if (tags != null) {
            for (String tag : tags) {
                if (!StringUtils.isBlank(tag)) {
                    out.add(tag.trim());
                }
            }
        }
        return out;
    }

    private static ResponseEntity<Object> respond(StoreOutcome<?> outcome, HttpStatus okStatus) {
        if (outcome.isOk()) {
            Object body = outcome.getValue().orElse(null);
            if (body instanceof String) {
                Map<String, Object> deleted = new LinkedHashMap<>();
                deleted.put("memory_id", body);
                deleted.put("status", "deleted");
                body = deleted;
            }
            return ResponseEntity.status(okStatus).body(body);
        }
        HttpStatus status;
        switch (outcome.getStatus()) {
            case NOT_FOUND:
                status = HttpStatus.NOT_FOUND;
                break;
            case CAPACITY_EXCEEDED:
                status = HttpStatus.CONFLICT;
                break;
            case IO_ERROR:
                status = HttpStatus.INTERNAL_SERVER_ERROR;
                break;
            default:
                status = HttpStatus.BAD_REQUEST;
        }
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("status", outcome.getStatus().name().toLowerCase());
        error.put("error", outcome.getMessage());
        return ResponseEntity.status(status).body(error);
    }
}
