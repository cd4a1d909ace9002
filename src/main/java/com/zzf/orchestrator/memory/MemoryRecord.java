package com.zzf.orchestrator.memory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One line of {@code memory.jsonl}: either the full state of an entry or a tombstone.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
class MemoryRecord {
    static final String PUT = "put";
    static final String DELETE = "delete";

    private String op;
    private String id;
    private long ts;
    private MemoryEntry entry;

    static MemoryRecord put(MemoryEntry entry, long ts) {
        return new MemoryRecord(PUT, entry.getId(), ts, entry);
    }

    static MemoryRecord tombstone(String id, long ts) {
        return new MemoryRecord(DELETE, id, ts, null);
    }

    boolean isPut() {
        return PUT.equals(op) && entry != null;
    }

    boolean isDelete() {
        return DELETE.equals(op);
    }
}
