package com.zzf.orchestrator.memory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Set;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
class IndexEntry {
    /** Byte offset of the current record in the log. */
    private long offset;
    private MemoryKind kind;
    private Set<String> tags = new LinkedHashSet<>();
    private double importance;
    private long createdAt;
    private long updatedAt;

    static IndexEntry of(long offset, MemoryEntry entry) {
        return new IndexEntry(offset, entry.getKind(),
                entry.getTags() == null ? new LinkedHashSet<>() : new LinkedHashSet<>(entry.getTags()),
                entry.getImportance(), entry.getCreatedAt(), entry.getUpdatedAt());
    }
}
