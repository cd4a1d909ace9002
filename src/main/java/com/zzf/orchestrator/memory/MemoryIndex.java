package com.zzf.orchestrator.memory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Current record per live id plus every id ever written. Persisted to {@code index.json} as a
 * cache; {@link #logSize} records the log length it was built from.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
class MemoryIndex {
    private Map<String, IndexEntry> current = new LinkedHashMap<>();
    private Set<String> knownIds = new LinkedHashSet<>();
    private long logSize;
    private long lastUpdated;

    void apply(MemoryRecord record, long offset) {
        if (record.getId() == null) {
            return;
        }
        knownIds.add(record.getId());
        if (record.isPut()) {
            current.put(record.getId(), IndexEntry.of(offset, record.getEntry()));
        } else if (record.isDelete()) {
            current.remove(record.getId());
        }
        lastUpdated = Math.max(lastUpdated, record.getTs());
    }

    boolean isCurrent(String id, long offset) {
        IndexEntry entry = current.get(id);
        return entry != null && entry.getOffset() == offset;
    }
}
