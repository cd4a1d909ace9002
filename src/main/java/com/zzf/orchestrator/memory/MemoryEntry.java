package com.zzf.orchestrator.memory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One stored memory. Timestamps are epoch milliseconds. The store hands out copies only.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MemoryEntry {
    private String id;
    @JsonProperty("created_at")
    private long createdAt;
    @JsonProperty("updated_at")
    private long updatedAt;
    @JsonProperty("last_accessed")
    private long lastAccessed;
    private MemoryKind kind;
    private String content;
    @Builder.Default
    private Set<String> tags = new LinkedHashSet<>();
    private double importance;
    @JsonProperty("access_count")
    private long accessCount;
    private String source;

    public MemoryEntry copy() {
        return toBuilder().tags(tags == null ? new LinkedHashSet<>() : new LinkedHashSet<>(tags)).build();
    }
}
