package com.zzf.orchestrator.memory;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class MemoryStats {
    @JsonProperty("memory_name")
    String memoryName;
    @JsonProperty("total_entries")
    int totalEntries;
    @JsonProperty("max_entries")
    int maxEntries;
    @JsonProperty("entry_types")
    Map<String, Long> countsByKind;
    @JsonProperty("size_bytes")
    long sizeBytes;
    @JsonProperty("last_updated")
    long lastUpdated;
    @JsonProperty("average_importance")
    double averageImportance;
    @JsonProperty("total_accesses")
    long totalAccesses;
}
