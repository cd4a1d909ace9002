package com.zzf.orchestrator.memory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MemoryInstanceSettings {
    private String name;
    private boolean enabled;
    @JsonProperty("max_entries")
    @Builder.Default
    private int maxEntries = 10000;
    private String directory;
    private String description;
}
