package com.zzf.orchestrator.memory;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

@Value
@Builder
public class MemorySearchQuery {
    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT = 50;

    /** Case-insensitive substring of the content. */
    String query;
    /** Matches entries carrying any of these tags. */
    Set<String> tags;
    MemoryKind kind;
    Double minImportance;
    Integer limit;

    public int effectiveLimit() {
        if (limit == null || limit <= 0) {
            return DEFAULT_LIMIT;
        }
        return Math.min(limit, MAX_LIMIT);
    }

    public static MemorySearchQuery all() {
        return MemorySearchQuery.builder().build();
    }
}
