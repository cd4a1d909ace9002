package com.zzf.orchestrator.memory;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Partial update; null fields keep their current value.
 */
@Value
@Builder
public class MemoryPatch {
    String content;
    Set<String> tags;
    Double importance;
    MemoryKind kind;

    public boolean isEmpty() {
        return content == null && tags == null && importance == null && kind == null;
    }
}
