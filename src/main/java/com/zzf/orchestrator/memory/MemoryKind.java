package com.zzf.orchestrator.memory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum MemoryKind {
    NOTE,
    FACT,
    PREFERENCE,
    TASK,
    CONTEXT;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<MemoryKind> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (MemoryKind kind : values()) {
            if (kind.name().equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    static MemoryKind fromJson(String value) {
        return fromValue(value).orElseThrow(() -> new IllegalArgumentException("Unknown memory kind: " + value));
    }
}
