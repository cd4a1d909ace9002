package com.zzf.orchestrator.core.tool;

import com.zzf.orchestrator.config.ToolSettings;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A single authorized call handed to a handler, with arguments already coerced to their declared
 * types.
 */
@Value
@Builder
public class ToolExecution {
    String callId;
    String toolName;
    Map<String, Object> arguments;
    Duration timeout;
    ToolSettings settings;

    public String string(String name) {
        Object value = arguments.get(name);
        return value == null ? null : value.toString();
    }

    public Long integer(String name) {
        Object value = arguments.get(name);
        return value instanceof Number ? ((Number) value).longValue() : null;
    }

    public Double number(String name) {
        Object value = arguments.get(name);
        return value instanceof Number ? ((Number) value).doubleValue() : null;
    }

    public Boolean bool(String name) {
        Object value = arguments.get(name);
        return value instanceof Boolean ? (Boolean) value : null;
    }

    @SuppressWarnings("unchecked")
    public List<String> stringList(String name) {
        Object value = arguments.get(name);
        return value instanceof List ? (List<String>) value : Collections.emptyList();
    }

    public boolean has(String name) {
        return arguments.containsKey(name);
    }
}
