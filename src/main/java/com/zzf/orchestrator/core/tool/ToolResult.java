package com.zzf.orchestrator.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured outcome of one tool call, rendered as JSON into the conversation.
 */
public final class ToolResult {
    private final String tool;
    private final String callId;
    private final ToolStatus status;
    private final String error;
    private final String hint;
    private final long tookMs;
    private final JsonNode result;
    private final Map<String, JsonNode> extras;

    private ToolResult(String tool, String callId, ToolStatus status, String error, String hint, long tookMs,
                       JsonNode result, Map<String, JsonNode> extras) {
        this.tool = tool == null ? "" : tool.trim();
        this.callId = callId == null ? "" : callId.trim();
        this.status = status;
        this.error = error == null ? "" : error.trim();
        this.hint = hint == null ? "" : hint.trim();
        this.tookMs = tookMs;
        this.result = result;
        this.extras = extras == null ? Collections.emptyMap() : extras;
    }

    public static ToolResult ok(String tool, JsonNode result) {
        return new ToolResult(tool, "", ToolStatus.OK, "", "", -1L, result, Collections.emptyMap());
    }

    public static ToolResult error(String tool, String error) {
        return of(ToolStatus.ERROR, tool, error);
    }

    public static ToolResult of(ToolStatus status, String tool, String error) {
        return new ToolResult(tool, "", status, error, "", -1L, null, Collections.emptyMap());
    }

    public ToolResult withCallId(String callId) {
        return new ToolResult(tool, callId, status, error, hint, tookMs, result, extras);
    }

    public ToolResult withHint(String hint) {
        return new ToolResult(tool, callId, status, error, hint, tookMs, result, extras);
    }

    public ToolResult withTookMs(long tookMs) {
        return new ToolResult(tool, callId, status, error, hint, tookMs, result, extras);
    }

    public ToolResult withExtra(String key, JsonNode value) {
        if (key == null || key.isBlank() || value == null) {
            return this;
        }
        Map<String, JsonNode> next = new LinkedHashMap<>(extras);
        next.put(key, value);
        return new ToolResult(tool, callId, status, error, hint, tookMs, result, next);
    }

    public boolean isSuccess() {
        return status == ToolStatus.OK;
    }

    public String getTool() {
        return tool;
    }

    public String getCallId() {
        return callId;
    }

    public ToolStatus getStatus() {
        return status;
    }

    public JsonNode getData() {
        return result;
    }

    public String getError() {
        return error;
    }

    public String getHint() {
        return hint;
    }

    public long getTookMs() {
        return tookMs;
    }

    public JsonNode extra(String key) {
        return extras.get(key);
    }

    public ObjectNode toJson(ObjectMapper mapper) {
        ObjectNode out = mapper.createObjectNode();
        out.put("tool", tool);
        if (!callId.isEmpty()) {
            out.put("callId", callId);
        }
        out.put("status", status.wireValue());
        out.put("success", isSuccess());
        if (!error.isEmpty()) {
            out.put("error", error);
        }
        if (!hint.isEmpty()) {
            out.put("hint", hint);
        }
        if (tookMs >= 0) {
            out.put("tookMs", tookMs);
        }
        if (result != null) {
            out.set("result", result);
        }
        for (Map.Entry<String, JsonNode> entry : extras.entrySet()) {
            if (!out.has(entry.getKey())) {
                out.set(entry.getKey(), entry.getValue());
            }
        }
        return out;
    }

    @Override
    public String toString() {
        return "ToolResult{tool=" + tool + ", callId=" + callId + ", status=" + status.wireValue()
                + (error.isEmpty() ? "" : ", error=" + error) + "}";
    }
}
