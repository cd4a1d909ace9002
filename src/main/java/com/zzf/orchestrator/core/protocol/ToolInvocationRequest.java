package com.zzf.orchestrator.core.protocol;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Canonical, already-normalized request to run one tool. Never mutated; a new request is
 * created per attempt.
 */
public final class ToolInvocationRequest {
    private final String callId;
    private final String toolName;
    private final Map<String, String> arguments;
    private final CallOrigin origin;

    public ToolInvocationRequest(String callId, String toolName, Map<String, String> arguments, CallOrigin origin) {
        this.callId = callId == null || callId.isBlank() ? newCallId() : callId.trim();
        this.toolName = toolName == null ? "" : toolName.trim();
        this.arguments = arguments == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
        this.origin = origin == null ? CallOrigin.direct() : origin;
    }

    public static ToolInvocationRequest of(String toolName, Map<String, String> arguments) {
        return new ToolInvocationRequest(null, toolName, arguments, CallOrigin.direct());
    }

    public static String newCallId() {
        return "call_" + UUID.randomUUID().toString().replace("-", "").substring(0, 24);
    }

    public String getCallId() {
        return callId;
    }

    public String getToolName() {
        return toolName;
    }

    public Map<String, String> getArguments() {
        return arguments;
    }

    public String argument(String name) {
        return arguments.get(name);
    }

    public CallOrigin getOrigin() {
        return origin;
    }

    /**
     * Identity of "this exact request" for the approval gate: tool name and arguments,
     * independent of call id, origin and argument order.
     */
    public String fingerprint() {
        StringBuilder sb = new StringBuilder(toolName).append('\u0000');
        for (Map.Entry<String, String> entry : new TreeMap<>(arguments).entrySet()) {
            sb.append(entry.getKey()).append('=').append(entry.getValue()).append('\u0000');
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(sb.toString().getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder();
            for (int i = 0; i < 12; i++) {
                hex.append(String.format("%02x", hash[i]));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ToolInvocationRequest)) {
            return false;
        }
        ToolInvocationRequest that = (ToolInvocationRequest) o;
        return callId.equals(that.callId) && toolName.equals(that.toolName)
                && arguments.equals(that.arguments) && origin.equals(that.origin);
    }

    @Override
    public int hashCode() {
        return Objects.hash(callId, toolName, arguments, origin);
    }

    @Override
    public String toString() {
        return "ToolInvocationRequest{callId=" + callId + ", tool=" + toolName + ", args=" + arguments.keySet()
                + ", origin=" + origin + "}";
    }
}
