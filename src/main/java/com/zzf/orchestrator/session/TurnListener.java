package com.zzf.orchestrator.session;

import com.zzf.orchestrator.core.policy.SecurityDecision;
import com.zzf.orchestrator.core.protocol.ToolInvocationRequest;
import com.zzf.orchestrator.core.tool.ToolResult;

/**
 * Receives the visible part of a turn as it happens.
 */
public interface TurnListener {
    TurnListener NONE = new TurnListener() {
    };

    default void onToken(String token) {}

    default void onToolCall(ToolInvocationRequest request, SecurityDecision decision) {}

    default void onToolResult(ToolResult result) {}

    default void onPassComplete(PassResult result) {}
}
