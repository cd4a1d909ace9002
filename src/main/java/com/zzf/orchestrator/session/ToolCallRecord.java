package com.zzf.orchestrator.session;

import com.zzf.orchestrator.core.policy.SecurityDecision;
import com.zzf.orchestrator.core.protocol.ToolInvocationRequest;
import com.zzf.orchestrator.core.tool.ToolResult;
import lombok.Value;

@Value
public class ToolCallRecord {
    ToolInvocationRequest request;
    SecurityDecision decision;
    ToolResult result;
}
