package com.zzf.orchestrator.core.policy;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class PendingApproval {
    String fingerprint;
    String callId;
    String toolName;
    Map<String, String> arguments;
    DecisionReason reason;
    String detail;
    Instant requestedAt;
}
