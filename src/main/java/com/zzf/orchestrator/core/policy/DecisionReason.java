package com.zzf.orchestrator.core.policy;

public enum DecisionReason {
    WHITELISTED,
    PERMITTED,
    APPROVED,
    TOOL_UNAVAILABLE,
    NOT_WHITELISTED,
    READ_ONLY,
    DANGEROUS_REQUIRES_APPROVAL,
    TIMEOUT_EXCEEDED;

    public String wireValue() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
