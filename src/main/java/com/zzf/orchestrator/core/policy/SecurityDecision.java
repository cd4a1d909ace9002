package com.zzf.orchestrator.core.policy;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Outcome of authorizing one tool invocation request. Carries no timestamps so that authorizing the
 * same request twice under the same configuration yields equal decisions.
 */
@Value
@Builder
public class SecurityDecision {
    boolean allowed;
    DecisionReason reason;
    Duration effectiveTimeout;
    String detail;
    boolean approvalRequired;
    String toolName;
    /** Fingerprint of the request this decision was made for. */
    String fingerprint;

    public boolean covers(String requestFingerprint) {
        return fingerprint != null && fingerprint.equals(requestFingerprint);
    }
}
