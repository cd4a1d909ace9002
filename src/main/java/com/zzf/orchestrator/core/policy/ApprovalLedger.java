package com.zzf.orchestrator.core.policy;

import com.zzf.orchestrator.core.protocol.ToolInvocationRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Out-of-band approvals for requests that require one, keyed by request fingerprint. An approval
 * admits exactly one execution of the identical request.
 */
@Slf4j
@Component
public class ApprovalLedger {

    private final Map<String, PendingApproval> pending = new ConcurrentHashMap<>();
    private final Set<String> approved = ConcurrentHashMap.newKeySet();

    public void recordPending(ToolInvocationRequest request, SecurityDecision decision) {
        if (request == null || decision == null || decision.isAllowed() || !decision.isApprovalRequired()) {
            return;
        }
        String fingerprint = request.fingerprint();
        pending.putIfAbsent(fingerprint, PendingApproval.builder()
                .fingerprint(fingerprint)
                .callId(request.getCallId())
                .toolName(request.getToolName())
                .arguments(request.getArguments())
                .reason(decision.getReason())
                .detail(decision.getDetail())
                .requestedAt(Instant.now())
                .build());
        log.info("approval.pending tool={} fingerprint={} detail={}", request.getToolName(), fingerprint, decision.getDetail());
    }

    public boolean approve(String fingerprint) {
        if (fingerprint == null || fingerprint.isBlank()) {
            return false;
        }
        PendingApproval removed = pending.remove(fingerprint.trim());
        if (removed == null) {
            return false;
        }
        approved.add(removed.getFingerprint());
        log.info("approval.granted tool={} fingerprint={}", removed.getToolName(), removed.getFingerprint());
        return true;
    }

    public boolean reject(String fingerprint) {
        if (fingerprint == null || fingerprint.isBlank()) {
            return false;
        }
        PendingApproval removed = pending.remove(fingerprint.trim());
        if (removed != null) {
            log.info("approval.rejected tool={} fingerprint={}", removed.getToolName(), removed.getFingerprint());
        }
        return removed != null;
    }

    public boolean isApproved(String fingerprint) {
        return fingerprint != null && approved.contains(fingerprint);
    }

    /**
     * Uses up the approval for a request once it has been dispatched.
     */
    public boolean consume(String fingerprint) {
        return fingerprint != null && approved.remove(fingerprint);
    }

    public Optional<PendingApproval> get(String fingerprint) {
        if (fingerprint == null || fingerprint.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(pending.get(fingerprint.trim()));
    }

    public List<PendingApproval> listPending() {
        List<PendingApproval> list = new ArrayList<>(pending.values());
        list.sort(Comparator.comparing(PendingApproval::getRequestedAt));
        return list;
    }
}
