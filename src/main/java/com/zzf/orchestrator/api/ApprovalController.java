package com.zzf.orchestrator.api;

import com.zzf.orchestrator.core.policy.ApprovalLedger;
import com.zzf.orchestrator.core.policy.PendingApproval;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Human side of the approval gate. Approving a pending request lets the identical request pass once.
 */
@Slf4j
@RestController
@RequestMapping("/api/approvals")
@RequiredArgsConstructor
public class ApprovalController {

    private final ApprovalLedger approvalLedger;

    public static class ApprovalDecisionRequest {
        public boolean reject;
    }

    @GetMapping
    public List<PendingApproval> listPending() {
        return approvalLedger.listPending();
    }

    @PostMapping("/{fingerprint}")
    public ResponseEntity<Map<String, Object>> decide(@PathVariable String fingerprint,
                                                      @RequestBody(required = false) ApprovalDecisionRequest request) {
        boolean reject = request != null && request.reject;
        boolean found = reject ? approvalLedger.reject(fingerprint) : approvalLedger.approve(fingerprint);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("fingerprint", fingerprint);
        if (!found) {
            response.put("status", "error");
            response.put("error", "Pending approval not found: " + fingerprint);
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
        }
        response.put("status", reject ? "rejected" : "approved");
        return ResponseEntity.ok(response);
    }
}
