package com.zzf.orchestrator.session;

import com.zzf.orchestrator.core.classify.OperationType;
import com.zzf.orchestrator.core.plan.ExecutionPlan;
import lombok.Builder;
import lombok.Value;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Result of one user turn. The background pass, when planned, is still running or finished; it is
 * never awaited by the coordinator.
 */
@Value
@Builder
public class TurnOutcome {
    String sessionId;
    OperationType operationType;
    ExecutionPlan plan;
    PassResult firstPass;
    CompletableFuture<PassResult> background;

    public String getAnswer() {
        return firstPass == null ? "" : firstPass.getText();
    }

    public Optional<CompletableFuture<PassResult>> backgroundPass() {
        return Optional.ofNullable(background);
    }
}
