package com.zzf.orchestrator.core.plan;

import com.zzf.orchestrator.core.classify.OperationType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

@Slf4j
@Component
public class ExecutionStrategySelector {

    public ExecutionPlan plan(OperationType operationType, String mode, boolean toolsEnabled) {
        return plan(operationType, ExecutionMode.fromConfig(mode), toolsEnabled);
    }

    public ExecutionPlan plan(OperationType operationType, ExecutionMode mode, boolean toolsEnabled) {
        OperationType type = operationType == null ? OperationType.GENERAL : operationType;
        if (mode == null) {
            throw new IllegalArgumentException("mode is required");
        }
        ExecutionPlan plan = select(type, mode, toolsEnabled);
        if (plan.isReadHazard()) {
            log.warn("plan.hazard mode={} type={} visible answer is produced without tool access; "
                    + "the tool-derived answer is only computed in the background pass", mode.configValue(), type);
        }
        log.debug("plan.select {}", plan);
        return plan;
    }

    private ExecutionPlan select(OperationType type, ExecutionMode mode, boolean toolsEnabled) {
        if (!toolsEnabled) {
            return single(type, mode, true, false);
        }
        switch (mode) {
            case SINGLE_PASS:
                return single(type, mode, false, true);
            case DUAL_PASS_WRITE_ONLY:
                if (type == OperationType.WRITE) {
                    return dual(type, mode, false);
                }
                if (type == OperationType.READ) {
                    return single(type, mode, false, true);
                }
                return single(type, mode, true, false);
            case DUAL_PASS_ALL:
                return dual(type, mode, type == OperationType.READ);
            default:
                throw new IllegalStateException("Unhandled execution mode: " + mode);
        }
    }

    private static ExecutionPlan single(OperationType type, ExecutionMode mode, boolean streamed, boolean tools) {
        return new ExecutionPlan(type, mode, List.of(new PassPlan(1, streamed, tools, false)), false);
    }

    private static ExecutionPlan dual(OperationType type, ExecutionMode mode, boolean readHazard) {
        return new ExecutionPlan(type, mode, List.of(
                new PassPlan(1, true, false, false),
                new PassPlan(2, false, true, true)
        ), readHazard);
    }
}
