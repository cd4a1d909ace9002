package com.zzf.orchestrator.core.plan;

import com.zzf.orchestrator.core.classify.OperationType;

import java.util.List;

/**
 * Strategy for one user turn. Computed once, consumed by the coordinator, then discarded.
 */
public final class ExecutionPlan {
    private final OperationType operationType;
    private final ExecutionMode mode;
    private final List<PassPlan> passes;
    private final boolean readHazard;

    ExecutionPlan(OperationType operationType, ExecutionMode mode, List<PassPlan> passes, boolean readHazard) {
        this.operationType = operationType;
        this.mode = mode;
        this.passes = List.copyOf(passes);
        this.readHazard = readHazard;
    }

    public OperationType getOperationType() {
        return operationType;
    }

    public ExecutionMode getMode() {
        return mode;
    }

    public List<PassPlan> getPasses() {
        return passes;
    }

    public int getPassCount() {
        return passes.size();
    }

    public boolean isStreamFirstPass() {
        return passes.get(0).isStreamed();
    }

    /**
     * @param pass 1-based pass number
     */
    public boolean toolsEnabledInPass(int pass) {
        if (pass < 1 || pass > passes.size()) {
            return false;
        }
        return passes.get(pass - 1).isToolsEnabled();
    }

    public PassPlan pass(int pass) {
        return passes.get(pass - 1);
    }

    public boolean isDualPass() {
        return passes.size() == 2;
    }

    /**
     * True when the visible answer to a READ turn comes from a pass without tool access.
     */
    public boolean isReadHazard() {
        return readHazard;
    }

    @Override
    public String toString() {
        return "ExecutionPlan{type=" + operationType + ", mode=" + mode.configValue()
                + ", passes=" + passes + ", readHazard=" + readHazard + "}";
    }
}
