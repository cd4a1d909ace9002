package com.zzf.orchestrator.core.plan;

import com.zzf.orchestrator.model.ConfigurationException;

import java.util.Locale;

public enum ExecutionMode {
    SINGLE_PASS("single_pass"),
    DUAL_PASS_WRITE_ONLY("dual_pass_write_only"),
    /**
     * Every tool-enabled turn runs a streamed, tool-free pass first. For READ turns the
     * visible answer is produced without memory access and may be fabricated; the tool
     * result is only computed in the background pass and never shown. Kept as configured,
     * flagged on the plan.
     */
    DUAL_PASS_ALL("dual_pass_all");

    private final String configValue;

    ExecutionMode(String configValue) {
        this.configValue = configValue;
    }

    public String configValue() {
        return configValue;
    }

    public static ExecutionMode fromConfig(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ConfigurationException("Execution mode is not set. Expected one of: single_pass, dual_pass_write_only, dual_pass_all");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (ExecutionMode mode : values()) {
            if (mode.configValue.equals(normalized)) {
                return mode;
            }
        }
        throw new ConfigurationException("Invalid execution mode '" + raw.trim()
                + "'. Expected one of: single_pass, dual_pass_write_only, dual_pass_all");
    }
}
