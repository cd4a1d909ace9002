package com.zzf.orchestrator.config;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Operator-facing state of one tool.
 */
@Value
@Builder
public class ToolView {
    String name;
    String description;
    String category;
    boolean configuredEnabled;
    /** Runtime override, null when the registry value applies. */
    Boolean override;
    boolean enabled;
    boolean requiresApproval;
    List<String> whitelist;
    String rootDirectory;
    Integer timeoutSeconds;
    String mode;
}
