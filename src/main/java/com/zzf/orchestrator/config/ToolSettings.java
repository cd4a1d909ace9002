package com.zzf.orchestrator.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One entry of the tool registry file.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ToolSettings {
    private String name;
    private boolean enabled;
    @JsonProperty("requires_approval")
    private boolean requiresApproval;
    @Builder.Default
    private List<String> whitelist = new ArrayList<>();
    @JsonProperty("root_directory")
    private String rootDirectory;
    @JsonProperty("timeout_seconds")
    private Integer timeoutSeconds;
    /** {@code ro} or {@code rw}; only meaningful for file access. */
    @Builder.Default
    private String mode = "ro";

    public boolean isReadWrite() {
        return "rw".equalsIgnoreCase(mode == null ? "" : mode.trim());
    }

    public ToolSettings copy() {
        return toBuilder().whitelist(whitelist == null ? new ArrayList<>() : new ArrayList<>(whitelist)).build();
    }
}
