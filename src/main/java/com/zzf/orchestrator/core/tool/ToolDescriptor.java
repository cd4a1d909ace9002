package com.zzf.orchestrator.core.tool;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Static declaration of an invocable capability. Immutable once loaded.
 */
@Value
@Builder(toBuilder = true)
public class ToolDescriptor {
    String name;
    String description;
    @Singular
    List<ParameterSpec> parameters;
    ToolCategory category;
    boolean requiresApproval;
    /** Whether the tool may run as part of a streamed pass. */
    boolean streamable;
    @Builder.Default
    TargetKind targetKind = TargetKind.NONE;
    /** Argument holding the policy target; null when {@link #targetKind} is NONE. */
    String targetArgument;

    public Optional<ParameterSpec> parameter(String parameterName) {
        for (ParameterSpec spec : parameters) {
            if (spec.getName().equals(parameterName)) {
                return Optional.of(spec);
            }
        }
        return Optional.empty();
    }

    public boolean isSideEffecting() {
        return category == ToolCategory.SIDE_EFFECTING;
    }
}
