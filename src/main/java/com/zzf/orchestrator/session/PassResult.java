package com.zzf.orchestrator.session;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PassResult {
    int passNumber;
    boolean streamed;
    String text;
    @Singular
    List<ToolCallRecord> toolCalls;
    int iterations;
    /** True when the tool loop stopped at the iteration limit. */
    boolean truncated;
}
