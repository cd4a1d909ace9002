package com.zzf.orchestrator.llm;

import com.zzf.orchestrator.core.protocol.NativeToolCall;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One complete, unstreamed model response.
 */
@Value
@Builder
public class InferenceResponse {
    String content;
    @Singular
    List<NativeToolCall> toolCalls;
    String finishReason;

    public static InferenceResponse text(String content) {
        return InferenceResponse.builder().content(content).finishReason("stop").build();
    }
}
