package com.zzf.orchestrator.llm;

import com.zzf.orchestrator.core.tool.ToolDescriptor;

import java.util.List;
import java.util.function.Consumer;

/**
 * Chat-completion endpoint. Each call is a single fallible operation; implementations do not retry.
 *
 * @throws com.zzf.orchestrator.model.InferenceException on transport or protocol failure
 */
public interface InferenceClient {

    /**
     * Unstreamed completion. {@code tools} may be empty, in which case none are offered.
     */
    InferenceResponse complete(List<ChatMessage> messages, List<ToolDescriptor> tools);

    /**
     * Streamed, tool-free completion. Tokens are handed to {@code onToken} as they arrive; the
     * full text is returned once the stream ends.
     */
    String stream(List<ChatMessage> messages, Consumer<String> onToken);
}
