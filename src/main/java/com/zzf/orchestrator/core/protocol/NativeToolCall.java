package com.zzf.orchestrator.core.protocol;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A structured call as returned by the chat-completion endpoint; arguments are the raw JSON text.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NativeToolCall {
    private String id;
    private String name;
    private String argumentsJson;
}
