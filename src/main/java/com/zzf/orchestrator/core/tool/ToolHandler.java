package com.zzf.orchestrator.core.tool;

public interface ToolHandler {
    ToolDescriptor descriptor();

    ToolResult execute(ToolExecution execution) throws Exception;

    /**
     * Stops a running call after its deadline passed. Handlers that start external work must
     * terminate it here.
     */
    default void cancel(String callId) {
    }
}
