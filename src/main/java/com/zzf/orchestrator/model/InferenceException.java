package com.zzf.orchestrator.model;

/**
 * A single failed call to the chat-completion endpoint.
 */
public class InferenceException extends OrchestratorException {

    public InferenceException(String message) {
        super("INFERENCE_ERROR", message);
    }

    public InferenceException(String message, Throwable cause) {
        super("INFERENCE_ERROR", message, cause);
    }
}
