package com.zzf.orchestrator.model;

/**
 * Invalid execution mode, missing or unreadable registry. Never retried.
 */
public class ConfigurationException extends OrchestratorException {

    public ConfigurationException(String message) {
        super("CONFIGURATION_ERROR", message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super("CONFIGURATION_ERROR", message, cause);
    }
}
