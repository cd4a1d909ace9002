package com.zzf.orchestrator.core.classify;

public enum OperationType {
    /** Retrieve something from memory. */
    READ,
    /** Store something in memory. */
    WRITE,
    /** Anything else. */
    GENERAL
}
