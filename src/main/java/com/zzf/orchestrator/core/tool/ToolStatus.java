package com.zzf.orchestrator.core.tool;

import java.util.Locale;

public enum ToolStatus {
    OK,
    ERROR,
    DENIED,
    REFUSED,
    TIMED_OUT,
    INVALID_ARGUMENTS;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
