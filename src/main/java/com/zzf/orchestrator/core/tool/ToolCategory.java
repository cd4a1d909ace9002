package com.zzf.orchestrator.core.tool;

public enum ToolCategory {
    READ_ONLY,
    SIDE_EFFECTING
}
