package com.zzf.orchestrator.core.tool;

/**
 * What the policy engine inspects for a tool: nothing, a filesystem path, or a command line.
 */
public enum TargetKind {
    NONE,
    PATH,
    COMMAND
}
