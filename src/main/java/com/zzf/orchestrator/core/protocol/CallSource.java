package com.zzf.orchestrator.core.protocol;

public enum CallSource {
    /** Structured call list attached to the inference response. */
    NATIVE,
    /** {@code <function=...><parameter=...>} block embedded in the response text. */
    TAGGED_TEXT,
    /** Issued directly by a caller, e.g. the REST surface. */
    DIRECT
}
