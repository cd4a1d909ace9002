package com.zzf.orchestrator.core.plan;

import lombok.Value;

@Value
public class PassPlan {
    int number;
    boolean streamed;
    boolean toolsEnabled;
    /** Runs after the previous pass on a background task; the caller does not wait for it. */
    boolean background;
}
