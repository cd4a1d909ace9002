package com.zzf.orchestrator.core.protocol;

import lombok.Value;

@Value
public class CallOrigin {
    int passNumber;
    boolean streamedPass;
    CallSource source;

    public static CallOrigin direct() {
        return new CallOrigin(0, false, CallSource.DIRECT);
    }
}
