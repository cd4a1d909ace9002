package com.zzf.orchestrator.core.protocol;

import java.util.List;

public final class NormalizedOutput {
    private final String text;
    private final List<ToolInvocationRequest> requests;
    private final CallSource source;

    public NormalizedOutput(String text, List<ToolInvocationRequest> requests, CallSource source) {
        this.text = text == null ? "" : text;
        this.requests = requests == null ? List.of() : List.copyOf(requests);
        this.source = source;
    }

    public static NormalizedOutput textOnly(String text) {
        return new NormalizedOutput(text, List.of(), null);
    }

    public String getText() {
        return text;
    }

    public List<ToolInvocationRequest> getRequests() {
        return requests;
    }

    public boolean hasCalls() {
        return !requests.isEmpty();
    }

    /** Which path produced the calls; null when there are none. */
    public CallSource getSource() {
        return source;
    }
}
