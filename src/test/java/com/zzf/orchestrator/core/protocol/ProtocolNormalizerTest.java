package com.zzf.orchestrator.core.protocol;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProtocolNormalizerTest {

    private static final Set<String> OFFERED = Set.of("add_memory", "search_memories");
    private static final CallOrigin PASS_TWO = new CallOrigin(2, false, CallSource.NATIVE);

    private final ProtocolNormalizer normalizer = new ProtocolNormalizer(new ObjectMapper(), true);

    @Test
    void shouldConvertTaggedBlockAndStripItFromText() {
        String raw = "Sure. <function=add_memory><parameter=content>User's name is Matt</parameter>"
                + "<parameter=kind>fact</parameter></function> Done.";

        NormalizedOutput out = normalizer.normalize(raw, List.of(), OFFERED, PASS_TWO);

        assertTrue(out.hasCalls());
        assertEquals(CallSource.TAGGED_TEXT, out.getSource());
        ToolInvocationRequest request = out.getRequests().get(0);
        assertEquals("add_memory", request.getToolName());
        assertEquals("User's name is Matt", request.argument("content"));
        assertEquals("fact", request.argument("kind"));
        assertEquals(CallSource.TAGGED_TEXT, request.getOrigin().getSource());
        assertEquals(2, request.getOrigin().getPassNumber());
        assertEquals("Sure.  Done.".replace("  ", " "), out.getText().replace("  ", " "));
        assertFalse(out.getText().contains("<function="));
    }

    @Test
    void nativeCallsTakePrecedenceOverTaggedText() {
        String raw = "<function=search_memories><parameter=query>name</parameter></function>";
        NativeToolCall call = new NativeToolCall("call_1", "add_memory", "{\"content\":\"likes tea\",\"importance\":0.8}");

        NormalizedOutput out = normalizer.normalize(raw, List.of(call), OFFERED, PASS_TWO);

        assertEquals(1, out.getRequests().size());
        assertEquals(CallSource.NATIVE, out.getSource());
        ToolInvocationRequest request = out.getRequests().get(0);
        assertEquals("call_1", request.getCallId());
        assertEquals("add_memory", request.getToolName());
        assertEquals("likes tea", request.argument("content"));
        assertEquals("0.8", request.argument("importance"));
    }

    @Test
    void unterminatedParameterLeavesTextUntouched() {
        String raw = "Let me save that <function=add_memory><parameter=content>User's name is Matt";

        NormalizedOutput out = normalizer.normalize(raw, List.of(), OFFERED, PASS_TWO);

        assertFalse(out.hasCalls());
        assertNull(out.getSource());
        assertEquals(raw, out.getText());
    }

    @Test
    void blockWithoutParametersIsNotACall() {
        String raw = "<function=add_memory></function>";
        assertFalse(normalizer.normalize(raw, List.of(), OFFERED, PASS_TWO).hasCalls());
    }

    @Test
    void unknownFunctionNameStaysText() {
        String raw = "<function=format_disk><parameter=device>/dev/sda</parameter></function>";

        NormalizedOutput out = normalizer.normalize(raw, List.of(), OFFERED, PASS_TWO);

        assertFalse(out.hasCalls());
        assertEquals(raw, out.getText());
    }

    @Test
    void consecutiveBlocksWithoutClosingTagsAreSplit() {
        String raw = "<function=search_memories><parameter=query>coffee</parameter>"
                + "<function=add_memory><parameter=content>likes espresso</parameter>";

        NormalizedOutput out = normalizer.normalize(raw);

        assertEquals(2, out.getRequests().size());
        assertEquals("search_memories", out.getRequests().get(0).getToolName());
        assertEquals("coffee", out.getRequests().get(0).argument("query"));
        assertEquals("add_memory", out.getRequests().get(1).getToolName());
        assertEquals("", out.getText());
    }

    @Test
    void taggedParsingCanBeDisabled() {
        ProtocolNormalizer nativeOnly = new ProtocolNormalizer(new ObjectMapper(), false);
        String raw = "<function=add_memory><parameter=content>x</parameter></function>";

        NormalizedOutput out = nativeOnly.normalize(raw, List.of(), OFFERED, PASS_TWO);

        assertFalse(out.hasCalls());
        assertEquals(raw, out.getText());
    }

    @Test
    void malformedNativeArgumentsYieldEmptyArguments() {
        NativeToolCall call = new NativeToolCall("call_2", "search_memories", "{not json");

        NormalizedOutput out = normalizer.normalize("", List.of(call), OFFERED, PASS_TWO);

        assertEquals(1, out.getRequests().size());
        assertTrue(out.getRequests().get(0).getArguments().isEmpty());
    }

    @Test
    void fingerprintIgnoresCallIdAndArgumentOrder() {
        Map<String, String> first = new LinkedHashMap<>();
        first.put("content", "a");
        first.put("kind", "fact");
        Map<String, String> second = new LinkedHashMap<>();
        second.put("kind", "fact");
        second.put("content", "a");

        ToolInvocationRequest a = new ToolInvocationRequest("call_a", "add_memory", first, CallOrigin.direct());
        ToolInvocationRequest b = new ToolInvocationRequest("call_b", "add_memory", second, PASS_TWO);
        ToolInvocationRequest c = ToolInvocationRequest.of("add_memory", Map.of("content", "b", "kind", "fact"));

        assertEquals(a.fingerprint(), b.fingerprint());
        assertNotEquals(a.fingerprint(), c.fingerprint());
    }
}
