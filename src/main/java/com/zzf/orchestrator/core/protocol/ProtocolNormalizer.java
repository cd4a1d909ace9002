package com.zzf.orchestrator.core.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns the raw output of one inference call into canonical {@link ToolInvocationRequest}s plus
 * the remaining text.
 * <p>
 * Native structured calls take strict precedence: when a response carries any, the tagged-text
 * path is skipped for that response. Parsing is best effort and never throws; the model output
 * is the one input this layer does not control.
 */
@Slf4j
public class ProtocolNormalizer {
    private final ObjectMapper mapper;
    private final boolean taggedCallsEnabled;
    private final TaggedCallParser taggedParser = new TaggedCallParser();

    public ProtocolNormalizer(ObjectMapper mapper, boolean taggedCallsEnabled) {
        this.mapper = mapper;
        this.taggedCallsEnabled = taggedCallsEnabled;
    }

    /**
     * Tagged-text only, any function name accepted.
     */
    public NormalizedOutput normalize(String rawModelOutput) {
        return normalize(rawModelOutput, List.of(), null, CallOrigin.direct());
    }

    /**
     * @param content       response text, may be null
     * @param nativeCalls   structured calls attached to the response, may be empty
     * @param offeredTools  tool names offered to this pass; tagged blocks naming anything else are
     *                      left as text. Null accepts any name.
     * @param origin        pass that produced the response
     */
    public NormalizedOutput normalize(String content, List<NativeToolCall> nativeCalls, Set<String> offeredTools, CallOrigin origin) {
        String text = content == null ? "" : content;
        if (nativeCalls != null && !nativeCalls.isEmpty()) {
            List<ToolInvocationRequest> requests = fromNative(nativeCalls, origin);
            if (!requests.isEmpty()) {
                log.debug("normalize.native calls={} pass={}", requests.size(), origin.getPassNumber());
                return new NormalizedOutput(text.trim(), requests, CallSource.NATIVE);
            }
        }
        if (!taggedCallsEnabled) {
            return NormalizedOutput.textOnly(text);
        }
        TaggedCallParser.Result parsed = taggedParser.parse(text, offeredTools);
        if (parsed.blocks.isEmpty()) {
            return NormalizedOutput.textOnly(text);
        }
        CallOrigin taggedOrigin = new CallOrigin(origin.getPassNumber(), origin.isStreamedPass(), CallSource.TAGGED_TEXT);
        List<ToolInvocationRequest> requests = new ArrayList<>();
        for (TaggedCallParser.Block block : parsed.blocks) {
            requests.add(new ToolInvocationRequest(null, block.functionName, block.arguments, taggedOrigin));
        }
        log.info("normalize.tagged converted={} pass={}", requests.size(), origin.getPassNumber());
        return new NormalizedOutput(parsed.remainingText, requests, CallSource.TAGGED_TEXT);
    }

    private List<ToolInvocationRequest> fromNative(List<NativeToolCall> nativeCalls, CallOrigin origin) {
        CallOrigin nativeOrigin = new CallOrigin(origin.getPassNumber(), origin.isStreamedPass(), CallSource.NATIVE);
        List<ToolInvocationRequest> out = new ArrayList<>();
        for (NativeToolCall call : nativeCalls) {
            if (call == null || call.getName() == null || call.getName().isBlank()) {
                log.warn("normalize.native.skip reason=blank_name");
                continue;
            }
            out.add(new ToolInvocationRequest(call.getId(), call.getName(), flattenArguments(call), nativeOrigin));
        }
        return out;
    }

    private Map<String, String> flattenArguments(NativeToolCall call) {
        Map<String, String> args = new LinkedHashMap<>();
        String raw = call.getArgumentsJson();
        if (raw == null || raw.isBlank()) {
            return args;
        }
        try {
            JsonNode node = mapper.readTree(raw);
            if (node == null || !node.isObject()) {
                log.warn("normalize.native.args_not_object tool={}", call.getName());
                return args;
            }
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode value = field.getValue();
                if (value == null || value.isNull()) {
                    continue;
                }
                args.put(field.getKey(), value.isTextual() ? value.asText() : value.toString());
            }
        } catch (Exception e) {
            log.error("normalize.native.args_unparseable tool={} args={}", call.getName(), raw, e);
        }
        return args;
    }
}
