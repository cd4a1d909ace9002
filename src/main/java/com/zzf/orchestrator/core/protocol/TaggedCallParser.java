package com.zzf.orchestrator.core.protocol;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds {@code <function=NAME><parameter=KEY>VALUE</parameter>...[</function>]} blocks in model output.
 * <p>
 * A block only counts as a call when the function tag is followed by at least one complete
 * parameter tag. Blocks with an unterminated parameter, no parameters, or an unknown function
 * name stay in the text untouched.
 */
@Slf4j
final class TaggedCallParser {
    private static final String FUNCTION_PREFIX = "<function=";
    private static final String PARAMETER_PREFIX = "<parameter=";
    private static final String PARAMETER_CLOSE = "</parameter>";
    private static final Pattern FUNCTION_OPEN = Pattern.compile("<function=([^<>\\r\\n]+)>");
    private static final Pattern PARAMETER_OPEN = Pattern.compile("\\s*<parameter=([^<>\\r\\n]+)>");
    private static final Pattern FUNCTION_CLOSE = Pattern.compile("\\s*</function>");

    static final class Block {
        final int start;
        final int end;
        final String functionName;
        final Map<String, String> arguments;

        Block(int start, int end, String functionName, Map<String, String> arguments) {
            this.start = start;
            this.end = end;
            this.functionName = functionName;
            this.arguments = Collections.unmodifiableMap(arguments);
        }
    }

    static final class Result {
        final List<Block> blocks;
        final String remainingText;

        Result(List<Block> blocks, String remainingText) {
            this.blocks = blocks;
            this.remainingText = remainingText;
        }
    }

    /**
     * @param knownFunctions names accepted as calls; null accepts any name
     */
    Result parse(String text, Set<String> knownFunctions) {
        if (text == null || text.isEmpty() || !text.contains(FUNCTION_PREFIX)) {
            return new Result(List.of(), text == null ? "" : text);
        }
        List<Block> blocks = new ArrayList<>();
        Matcher open = FUNCTION_OPEN.matcher(text);
        int from = 0;
        while (from < text.length() && open.find(from)) {
            Block block = parseBlock(text, open);
            if (block == null) {
                from = open.end();
                continue;
            }
            if (knownFunctions != null && !knownFunctions.contains(block.functionName)) {
                log.debug("tagged.skip reason=unknown_function name={}", block.functionName);
                from = open.end();
                continue;
            }
            blocks.add(block);
            from = block.end;
        }
        return new Result(blocks, strip(text, blocks));
    }

    private Block parseBlock(String text, Matcher open) {
        String name = open.group(1).trim();
        if (name.isEmpty()) {
            return null;
        }
        int cursor = open.end();
        int nextFunction = text.indexOf(FUNCTION_PREFIX, cursor);
        int limit = nextFunction < 0 ? text.length() : nextFunction;
        Map<String, String> args = new LinkedHashMap<>();
        Matcher param = PARAMETER_OPEN.matcher(text);
        while (true) {
            param.region(cursor, limit);
            if (!param.lookingAt()) {
                break;
            }
            String key = param.group(1).trim();
            int valueStart = param.end();
            int close = text.indexOf(PARAMETER_CLOSE, valueStart);
            int nextParam = text.indexOf(PARAMETER_PREFIX, valueStart);
            if (close < 0 || close > limit || (nextParam >= 0 && nextParam < close)) {
                log.debug("tagged.skip reason=unterminated_parameter function={} parameter={}", name, key);
                return null;
            }
            if (key.isEmpty()) {
                return null;
            }
            args.put(key, text.substring(valueStart, close).trim());
            cursor = close + PARAMETER_CLOSE.length();
        }
        if (args.isEmpty()) {
            return null;
        }
        Matcher end = FUNCTION_CLOSE.matcher(text);
        end.region(cursor, limit);
        if (end.lookingAt()) {
            cursor = end.end();
        }
        return new Block(open.start(), cursor, name, args);
    }

    private static String strip(String text, List<Block> blocks) {
        if (blocks.isEmpty()) {
            return text;
        }
        StringBuilder out = new StringBuilder();
        int last = 0;
        for (Block block : blocks) {
            out.append(text, last, block.start);
            last = block.end;
        }
        out.append(text.substring(last));
        return out.toString().trim();
    }
}
