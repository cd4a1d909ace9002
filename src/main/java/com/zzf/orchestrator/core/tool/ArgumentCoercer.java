package com.zzf.orchestrator.core.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts the string arguments of a normalized call into the types a tool declares.
 *
 * <p>Blank values count as absent. Arguments the descriptor does not declare are dropped.
 * List parameters accept a JSON array, a comma separated string, or whitespace separated tokens
 * with quoting.
 */
@Slf4j
public class ArgumentCoercer {
    private static final Pattern TOKEN_PATTERN = Pattern.compile("\"([^\"]*)\"|'([^']*)'|(\\S+)");

    private final ObjectMapper mapper;

    public ArgumentCoercer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @throws IllegalArgumentException naming the first offending parameter
     */
    public Map<String, Object> coerce(ToolDescriptor descriptor, Map<String, String> raw) {
        Map<String, String> input = raw == null ? Collections.emptyMap() : raw;
        Map<String, Object> out = new LinkedHashMap<>();
        for (ParameterSpec spec : descriptor.getParameters()) {
            String value = input.get(spec.getName());
            if (value == null || value.isBlank()) {
                if (spec.isRequired()) {
                    throw new IllegalArgumentException("missing required parameter '" + spec.getName() + "'");
                }
                continue;
            }
            out.put(spec.getName(), convert(spec, value));
        }
        for (String name : input.keySet()) {
            if (descriptor.parameter(name).isEmpty()) {
                log.debug("coerce.drop tool={} argument={}", descriptor.getName(), name);
            }
        }
        return out;
    }

    public List<String> parseStringList(String raw) {
        if (raw == null || raw.isBlank()) {
            return Collections.emptyList();
        }
        String trimmed = raw.trim();
        if (trimmed.startsWith("[")) {
            try {
                JsonNode node = mapper.readTree(trimmed);
                if (node != null && node.isArray()) {
                    List<String> values = new ArrayList<>();
                    for (JsonNode item : node) {
                        if (item != null && !item.isNull()) {
                            values.add(item.isTextual() ? item.asText() : item.toString());
                        }
                    }
                    return values;
                }
            } catch (JsonProcessingException e) {
                log.debug("coerce.list_not_json value={}", trimmed);
            }
        }
        List<String> values = new ArrayList<>();
        if (trimmed.contains(",")) {
            for (String part : trimmed.split(",")) {
                if (!part.isBlank()) {
                    values.add(part.trim());
                }
            }
            return values;
        }
        Matcher matcher = TOKEN_PATTERN.matcher(trimmed);
        while (matcher.find()) {
            String token = matcher.group(1) != null ? matcher.group(1)
                    : matcher.group(2) != null ? matcher.group(2)
                    : matcher.group(3);
            values.add(token);
        }
        return values;
    }

    private Object convert(ParameterSpec spec, String value) {
        String trimmed = value.trim();
        switch (spec.getType()) {
            case STRING:
                return checkAllowed(spec, value);
            case INTEGER:
                return checkRange(spec, parseInteger(spec, trimmed));
            case NUMBER:
                return checkRange(spec, parseNumber(spec, trimmed));
            case BOOLEAN:
                return parseBoolean(spec, trimmed);
            case STRING_LIST:
                return Collections.unmodifiableList(parseStringList(value));
            default:
                throw new IllegalArgumentException("unsupported type for parameter '" + spec.getName() + "'");
        }
    }

    private String checkAllowed(ParameterSpec spec, String value) {
        List<String> allowed = spec.getAllowedValues();
        if (allowed == null || allowed.isEmpty()) {
            return value;
        }
        String candidate = value.trim();
        for (String option : allowed) {
            if (option.equalsIgnoreCase(candidate)) {
                return option;
            }
        }
        throw new IllegalArgumentException("parameter '" + spec.getName() + "' must be one of " + allowed + ", got '" + candidate + "'");
    }

    private Long parseInteger(ParameterSpec spec, String value) {
        try {
            return new BigDecimal(value).longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new IllegalArgumentException("parameter '" + spec.getName() + "' expects an integer, got '" + value + "'");
        }
    }

    private Double parseNumber(ParameterSpec spec, String value) {
        try {
            double parsed = Double.parseDouble(value);
            if (Double.isNaN(parsed) || Double.isInfinite(parsed)) {
                throw new NumberFormatException(value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("parameter '" + spec.getName() + "' expects a number, got '" + value + "'");
        }
    }

    private Boolean parseBoolean(ParameterSpec spec, String value) {
        switch (value.toLowerCase(Locale.ROOT)) {
            case "true":
            case "yes":
            case "1":
                return Boolean.TRUE;
            case "false":
            case "no":
            case "0":
                return Boolean.FALSE;
            default:
                throw new IllegalArgumentException("parameter '" + spec.getName() + "' expects a boolean, got '" + value + "'");
        }
    }

    private <N extends Number> N checkRange(ParameterSpec spec, N value) {
        double v = value.doubleValue();
        if (spec.getMinimum() != null && v < spec.getMinimum()) {
            throw new IllegalArgumentException("parameter '" + spec.getName() + "' must be >= " + spec.getMinimum());
        }
        if (spec.getMaximum() != null && v > spec.getMaximum()) {
            throw new IllegalArgumentException("parameter '" + spec.getName() + "' must be <= " + spec.getMaximum());
        }
        return value;
    }
}
