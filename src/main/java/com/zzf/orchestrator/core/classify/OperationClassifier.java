package com.zzf.orchestrator.core.classify;

import com.zzf.orchestrator.core.util.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Labels the latest user message as READ, WRITE or GENERAL.
 * <p>
 * Pattern based. READ families are tried before WRITE families, so
 * "do you remember my name" is a READ even though it contains "remember".
 * A message that matches nothing is GENERAL, which only costs a missed memory
 * write and never an unsafe execution.
 */
@Component
public class OperationClassifier {
    private static final Logger logger = LoggerFactory.getLogger(OperationClassifier.class);

    private static final List<Pattern> READ_PATTERNS = List.of(
            Pattern.compile("\\b(what|whats|what's)\\b.*\\b(my|your|their|our)\\b"),
            Pattern.compile("\\b(do you (know|remember))\\b"),
            Pattern.compile("\\b(can you (recall|tell me|remind me))\\b"),
            Pattern.compile("\\b(what did i (say|tell|mention))\\b"),
            Pattern.compile("\\b(retrieve|recall|find|search|look up|get)\\b"),
            Pattern.compile("\\b(show me|tell me about)\\b")
    );

    private static final List<Pattern> WRITE_PATTERNS = List.of(
            Pattern.compile("\\b(remember|memorize|store|save|keep track|note that)\\b"),
            Pattern.compile("\\b(my .* is)\\b"),
            Pattern.compile("\\b(i (am|like|prefer|want|need))\\b"),
            Pattern.compile("\\b(add (this|that|to)|put in|write down)\\b")
    );

    public OperationType classify(String message) {
        if (message == null || message.isBlank()) {
            return OperationType.GENERAL;
        }
        String normalized = message.toLowerCase(Locale.ROOT).trim();
        if (matchesAny(READ_PATTERNS, normalized)) {
            logger.debug("classify.match type=READ msg={}", StringUtils.truncate(normalized, 50));
            return OperationType.READ;
        }
        if (matchesAny(WRITE_PATTERNS, normalized)) {
            logger.debug("classify.match type=WRITE msg={}", StringUtils.truncate(normalized, 50));
            return OperationType.WRITE;
        }
        return OperationType.GENERAL;
    }

    private static boolean matchesAny(List<Pattern> patterns, String text) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }
}
