package com.zzf.orchestrator.core.policy;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Glob matching for whitelist entries.
 *
 * <p>{@code *} matches within one path segment, {@code **} matches across segments and {@code ?}
 * matches a single character. A pattern ending in {@code /*} or {@code /**} admits the directory
 * and everything beneath it. A pattern without a separator is matched against the file name only,
 * and only for targets under the tool root. Relative patterns are anchored at the root. Matching is
 * case-sensitive.
 */
final class WhitelistMatcher {

    private final Map<String, Pattern> compiled = new ConcurrentHashMap<>();

    boolean matchesPath(Path candidate, Path root, List<String> patterns) {
        if (candidate == null || patterns == null || patterns.isEmpty()) {
            return false;
        }
        String target = TargetResolver.toTransportPath(candidate);
        boolean underRoot = candidate.startsWith(root);
        Path fileName = candidate.getFileName();
        String name = fileName == null ? "" : fileName.toString();
        for (String raw : patterns) {
            if (raw == null || raw.isBlank()) {
                continue;
            }
            String pattern = raw.trim().replace('\\', '/');
            if (!pattern.contains("/")) {
                if (underRoot && glob(pattern).matcher(name).matches()) {
                    return true;
                }
                continue;
            }
            String anchored = pattern.startsWith("/") || pattern.matches("^[a-zA-Z]:/.*")
                    ? pattern
                    : TargetResolver.toTransportPath(root) + "/" + stripDotSlash(pattern);
            if (matchesAnchored(anchored, target)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Matches a bare command name such as {@code git} against the name-only entries.
     */
    boolean matchesCommandName(String command, List<String> patterns) {
        if (command == null || command.isBlank() || patterns == null) {
            return false;
        }
        for (String raw : patterns) {
            if (raw == null || raw.isBlank()) {
                continue;
            }
            String pattern = raw.trim();
            if (pattern.contains("/") || pattern.contains("\\")) {
                continue;
            }
            if (glob(pattern).matcher(command.trim()).matches()) {
                return true;
            }
        }
        return false;
    }

    private boolean matchesAnchored(String pattern, String target) {
        String prefix = null;
        if (pattern.endsWith("/**")) {
            prefix = pattern.substring(0, pattern.length() - 3);
        } else if (pattern.endsWith("/*")) {
            prefix = pattern.substring(0, pattern.length() - 2);
        }
        if (prefix != null && !hasWildcard(prefix)) {
            return target.equals(prefix) || target.startsWith(prefix.endsWith("/") ? prefix : prefix + "/");
        }
        return glob(pattern).matcher(target).matches();
    }

    private Pattern glob(String pattern) {
        return compiled.computeIfAbsent(pattern, WhitelistMatcher::compile);
    }

    static Pattern compile(String glob) {
        StringBuilder regex = new StringBuilder();
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            if (c == '*') {
                if (i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
                    regex.append(".*");
                    i += 2;
                    continue;
                }
                regex.append("[^/]*");
            } else if (c == '?') {
                regex.append("[^/]");
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
            i++;
        }
        return Pattern.compile(regex.toString());
    }

    private static boolean hasWildcard(String value) {
        return value.indexOf('*') >= 0 || value.indexOf('?') >= 0;
    }

    private static String stripDotSlash(String pattern) {
        String result = pattern;
        while (result.startsWith("./")) {
            result = result.substring(2);
        }
        return result;
    }
}
