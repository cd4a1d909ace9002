package com.zzf.orchestrator.core.policy;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Flags targets that force approval even when whitelisted: system and credential paths, and
 * destructive or privileged commands.
 */
final class DangerousTargetDetector {
    private static final Pattern TOKEN_PATTERN = Pattern.compile("\"([^\"]+)\"|'([^']+)'|(\\S+)");

    private static final List<String> SYSTEM_PREFIXES = List.of("/etc", "/sys", "/proc", "/dev", "/boot", "/root");
    private static final Set<String> SECRET_DIRECTORIES = Set.of(".ssh", ".aws", ".gnupg");

    List<String> assessPath(Path target) {
        List<String> reasons = new ArrayList<>();
        if (target == null) {
            return reasons;
        }
        Path normalized = target.toAbsolutePath().normalize();
        String transport = TargetResolver.toTransportPath(normalized);
        for (String prefix : SYSTEM_PREFIXES) {
            if (transport.equals(prefix) || transport.startsWith(prefix + "/")) {
                addReason(reasons, "system path " + prefix);
                break;
            }
        }
        for (Path segment : normalized) {
            if (SECRET_DIRECTORIES.contains(segment.toString())) {
                addReason(reasons, "credential directory " + segment);
                break;
            }
        }
        Path fileName = normalized.getFileName();
        String name = fileName == null ? "" : fileName.toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".key") || name.endsWith(".pem")) {
            addReason(reasons, "key material file");
        }
        if (name.contains("credentials") || name.contains("password")) {
            addReason(reasons, "credential file");
        }
        if (name.equals(".env") || name.endsWith(".env")) {
            addReason(reasons, "environment secrets file");
        }
        return reasons;
    }

    List<String> assessCommand(String commandLine, Path root) {
        List<String> reasons = new ArrayList<>();
        if (commandLine == null || commandLine.isBlank()) {
            return reasons;
        }
        String normalized = commandLine.toLowerCase(Locale.ROOT)
                .replace('\n', ' ')
                .replace('\r', ' ')
                .replaceAll("\\s+", " ")
                .trim();

        if (normalized.matches("(?:.*[;&|]\\s*|)(?:sudo\\s+)?(?:\\S*/)?rm(?:\\s.*)?")) {
            addReason(reasons, "file delete command");
        }
        if (normalized.matches(".*\\brm\\b.*\\s-[a-z]*r[a-z]*\\b.*")) {
            addReason(reasons, "recursive delete command");
        }
        if (normalized.matches(".*\\bfind\\b.*\\s-delete\\b.*")) {
            addReason(reasons, "find -delete sweep");
        }
        if (normalized.matches("(?:.*[;&|]\\s*|)(?:\\S*/)?(mkfs(\\.\\w+)?|format|fdisk|parted|wipefs)(?:\\s.*)?")) {
            addReason(reasons, "disk formatting/partition command");
        }
        if (normalized.matches(".*\\bdd\\b.*\\bof=/dev/.*")) {
            addReason(reasons, "raw disk write command");
        }
        if (normalized.matches(".*\\b(chmod|chown)\\b.*")) {
            addReason(reasons, "permission/ownership change");
        }
        if (normalized.matches(".*\\b(kill|pkill|killall)\\b.*")) {
            addReason(reasons, "process kill command");
        }
        if (normalized.matches("(?:.*[;&|]\\s*|)(sudo|su|doas)(?:\\s.*)?")) {
            addReason(reasons, "privilege escalation");
        }
        if (normalized.matches(".*\\b(shutdown|reboot|poweroff|halt)\\b.*")) {
            addReason(reasons, "system shutdown/reboot command");
        }
        if (normalized.matches(".*\\b(curl|wget)\\b.*\\|\\s*(sh|bash|zsh)\\b.*")) {
            addReason(reasons, "remote script pipe execution");
        }
        if (normalized.contains(":(){ :|:& };:")) {
            addReason(reasons, "fork-bomb pattern");
        }
        reasons.addAll(assessArguments(commandLine, root));
        return reasons;
    }

    private List<String> assessArguments(String commandLine, Path root) {
        List<String> reasons = new ArrayList<>();
        Matcher matcher = TOKEN_PATTERN.matcher(commandLine);
        boolean first = true;
        while (matcher.find()) {
            String token = firstNonBlank(matcher.group(1), matcher.group(2), matcher.group(3));
            if (first) {
                first = false;
                continue;
            }
            int equalsIndex = token.indexOf('=');
            if (equalsIndex > 0 && equalsIndex + 1 < token.length()) {
                token = token.substring(equalsIndex + 1);
            }
            if (!looksLikePath(token)) {
                continue;
            }
            Path resolved;
            try {
                resolved = TargetResolver.resolveTarget(root, token);
            } catch (IllegalArgumentException e) {
                addReason(reasons, "unparseable path argument: " + token);
                continue;
            }
            if (!TargetResolver.isInside(root, resolved)) {
                addReason(reasons, "argument outside root: " + TargetResolver.toTransportPath(resolved));
            }
            for (String pathReason : assessPath(resolved)) {
                addReason(reasons, pathReason);
            }
        }
        return reasons;
    }

    private static boolean looksLikePath(String token) {
        if (token == null || token.isBlank() || token.startsWith("-")) {
            return false;
        }
        return token.startsWith("/") || token.startsWith("~/") || token.startsWith("file://")
                || token.equals("..") || token.contains("/");
    }

    private static void addReason(List<String> reasons, String reason) {
        if (!reasons.contains(reason)) {
            reasons.add(reason);
        }
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return "";
    }
}
