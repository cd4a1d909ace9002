package com.zzf.orchestrator.core.policy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Resolves raw path arguments against a tool's root directory. The policy engine and the tool
 * handlers both go through {@link #resolveTarget}, so the path that was authorized is the path
 * that is touched.
 */
public final class TargetResolver {

    private static final boolean WINDOWS = System.getProperty("os.name", "")
            .toLowerCase(Locale.ROOT)
            .contains("win");

    private TargetResolver() {
    }

    public static Path resolveRoot(String rootDirectory) {
        String raw = rootDirectory == null || rootDirectory.isBlank()
                ? System.getProperty("user.dir")
                : rootDirectory;
        return real(parse(raw));
    }

    /**
     * The normalized target with every symbolic link in its existing part followed.
     *
     * @throws IllegalArgumentException when the path cannot be parsed or a link cannot be followed
     */
    public static Path resolveTarget(Path root, String rawTarget) {
        return real(normalized(root, rawTarget));
    }

    /**
     * Follows links through the longest prefix that exists and re-appends the missing tail.
     * A dangling link in that prefix cannot be followed and is rejected.
     */
    static Path real(Path path) {
        Path absolute = path.toAbsolutePath().normalize();
        Path existing = absolute;
        while (existing != null && !Files.exists(existing, LinkOption.NOFOLLOW_LINKS)) {
            existing = existing.getParent();
        }
        if (existing == null) {
            return absolute;
        }
        try {
            return existing.toRealPath().resolve(existing.relativize(absolute)).normalize();
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot resolve " + toTransportPath(absolute) + ": " + e.getMessage(), e);
        }
    }

    /**
     * Joins the raw target to the root without normalizing, so {@code ..} segments survive.
     */
    static Path lexical(Path root, String rawTarget) {
        Path parsed = parse(rawTarget);
        if (parsed.isAbsolute()) {
            return parsed;
        }
        return root.resolve(parsed);
    }

    static Path normalized(Path root, String rawTarget) {
        return lexical(root, rawTarget).toAbsolutePath().normalize();
    }

    static boolean isAbsolute(String rawTarget) {
        return parse(rawTarget).isAbsolute();
    }

    static boolean isInside(Path root, Path candidate) {
        return candidate.toAbsolutePath().normalize().startsWith(root);
    }

    static String toTransportPath(Path path) {
        return path == null ? "" : path.toString().replace('\\', '/');
    }

    static Path parse(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return Paths.get(".");
        }
        String normalized = rawPath.trim();
        if (normalized.startsWith("file://")) {
            normalized = normalized.substring("file://".length());
        }
        if (normalized.startsWith("~/")) {
            normalized = System.getProperty("user.home", "") + normalized.substring(1);
        }
        if (WINDOWS && normalized.matches("^/[a-zA-Z]/.*")) {
            char drive = Character.toUpperCase(normalized.charAt(1));
            normalized = drive + ":" + normalized.substring(2);
        }
        try {
            return Paths.get(normalized);
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("Invalid path: " + rawPath, e);
        }
    }
}
