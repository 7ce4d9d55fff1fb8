package io.instancegate.security;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Lexical validation of container persistence paths. Works on the literal string only;
 * the filesystem is never consulted because the directories usually do not exist yet.
 */
public final class PathSafetyValidator {
    public static final String INVALID_PATH = "Invalid directory path";

    private PathSafetyValidator() {
    }

    public static PathValidation validate(String path, String allowedRoot) {
        String root = normalizeRoot(allowedRoot);
        if (path == null || path.isBlank()) {
            return PathValidation.rejected(path, "empty path");
        }
        if (path.indexOf('\0') >= 0) {
            return PathValidation.rejected(path, "path contains NUL");
        }
        if (!path.startsWith("/")) {
            return PathValidation.rejected(path, "path is not absolute");
        }
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : path.split("/")) {
            if (segment.isEmpty() || ".".equals(segment)) {
                continue;
            }
            if ("..".equals(segment)) {
                // Any parent reference is a traversal attempt, even one that would stay under root.
                return PathValidation.rejected(path, "path contains parent reference");
            }
            segments.addLast(segment);
        }
        String normalized = "/" + String.join("/", segments);
        if (!isUnder(normalized, root)) {
            return PathValidation.rejected(path, "path escapes persistence root " + root);
        }
        return PathValidation.accepted(path, normalized);
    }

    static String normalizeRoot(String allowedRoot) {
        if (allowedRoot == null || allowedRoot.isBlank()) {
            return "/";
        }
        String value = allowedRoot.trim();
        while (value.length() > 1 && value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value.startsWith("/") ? value : "/" + value;
    }

    private static boolean isUnder(String normalized, String root) {
        if ("/".equals(root)) {
            return true;
        }
        return normalized.equals(root) || normalized.startsWith(root + "/");
    }

    public record PathValidation(boolean valid, String input, String normalizedPath, String reason) {
        static PathValidation accepted(String input, String normalizedPath) {
            return new PathValidation(true, input, normalizedPath, "");
        }

        static PathValidation rejected(String input, String reason) {
            return new PathValidation(false, input, null, reason);
        }
    }
}
