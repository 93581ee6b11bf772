package io.github.chirino.checkin.model;

import java.util.Locale;

/** Helpers for attacker-supplied file names. Both {@code /} and {@code \} count as separators. */
public final class FileNames {

    private FileNames() {}

    /** Final path component, with every directory component stripped. */
    public static String baseName(String path) {
        if (path == null) {
            return "";
        }
        String trimmed = path;
        while (trimmed.endsWith("/") || trimmed.endsWith("\\")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        int slash = Math.max(trimmed.lastIndexOf('/'), trimmed.lastIndexOf('\\'));
        return slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
    }

    /** Lower-cased extension including the dot, or an empty string. Leading dots do not count. */
    public static String extension(String path) {
        String name = baseName(path);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot).toLowerCase(Locale.ROOT) : "";
    }

    /** Base name without its final extension. */
    public static String stem(String path) {
        String name = baseName(path);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    public static boolean isDirectoryName(String path) {
        return path != null && (path.endsWith("/") || path.endsWith("\\"));
    }
}
