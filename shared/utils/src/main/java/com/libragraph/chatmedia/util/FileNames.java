package com.libragraph.chatmedia.util;

import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * File-name helpers for the output tree.
 */
public final class FileNames {

    private static final Pattern RESERVED = Pattern.compile("[<>:\"/\\\\|?*\\p{Cntrl}]");
    private static final Pattern NON_SEGMENT = Pattern.compile("[^a-zA-Z0-9_@.-]");

    private FileNames() {
    }

    /**
     * Replaces characters that are reserved on common file systems with {@code _}.
     * Never returns an empty string.
     */
    public static String sanitize(String name) {
        String cleaned = RESERVED.matcher(name).replaceAll("_").trim();
        if (cleaned.isEmpty() || cleaned.equals(".") || cleaned.equals("..")) {
            return "_";
        }
        return cleaned;
    }

    /** Stricter form used for path segments derived from account ids. */
    public static String sanitizeSegment(String name) {
        return NON_SEGMENT.matcher(name.trim()).replaceAll("_");
    }

    /** Lowercase extension including the dot, or empty. */
    public static String extension(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot).toLowerCase() : "";
    }

    /** File name without its last extension. */
    public static String stem(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
