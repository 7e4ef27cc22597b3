package com.example.catalogsync.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Helpers for catalog business-key paths such as {@code Departement/"Amt f. Umwelt"}.
 * <p>
 * A name that contains {@code /}, {@code .} or a double quote is enclosed in double quotes,
 * and every double quote inside it is doubled.
 */
public final class CatalogPaths {

    private CatalogPaths() {
    }

    /**
     * Escape a single path segment. Leading and trailing spaces are removed.
     */
    public static String escape(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        String trimmed = name.trim();
        boolean needsQuoting = trimmed.contains("/") || trimmed.contains(".");
        if (trimmed.contains("\"")) {
            needsQuoting = true;
            trimmed = trimmed.replace("\"", "\"\"");
        }
        return needsQuoting ? "\"" + trimmed + "\"" : trimmed;
    }

    /**
     * Reverse of {@link #escape(String)} for a single segment.
     */
    public static String unescape(String segment) {
        if (segment == null || segment.length() < 2) {
            return segment;
        }
        if (segment.startsWith("\"") && segment.endsWith("\"")) {
            return segment.substring(1, segment.length() - 1).replace("\"\"", "\"");
        }
        return segment;
    }

    /**
     * Join already escaped segments into a path.
     */
    public static String join(List<String> escapedSegments) {
        return String.join("/", escapedSegments);
    }

    /**
     * Split an escaped path into its escaped segments. Slashes inside quoted segments do not split.
     */
    public static List<String> split(String path) {
        if (path == null || path.isBlank()) {
            return Collections.emptyList();
        }
        List<String> segments = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < path.length(); i++) {
            char c = path.charAt(i);
            if (c == '"') {
                quoted = !quoted;
                current.append(c);
            } else if (c == '/' && !quoted) {
                if (current.length() > 0) {
                    segments.add(current.toString());
                }
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        if (current.length() > 0) {
            segments.add(current.toString());
        }
        return segments;
    }
}
