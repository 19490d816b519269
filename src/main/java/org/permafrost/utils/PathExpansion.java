/*
 * Copyright (c) 2024-Present Perracodex. Use of this source code is governed by an MIT license.
 */

package org.permafrost.utils;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Expands {@code ${VAR}} placeholders and a leading {@code ~} in configured paths.
 * <p>
 * System properties win over environment variables, so {@code -Dpermafrost.home=...} overrides
 * an exported {@code permafrost.home}.
 * </p>
 */
public final class PathExpansion {

    private PathExpansion() {
        // Utility class - prevent instantiation
    }

    /**
     * @param path Path text with optional {@code ${VAR}} placeholders.
     * @return the expanded text, or the input if it contains nothing to expand
     * @throws IllegalArgumentException if a placeholder is unclosed or undefined
     */
    public static String expandPath(String path) {
        if (path == null) {
            return null;
        }
        String expanded = path;
        if (expanded.equals("~") || expanded.startsWith("~/")) {
            expanded = System.getProperty("user.home") + expanded.substring(1);
        }
        if (!expanded.contains("${")) {
            return expanded;
        }

        StringBuilder result = new StringBuilder();
        int pos = 0;
        while (pos < expanded.length()) {
            int start = expanded.indexOf("${", pos);
            if (start == -1) {
                result.append(expanded, pos, expanded.length());
                break;
            }
            result.append(expanded, pos, start);
            int end = expanded.indexOf('}', start + 2);
            if (end == -1) {
                throw new IllegalArgumentException("Unclosed variable in path: " + path);
            }
            String name = expanded.substring(start + 2, end);
            String value = resolveVariable(name);
            if (value == null) {
                throw new IllegalArgumentException("Undefined variable '${" + name + "}' in path: " + path
                    + ". Check that environment variable or system property exists.");
            }
            result.append(value);
            pos = end + 1;
        }
        return result.toString();
    }

    /**
     * Expands a path and makes it absolute against the working directory.
     *
     * @param path Path text.
     * @return absolute, normalized path
     */
    public static Path toAbsolutePath(String path) {
        return Paths.get(expandPath(path)).toAbsolutePath().normalize();
    }

    private static String resolveVariable(String name) {
        String value = System.getProperty(name);
        return value != null ? value : System.getenv(name);
    }
}
