package org.elogsync.pipeline.utils;

import java.nio.file.Path;

/**
 * Expands {@code ${VAR}} references and a leading {@code ~} in configured paths.
 * <p>
 * Variables resolve against Java system properties first, then environment variables, so
 * {@code -D} flags can override the environment:
 * <pre>
 * expandPath("${user.home}/elog")      → "/home/user/elog"
 * expandPath("~/elog")                 → "/home/user/elog"
 * expandPath("${ELOG_DATA}/stores")    → "/data/elog/stores"
 * </pre>
 */
public final class PathExpansion {

    private PathExpansion() {
        // Utility class - prevent instantiation
    }

    /**
     * @param path Path possibly containing variables
     * @return The expanded path
     * @throws IllegalArgumentException if a variable is undefined or a reference is unclosed
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
            int startVar = expanded.indexOf("${", pos);
            if (startVar == -1) {
                result.append(expanded.substring(pos));
                break;
            }
            result.append(expanded, pos, startVar);

            int endVar = expanded.indexOf('}', startVar + 2);
            if (endVar == -1) {
                throw new IllegalArgumentException("Unclosed variable in path: " + path);
            }
            String varName = expanded.substring(startVar + 2, endVar);
            String value = resolveVariable(varName);
            if (value == null) {
                throw new IllegalArgumentException("Undefined variable '${" + varName + "}' in path: " + path
                    + ". Check that environment variable or system property exists.");
            }
            result.append(value);
            pos = endVar + 1;
        }
        return result.toString();
    }

    /**
     * Expands the path and converts it to an absolute, normalized {@link Path}.
     */
    public static Path toPath(String path) {
        return Path.of(expandPath(path)).toAbsolutePath().normalize();
    }

    private static String resolveVariable(String varName) {
        String value = System.getProperty(varName);
        if (value != null) {
            return value;
        }
        return System.getenv(varName);
    }
}
