package com.stylefixer.util;

import java.nio.file.Path;
import java.util.List;

/**
 * Matches file paths against the include pattern given on the command line and the
 * {@code ignoreFiles} patterns of the configuration.
 */
public final class PathFilter {

    private PathFilter() {
    }

    /**
     * Matches the file name against {@code *.ext}, a {@code *}/{@code ?} wildcard, or a substring.
     */
    public static boolean matchesIncludePattern(Path file, String includePattern) {
        if (includePattern == null || includePattern.isEmpty()) {
            return true;
        }

        String fileName = file.getFileName().toString();

        if (includePattern.startsWith("*.")) {
            String extension = includePattern.substring(1);
            return fileName.endsWith(extension);
        } else if (includePattern.contains("*") || includePattern.contains("?")) {
            return fileName.matches(_toRegex(includePattern));
        } else {
            return fileName.contains(includePattern);
        }
    }

    /**
     * Matches the path relative to {@code basePath} against {@code **}/suffix, prefix/{@code **},
     * wildcard and exact patterns.
     */
    public static boolean isIgnored(Path file, Path basePath, List<String> ignorePatterns) {
        if (ignorePatterns == null || ignorePatterns.isEmpty()) {
            return false;
        }

        String relativePath = basePath.relativize(file).toString().replace("\\", "/");

        for (String pattern : ignorePatterns) {
            if (pattern.startsWith("**/")) {
                String suffix = pattern.substring(3);
                if (relativePath.equals(suffix) || relativePath.endsWith("/" + suffix)
                        || (suffix.contains("*") && relativePath.matches("(.*/)?" + _toRegex(suffix)))) {
                    return true;
                }
            } else if (pattern.endsWith("/**")) {
                String prefix = pattern.substring(0, pattern.length() - 3);
                if (relativePath.startsWith(prefix + "/")) {
                    return true;
                }
            } else if (pattern.contains("*") || pattern.contains("?")) {
                if (relativePath.matches(_toRegex(pattern))) {
                    return true;
                }
            } else if (pattern.equals(relativePath)) {
                return true;
            }
        }

        return false;
    }

    private static String _toRegex(String glob) {
        return glob
                .replace(".", "\\.")
                .replace("*", ".*")
                .replace("?", ".");
    }
}
