package com.codeviz.core.util;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Utility class for path handling shared by the scanner, the parser registry and the cache.
 */
public final class FileUtils {

    private static final char UNIX_SEPARATOR = '/';

    private FileUtils() {
        // Utility class
    }

    /**
     * Gets the file extension.
     *
     * @param path file path
     * @return file extension without dot, or empty string if no extension
     */
    public static String getExtension(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return "";
        }
        String name = fileName.toString();
        int lastDot = name.lastIndexOf('.');
        return lastDot > 0 ? name.substring(lastDot + 1) : "";
    }

    /**
     * Gets the file extension in lower case, the form used for language lookups.
     *
     * @param path file path
     * @return lower-cased extension without dot, or empty string if no extension
     */
    public static String getNormalizedExtension(Path path) {
        return getExtension(path).toLowerCase(Locale.ROOT);
    }

    /**
     * Returns the path of {@code file} relative to {@code root}, always using {@code /}
     * as separator so that ordering and cache keys do not depend on the platform.
     *
     * @param root project root
     * @param file file or directory below the root
     * @return relative path string, empty for the root itself
     */
    public static String toRelativePath(Path root, Path file) {
        Path relative = root.relativize(file);
        StringBuilder builder = new StringBuilder();
        for (Path part : relative) {
            String segment = part.toString();
            if (segment.isEmpty()) {
                continue;
            }
            if (builder.length() > 0) {
                builder.append(UNIX_SEPARATOR);
            }
            builder.append(segment);
        }
        return builder.toString();
    }

    /**
     * Checks whether a file or directory name marks a hidden entry (leading dot).
     *
     * @param path path to check
     * @return true if the last path element starts with a dot
     */
    public static boolean isHidden(Path path) {
        Path fileName = path.getFileName();
        return fileName != null && fileName.toString().startsWith(".");
    }
}
