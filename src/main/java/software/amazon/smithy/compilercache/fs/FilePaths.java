/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.compilercache.fs;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Utility methods for working with root-relative file paths.
 *
 * <p>Paths handed to a {@link FileProvider} are logical: they are always
 * relative to the provider's root, use {@code /} as the separator, and
 * start with a leading {@code /} once normalized.
 */
public final class FilePaths {
    public static final char SEPARATOR = '/';
    private static final String APP_ROOT_PREFIX = "~/";

    private FilePaths() {
    }

    /**
     * Normalizes a root-relative path.
     *
     * <p>Backslashes are converted to {@code /}, a leading {@code ~/} is
     * dropped, and {@code .} and {@code ..} segments are resolved. A path
     * can't escape above the root: {@code ..} at the root is ignored.
     *
     * @param path The path to normalize
     * @return The normalized path, with a leading {@code /}
     * @throws IllegalArgumentException If {@code path} is null or blank
     */
    public static String normalize(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Path must not be null or blank");
        }

        String unixPath = path.replace('\\', SEPARATOR);
        if (unixPath.startsWith(APP_ROOT_PREFIX)) {
            unixPath = unixPath.substring(APP_ROOT_PREFIX.length());
        }

        Deque<String> segments = new ArrayDeque<>();
        for (String segment : unixPath.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                segments.pollLast();
            } else {
                segments.addLast(segment);
            }
        }

        return SEPARATOR + String.join("/", segments);
    }

    /**
     * @param normalizedPath A path returned from {@link #normalize(String)}
     * @return The parent directory of the path, {@code /} for files in the
     *  root, or {@code null} if the path is the root itself
     */
    public static String getParent(String normalizedPath) {
        if (isRoot(normalizedPath)) {
            return null;
        }
        int lastSeparator = normalizedPath.lastIndexOf(SEPARATOR);
        return lastSeparator == 0 ? "/" : normalizedPath.substring(0, lastSeparator);
    }

    /**
     * @param normalizedPath A path returned from {@link #normalize(String)}
     * @return The last segment of the path, or an empty string for the root
     */
    public static String getFileName(String normalizedPath) {
        return normalizedPath.substring(normalizedPath.lastIndexOf(SEPARATOR) + 1);
    }

    /**
     * @param directory A normalized directory path
     * @param fileName The name of the file in {@code directory}
     * @return The normalized path of the file
     */
    public static String combine(String directory, String fileName) {
        return isRoot(directory) ? SEPARATOR + fileName : directory + SEPARATOR + fileName;
    }

    /**
     * @param normalizedPath A path returned from {@link #normalize(String)}
     * @return Whether the path is the logical root
     */
    public static boolean isRoot(String normalizedPath) {
        return normalizedPath.length() == 1;
    }
}
