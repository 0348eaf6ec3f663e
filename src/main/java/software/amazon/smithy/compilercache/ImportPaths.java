/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.compilercache;

import java.util.Iterator;
import java.util.NoSuchElementException;
import software.amazon.smithy.compilercache.fs.FilePaths;

/**
 * Computes the import files that apply to a file.
 *
 * <p>Every directory may contain an import file, conventionally
 * {@code _imports.smithy}, whose contents apply to every file in that
 * directory's subtree. A file therefore depends on the import file in its
 * own directory and on the one in each ancestor directory, up to the root.
 */
public final class ImportPaths {
    private ImportPaths() {
    }

    /**
     * Gets the paths of the import files that apply to {@code path}, nearest first.
     *
     * <p>For {@code models/weather/forecast.smithy} this is
     * {@code /models/weather/_imports.smithy}, {@code /models/_imports.smithy},
     * then {@code /_imports.smithy}. If {@code path} is itself an import file,
     * the walk starts at its parent directory. No I/O is done, so the returned
     * paths may not exist.
     *
     * <p>The returned iterable is lazy and can be iterated any number of times.
     *
     * @param path Root-relative path of the file
     * @param importFileName Name of the import file in each directory
     * @return The normalized paths of the import files
     */
    public static Iterable<String> getAncestorImportPaths(String path, String importFileName) {
        if (importFileName == null || importFileName.isBlank()) {
            throw new IllegalArgumentException("Import file name must not be null or blank");
        }

        String normalized = FilePaths.normalize(path);
        String start = FilePaths.getParent(normalized);
        if (start != null && FilePaths.getFileName(normalized).equalsIgnoreCase(importFileName)) {
            start = FilePaths.getParent(start);
        }

        String firstDirectory = start;
        return () -> new AncestorIterator(firstDirectory, importFileName);
    }

    private static final class AncestorIterator implements Iterator<String> {
        private final String importFileName;
        private String directory;

        private AncestorIterator(String directory, String importFileName) {
            this.directory = directory;
            this.importFileName = importFileName;
        }

        @Override
        public boolean hasNext() {
            return directory != null;
        }

        @Override
        public String next() {
            if (directory == null) {
                throw new NoSuchElementException();
            }
            String importPath = FilePaths.combine(directory, importFileName);
            directory = FilePaths.getParent(directory);
            return importPath;
        }
    }
}
