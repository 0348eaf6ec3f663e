/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.compilercache.fs;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import software.amazon.smithy.utils.IoUtils;

/**
 * A {@link FileInfo} backed by a regular file on disk.
 */
public final class PhysicalFileInfo implements FileInfo {
    private final Path path;

    PhysicalFileInfo(Path path) {
        this.path = path;
    }

    @Override
    public boolean exists() {
        return Files.isRegularFile(path);
    }

    @Override
    public String name() {
        return path.getFileName().toString();
    }

    @Override
    public Path physicalPath() {
        return path;
    }

    @Override
    public Instant lastModified() {
        try {
            return Files.getLastModifiedTime(path).toInstant();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public String readText() {
        return IoUtils.readUtf8File(path);
    }

    @Override
    public String toString() {
        return "PhysicalFileInfo{path=" + path + '}';
    }
}
