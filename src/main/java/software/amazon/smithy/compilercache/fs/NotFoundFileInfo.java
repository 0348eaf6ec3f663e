/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.compilercache.fs;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A {@link FileInfo} for a file that doesn't exist.
 *
 * @param name The name of the missing file
 */
public record NotFoundFileInfo(String name) implements FileInfo {
    @Override
    public boolean exists() {
        return false;
    }

    @Override
    public Path physicalPath() {
        return null;
    }

    @Override
    public Instant lastModified() {
        return Instant.EPOCH;
    }

    @Override
    public String readText() {
        throw new IllegalStateException("File does not exist: " + name);
    }
}
