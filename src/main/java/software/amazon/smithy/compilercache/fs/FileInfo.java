/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.compilercache.fs;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A file, or the absence of one, as seen by a {@link FileProvider}.
 */
public interface FileInfo {
    /**
     * @return Whether the file exists
     */
    boolean exists();

    /**
     * @return The name of the file, without any directory
     */
    String name();

    /**
     * @return The path of the file on disk, or {@code null} if it isn't
     *  backed by a physical file
     */
    Path physicalPath();

    /**
     * @return When the file was last modified, or {@link Instant#EPOCH} if
     *  it doesn't exist
     */
    Instant lastModified();

    /**
     * @return The UTF-8 text of the file
     * @throws IllegalStateException If the file doesn't exist
     */
    String readText();
}
