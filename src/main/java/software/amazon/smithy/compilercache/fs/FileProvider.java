/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.compilercache.fs;

import java.util.Collection;
import java.util.List;

/**
 * Looks up files by root-relative path and issues {@link ChangeTrigger}s for them.
 */
public interface FileProvider {
    /**
     * @param subpath Root-relative path of the file
     * @return Info for the file, which may be a file that doesn't {@link FileInfo#exists()}
     */
    FileInfo getFileInfo(String subpath);

    /**
     * Watches a set of files together.
     *
     * <p>Paths don't have to exist: creating a watched file expires the
     * returned trigger just like changing or deleting one does.
     *
     * @param subpaths Root-relative paths to watch
     * @return A single trigger that expires when any of {@code subpaths} changes
     */
    ChangeTrigger watch(Collection<String> subpaths);

    /**
     * @param subpath Root-relative path to watch
     * @return A trigger that expires when {@code subpath} changes
     */
    default ChangeTrigger watch(String subpath) {
        return watch(List.of(subpath));
    }
}
