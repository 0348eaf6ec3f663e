/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.compilercache.fs;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Logger;

/**
 * A {@link FileProvider} for files under a directory on disk.
 *
 * <p>This provider doesn't watch the file system itself. Instead, whoever
 * receives change notifications, typically the client through
 * {@code workspace/didChangeWatchedFiles}, reports them with
 * {@link #notifyChanged(Path)}.
 *
 * <p>There is at most one live {@link FileChangeTrigger} per path, shared by
 * every watcher of that path until it fires. Once fired it is discarded, so
 * the next call to {@link #watch(Collection)} gets a fresh one.
 *
 * <p>Triggers are keyed ignoring case. Whether or not the file system is
 * case-sensitive, a change reported under a file's real path expires
 * triggers acquired through any casing of it. Files that differ only in case
 * expire each other's triggers.
 */
public final class PhysicalFileProvider implements FileProvider {
    private static final Logger LOGGER = Logger.getLogger(PhysicalFileProvider.class.getName());

    private final Path root;
    private final ConcurrentMap<String, FileChangeTrigger> triggers = new ConcurrentHashMap<>();

    /**
     * @param root The directory that root-relative paths are resolved against
     */
    public PhysicalFileProvider(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    /**
     * @return The absolute, normalized root directory
     */
    public Path root() {
        return root;
    }

    @Override
    public FileInfo getFileInfo(String subpath) {
        String normalized = FilePaths.normalize(subpath);
        Path path = toPhysicalPath(normalized);
        if (!Files.isRegularFile(path)) {
            return new NotFoundFileInfo(FilePaths.getFileName(normalized));
        }
        return new PhysicalFileInfo(path);
    }

    @Override
    public ChangeTrigger watch(Collection<String> subpaths) {
        Set<String> normalized = new LinkedHashSet<>(subpaths.size());
        for (String subpath : subpaths) {
            normalized.add(toTriggerKey(FilePaths.normalize(subpath)));
        }

        List<FileChangeTrigger> watched = new ArrayList<>(normalized.size());
        for (String path : normalized) {
            watched.add(triggers.computeIfAbsent(path, ignored -> new FileChangeTrigger()));
        }
        return CompositeChangeTrigger.of(watched);
    }

    /**
     * Expires the triggers for {@code changed}, and for anything under it if
     * it was a directory, such as a deleted directory reported by the watchers
     * from {@code FileWatcherRegistrations}.
     *
     * @param changed Absolute path of the file or directory that was created,
     *  changed, or deleted
     * @return The number of triggers that were expired
     */
    public int notifyChanged(Path changed) {
        Path absolute = changed.toAbsolutePath().normalize();
        if (!absolute.startsWith(root)) {
            LOGGER.finest(() -> "Ignoring change outside of " + root + ": " + changed);
            return 0;
        }

        String key = toTriggerKey(
                absolute.equals(root) ? "/" : FilePaths.normalize(root.relativize(absolute).toString()));
        String directoryPrefix = FilePaths.isRoot(key) ? key : key + FilePaths.SEPARATOR;

        int expired = 0;
        Iterator<Map.Entry<String, FileChangeTrigger>> iterator = triggers.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<String, FileChangeTrigger> entry = iterator.next();
            String watchedPath = entry.getKey();
            if (watchedPath.equals(key) || watchedPath.startsWith(directoryPrefix)) {
                iterator.remove();
                if (entry.getValue().expire()) {
                    expired++;
                }
            }
        }

        int count = expired;
        LOGGER.fine(() -> "Change to " + key + " expired " + count + " trigger(s)");
        return count;
    }

    private static String toTriggerKey(String normalized) {
        return normalized.toLowerCase(Locale.ROOT);
    }

    private Path toPhysicalPath(String normalized) {
        // Normalized paths can't contain '..', so this always stays under the root
        return root.resolve(normalized.substring(1));
    }
}
