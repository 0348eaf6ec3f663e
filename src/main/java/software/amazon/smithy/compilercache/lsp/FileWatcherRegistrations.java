/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.compilercache.lsp;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import org.eclipse.lsp4j.DidChangeWatchedFilesRegistrationOptions;
import org.eclipse.lsp4j.FileSystemWatcher;
import org.eclipse.lsp4j.Registration;
import org.eclipse.lsp4j.Unregistration;
import org.eclipse.lsp4j.WatchKind;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import software.amazon.smithy.compilercache.CompilerCacheOptions;

/**
 * Computes the {@link Registration}s and {@link Unregistration}s that tell
 * the client which files to watch for changes.
 *
 * <p>Compiled entries depend on their source file and on every ancestor
 * import file, whether or not it exists yet. So the client is asked to report
 * creation, change, and deletion of any source or import file under each root,
 * and deletion of anything under each root so that deleted directories are
 * seen. Those events are forwarded to {@link CompilerCacheWorkspaceService}.
 *
 * <p>Clients don't de-duplicate file watchers, so all watchers must be
 * unregistered before registering a new list.
 */
public final class FileWatcherRegistrations {
    static final String WATCH_COMPILED_FILES_ID = "WatchCompiledFiles";
    static final String WATCH_FILES_METHOD = "workspace/didChangeWatchedFiles";
    private static final Integer WATCH_ALL_KINDS = WatchKind.Create | WatchKind.Change | WatchKind.Delete;
    private static final List<Unregistration> COMPILED_FILE_WATCHER_UNREGISTRATIONS = List.of(new Unregistration(
            WATCH_COMPILED_FILES_ID,
            WATCH_FILES_METHOD));

    private FileWatcherRegistrations() {
    }

    /**
     * @param roots The roots of the file providers to watch
     * @param options Options naming the import file and source file extensions
     * @return The registrations to watch source and import files under all roots
     */
    public static List<Registration> getWatcherRegistrations(Collection<Path> roots, CompilerCacheOptions options) {
        List<FileSystemWatcher> watchers = new ArrayList<>(roots.size() * 3);
        for (Path root : roots) {
            watchers.add(new FileSystemWatcher(
                    Either.forLeft(getSourceFilesWatchPattern(root, options.getSourceFileExtensions())),
                    WATCH_ALL_KINDS));
            watchers.add(new FileSystemWatcher(
                    Either.forLeft(getImportFilesWatchPattern(root, options.getImportFileName())),
                    WATCH_ALL_KINDS));
            watchers.add(new FileSystemWatcher(
                    Either.forLeft(getDeletedDirectoriesWatchPattern(root)),
                    WatchKind.Delete));
        }

        return Collections.singletonList(new Registration(
                WATCH_COMPILED_FILES_ID,
                WATCH_FILES_METHOD,
                new DidChangeWatchedFilesRegistrationOptions(watchers)));
    }

    /**
     * @return The unregistrations to stop watching source and import files
     */
    public static List<Unregistration> getWatcherUnregistrations() {
        return COMPILED_FILE_WATCHER_UNREGISTRATIONS;
    }

    static String getSourceFilesWatchPattern(Path root, List<String> extensions) {
        String extensionPattern = extensions.size() == 1
                ? extensions.get(0)
                : "{" + String.join(",", extensions) + "}";
        return escapeBackslashes(withTrailingSeparator(root) + "**" + File.separator + "*." + extensionPattern);
    }

    static String getImportFilesWatchPattern(Path root, String importFileName) {
        return escapeBackslashes(withTrailingSeparator(root) + "**" + File.separator + importFileName);
    }

    // Deleting a directory is reported for the directory itself, which the
    // file globs above don't match
    static String getDeletedDirectoriesWatchPattern(Path root) {
        return escapeBackslashes(withTrailingSeparator(root) + "**");
    }

    private static String withTrailingSeparator(Path root) {
        String rootString = root.toString();
        if (!rootString.endsWith(File.separator)) {
            rootString += File.separator;
        }
        return rootString;
    }

    // In glob patterns, '\' is an escape character, so it needs to escaped
    // itself to work as a separator (i.e. for windows)
    private static String escapeBackslashes(String pattern) {
        return pattern.replace("\\", "\\\\");
    }
}
