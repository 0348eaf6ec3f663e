/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.compilercache.lsp;

import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.logging.Logger;
import org.eclipse.lsp4j.DidChangeConfigurationParams;
import org.eclipse.lsp4j.DidChangeWatchedFilesParams;
import org.eclipse.lsp4j.FileEvent;
import org.eclipse.lsp4j.services.WorkspaceService;
import software.amazon.smithy.compilercache.fs.PhysicalFileProvider;

/**
 * Forwards file change notifications from the client to a {@link PhysicalFileProvider},
 * expiring the change triggers of any cache entries that depend on the changed files.
 */
public final class CompilerCacheWorkspaceService implements WorkspaceService {
    private static final Logger LOGGER = Logger.getLogger(CompilerCacheWorkspaceService.class.getName());

    private final PhysicalFileProvider fileProvider;

    /**
     * @param fileProvider The provider whose triggers should be expired on changes
     */
    public CompilerCacheWorkspaceService(PhysicalFileProvider fileProvider) {
        this.fileProvider = fileProvider;
    }

    @Override
    public void didChangeWatchedFiles(DidChangeWatchedFilesParams params) {
        LOGGER.finest("DidChangeWatchedFiles");
        applyFileEvents(params.getChanges());
    }

    @Override
    public void didChangeConfiguration(DidChangeConfigurationParams params) {
        // Options only take effect for caches created after initialization
        LOGGER.finest("DidChangeConfiguration");
    }

    /**
     * @param events The file events to apply
     * @return The number of triggers that were expired
     */
    int applyFileEvents(List<FileEvent> events) {
        int expired = 0;
        for (FileEvent event : events) {
            Path changedPath = toPath(event.getUri());
            if (changedPath == null) {
                LOGGER.warning(() -> "Ignoring " + event.getType() + " event for non-file URI: " + event.getUri());
                continue;
            }
            expired += fileProvider.notifyChanged(changedPath);
        }
        return expired;
    }

    private static Path toPath(String uri) {
        if (uri == null || !uri.startsWith("file:")) {
            return null;
        }
        return Paths.get(URI.create(uri));
    }
}
