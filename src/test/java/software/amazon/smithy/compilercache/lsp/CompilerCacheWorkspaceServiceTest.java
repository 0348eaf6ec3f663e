/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.compilercache.lsp;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.eclipse.lsp4j.DidChangeWatchedFilesParams;
import org.eclipse.lsp4j.FileChangeType;
import org.eclipse.lsp4j.FileEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.smithy.compilercache.CompilationResult;
import software.amazon.smithy.compilercache.CompilerCache;
import software.amazon.smithy.compilercache.CompilerCacheResult;
import software.amazon.smithy.compilercache.fs.ChangeTrigger;
import software.amazon.smithy.compilercache.fs.FileInfo;
import software.amazon.smithy.compilercache.fs.FileProvider;
import software.amazon.smithy.compilercache.fs.PhysicalFileProvider;

public class CompilerCacheWorkspaceServiceTest {
    private Path root;
    private PhysicalFileProvider fileProvider;
    private CompilerCacheWorkspaceService service;

    @BeforeEach
    public void setup() throws IOException {
        root = Files.createTempDirectory("compiler-cache-workspace");
        root.toFile().deleteOnExit();
        fileProvider = new PhysicalFileProvider(root);
        service = new CompilerCacheWorkspaceService(fileProvider);
    }

    @Test
    public void expiresTriggersForFileEvents() {
        ChangeTrigger trigger = fileProvider.watch("models/forecast.smithy");

        service.didChangeWatchedFiles(new DidChangeWatchedFilesParams(List.of(
                new FileEvent(uri("models/forecast.smithy"), FileChangeType.Changed))));

        assertThat(trigger.isExpired(), is(true));
    }

    @Test
    public void ignoresNonFileUris() {
        ChangeTrigger trigger = fileProvider.watch("models/forecast.smithy");

        int expired = service.applyFileEvents(List.of(
                new FileEvent("smithyjar:/foo.jar!/models/forecast.smithy", FileChangeType.Deleted)));

        assertThat(expired, equalTo(0));
        assertThat(trigger.isExpired(), is(false));
    }

    @Test
    public void recompilesWhenAncestorImportIsCreated() throws IOException {
        writeFile("models/weather/forecast.smithy", "namespace example.weather");
        CompilerCache cache = new CompilerCache(fileProvider);
        List<String> compiledTexts = new ArrayList<>();

        CompilerCacheResult first = cache.getOrAdd("models/weather/forecast.smithy", file -> {
            compiledTexts.add(file.fileInfo().readText());
            return CompilationResult.successful(String.class);
        });
        CompilerCacheResult cached = cache.getOrAdd("models/weather/forecast.smithy", file -> {
            throw new AssertionError("Shouldn't be called");
        });

        assertThat(first.isFromCache(), is(false));
        assertThat(cached.isFromCache(), is(true));

        writeFile("models/_imports.smithy", "use example.common#Id");
        service.didChangeWatchedFiles(new DidChangeWatchedFilesParams(List.of(
                new FileEvent(uri("models/_imports.smithy"), FileChangeType.Created))));
        CompilationResult expected = CompilationResult.successful(Integer.class);
        CompilerCacheResult recompiled = cache.getOrAdd("models/weather/forecast.smithy", file -> {
            compiledTexts.add(file.fileInfo().readText());
            return expected;
        });

        assertThat(recompiled.isFromCache(), is(false));
        assertThat(recompiled.compilationResult(), sameInstance(expected));
        assertThat(compiledTexts, equalTo(List.of("namespace example.weather", "namespace example.weather")));
    }

    @Test
    public void reportsDeletedFilesAsNotFound() throws IOException {
        writeFile("models/forecast.smithy", "namespace example");
        CompilerCache cache = new CompilerCache(fileProvider);
        cache.getOrAdd("models/forecast.smithy", file -> CompilationResult.successful(String.class));

        Files.delete(root.resolve("models/forecast.smithy"));
        service.didChangeWatchedFiles(new DidChangeWatchedFilesParams(List.of(
                new FileEvent(uri("models/forecast.smithy"), FileChangeType.Deleted))));
        CompilerCacheResult result = cache.getOrAdd("models/forecast.smithy", file -> {
            throw new AssertionError("Shouldn't be called");
        });

        assertThat(result, sameInstance(CompilerCacheResult.FILE_NOT_FOUND));
    }

    @Test
    public void findsFileAfterLookupInWrongCase() throws IOException {
        writeFile("Models/Forecast.smithy", "namespace example");
        CompilerCache cache = new CompilerCache(fileProvider);

        cache.getOrAdd("models/forecast.smithy", file -> CompilationResult.successful(String.class));
        CompilerCacheResult result = cache.getOrAdd("Models/Forecast.smithy",
                file -> CompilationResult.successful(String.class));

        assertThat(result.isFound(), is(true));
        assertThat(result.compilationResult().compiledType(), sameInstance(String.class));
    }

    @Test
    public void recompilesWhenChangeIsReportedInAnotherCase() throws IOException {
        writeFile("Models/Forecast.smithy", "namespace example");
        CompilerCache cache = new CompilerCache(fileProvider);
        cache.getOrAdd("Models/Forecast.smithy", file -> CompilationResult.successful(String.class));

        service.didChangeWatchedFiles(new DidChangeWatchedFilesParams(List.of(
                new FileEvent(uri("models/FORECAST.smithy"), FileChangeType.Changed))));
        CompilerCacheResult result = cache.getOrAdd("Models/Forecast.smithy",
                file -> CompilationResult.successful(Integer.class));

        assertThat(result.isFromCache(), is(false));
        assertThat(result.compilationResult().compiledType(), sameInstance(Integer.class));
    }

    @Test
    public void seesFileCreatedWhileCheckingIfItExists() {
        FileProvider creatingProvider = new FileProvider() {
            private boolean created;

            @Override
            public FileInfo getFileInfo(String subpath) {
                FileInfo fileInfo = fileProvider.getFileInfo(subpath);
                if (!created) {
                    created = true;
                    try {
                        writeFile("models/forecast.smithy", "namespace example");
                    } catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                    service.didChangeWatchedFiles(new DidChangeWatchedFilesParams(List.of(
                            new FileEvent(uri("models/forecast.smithy"), FileChangeType.Created))));
                }
                return fileInfo;
            }

            @Override
            public ChangeTrigger watch(Collection<String> subpaths) {
                return fileProvider.watch(subpaths);
            }
        };
        CompilerCache cache = new CompilerCache(creatingProvider);

        CompilerCacheResult missing = cache.getOrAdd("models/forecast.smithy",
                file -> CompilationResult.successful(String.class));
        CompilerCacheResult found = cache.getOrAdd("models/forecast.smithy",
                file -> CompilationResult.successful(String.class));

        assertThat(missing, sameInstance(CompilerCacheResult.FILE_NOT_FOUND));
        assertThat(found.isFound(), is(true));
        assertThat(found.isFromCache(), is(false));
    }

    private String uri(String relativePath) {
        return root.resolve(relativePath).toUri().toString();
    }

    private void writeFile(String relativePath, String text) throws IOException {
        Path path = root.resolve(relativePath);
        Files.createDirectories(path.getParent());
        Files.write(path, text.getBytes(StandardCharsets.UTF_8));
    }
}
