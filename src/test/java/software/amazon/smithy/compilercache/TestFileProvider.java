/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.compilercache;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import software.amazon.smithy.compilercache.fs.ChangeTrigger;
import software.amazon.smithy.compilercache.fs.CompositeChangeTrigger;
import software.amazon.smithy.compilercache.fs.FileChangeTrigger;
import software.amazon.smithy.compilercache.fs.FileInfo;
import software.amazon.smithy.compilercache.fs.FilePaths;
import software.amazon.smithy.compilercache.fs.FileProvider;
import software.amazon.smithy.compilercache.fs.NotFoundFileInfo;

/**
 * In-memory {@link FileProvider} with triggers that tests can expire by path,
 * and counters for how often each file was looked up.
 */
public class TestFileProvider implements FileProvider {
    private final Map<String, TestFileInfo> files = new ConcurrentHashMap<>();
    private final Map<String, FileChangeTrigger> triggers = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> fileInfoCalls = new ConcurrentHashMap<>();
    private final AtomicInteger watchCalls = new AtomicInteger();

    public TestFileProvider addFile(String path, String contents) {
        String normalized = FilePaths.normalize(path);
        files.put(normalized, new TestFileInfo(FilePaths.getFileName(normalized), contents));
        return this;
    }

    public void deleteFile(String path) {
        files.remove(FilePaths.normalize(path));
    }

    /**
     * @param path Path to get the current trigger of
     * @return The trigger handed out by the last {@link #watch} of {@code path}, which
     *  tests can {@link FileChangeTrigger#expire()} to simulate a change
     * @throws IllegalStateException If {@code path} was never watched
     */
    public FileChangeTrigger getTrigger(String path) {
        FileChangeTrigger trigger = triggers.get(FilePaths.normalize(path));
        if (trigger == null) {
            throw new IllegalStateException("No trigger for " + path);
        }
        return trigger;
    }

    public int getFileInfoCalls(String path) {
        AtomicInteger calls = fileInfoCalls.get(FilePaths.normalize(path));
        return calls == null ? 0 : calls.get();
    }

    public int getWatchCalls() {
        return watchCalls.get();
    }

    @Override
    public FileInfo getFileInfo(String subpath) {
        String normalized = FilePaths.normalize(subpath);
        fileInfoCalls.computeIfAbsent(normalized, ignored -> new AtomicInteger()).incrementAndGet();
        FileInfo fileInfo = files.get(normalized);
        return fileInfo != null ? fileInfo : new NotFoundFileInfo(FilePaths.getFileName(normalized));
    }

    @Override
    public ChangeTrigger watch(Collection<String> subpaths) {
        watchCalls.incrementAndGet();
        List<ChangeTrigger> watched = new ArrayList<>(subpaths.size());
        for (String subpath : subpaths) {
            // Expired triggers are replaced, like a real provider discards them once fired
            watched.add(triggers.compute(FilePaths.normalize(subpath), (path, existing) ->
                    existing == null || existing.isExpired() ? new FileChangeTrigger() : existing));
        }
        return CompositeChangeTrigger.of(watched);
    }

    private record TestFileInfo(String name, String contents) implements FileInfo {
        @Override
        public boolean exists() {
            return true;
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
            return contents;
        }
    }
}
