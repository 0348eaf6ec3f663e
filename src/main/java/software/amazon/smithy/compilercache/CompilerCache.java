/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.compilercache;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;
import java.util.logging.Logger;
import software.amazon.smithy.compilercache.fs.ChangeTrigger;
import software.amazon.smithy.compilercache.fs.CompositeChangeTrigger;
import software.amazon.smithy.compilercache.fs.FileInfo;
import software.amazon.smithy.compilercache.fs.FilePaths;
import software.amazon.smithy.compilercache.fs.FileProvider;
import software.amazon.smithy.compilercache.fs.RelativeFileInfo;

/**
 * Caches the results of compiling files, keyed by path.
 *
 * <p>A compiled entry is invalidated when the file itself, or any of its
 * ancestor import files (see {@link ImportPaths}), is created, changed, or
 * deleted. Files that don't exist are cached too, and invalidated when the
 * file is created.
 *
 * <p>Unless {@link CompilerCacheOptions#isCaseSensitive()}, paths that differ
 * only in case share an entry. A missing file is only reported from the cache
 * for the exact path that was probed, since the file system itself may be
 * case-sensitive.
 *
 * <p>Precompiled types supplied at construction are always returned as-is.
 * They are never recompiled, and the file system is never consulted for them.
 *
 * <p>This class is thread-safe. Compilation happens outside of any lock, so
 * concurrent lookups of the same path may both compile it. The last result
 * to be published wins, and every caller gets a complete result.
 */
public final class CompilerCache {
    private static final Logger LOGGER = Logger.getLogger(CompilerCache.class.getName());

    private final FileProvider fileProvider;
    private final CompilerCacheOptions options;
    private final Map<String, CompilerCacheEntry> precompiled;
    private final ConcurrentMap<String, CompilerCacheEntry> entries = new ConcurrentHashMap<>();

    /**
     * @param fileProvider Provider used to find files and watch for changes
     */
    public CompilerCache(FileProvider fileProvider) {
        this(fileProvider, Map.of());
    }

    /**
     * @param fileProvider Provider used to find files and watch for changes
     * @param precompiledTypes Types that were compiled ahead of time, by path
     */
    public CompilerCache(FileProvider fileProvider, Map<String, Class<?>> precompiledTypes) {
        this(fileProvider, precompiledTypes, CompilerCacheOptions.defaults());
    }

    /**
     * @param fileProvider Provider used to find files and watch for changes
     * @param precompiledTypes Types that were compiled ahead of time, by path
     * @param options Options controlling keys and import files
     * @throws IllegalArgumentException If a precompiled path is blank, has no
     *  type, or collides with another precompiled path once normalized
     */
    public CompilerCache(
            FileProvider fileProvider,
            Map<String, Class<?>> precompiledTypes,
            CompilerCacheOptions options
    ) {
        this.fileProvider = Objects.requireNonNull(fileProvider, "fileProvider");
        this.options = Objects.requireNonNull(options, "options");
        this.precompiled = createPrecompiledEntries(precompiledTypes);
    }

    /**
     * @return The options this cache was created with
     */
    public CompilerCacheOptions options() {
        return options;
    }

    /**
     * @return The number of runtime entries, including cached missing files,
     *  but not precompiled types
     */
    public int size() {
        return entries.size();
    }

    /**
     * Gets the cached compilation result for the file at {@code relativePath},
     * compiling it with {@code compile} if there is no valid cached result.
     *
     * <p>{@code compile} is called at most once, and not at all if the file
     * doesn't exist, is precompiled, or has a valid cached result. Exceptions
     * thrown by {@code compile} are propagated and nothing is cached.
     *
     * @param relativePath Root-relative path of the file
     * @param compile Function that compiles the file
     * @return {@link CompilerCacheResult#FILE_NOT_FOUND} if the file doesn't
     *  exist, otherwise the result of compilation
     * @throws CompilationFailedException If {@code compile} returns a failed result
     */
    public CompilerCacheResult getOrAdd(String relativePath, Function<RelativeFileInfo, CompilationResult> compile) {
        Objects.requireNonNull(compile, "compile");
        String normalizedPath = FilePaths.normalize(relativePath);
        String key = toKey(normalizedPath);

        CompilerCacheEntry precompiledEntry = precompiled.get(key);
        if (precompiledEntry != null) {
            return precompiledEntry.result();
        }

        CompilerCacheEntry entry = entries.get(key);
        if (entry != null) {
            if (entry.isExpired()) {
                LOGGER.fine(() -> "Cached " + entry.type() + " entry for " + normalizedPath + " expired");
                entries.remove(key, entry);
            } else if (entry.appliesTo(normalizedPath)) {
                LOGGER.finest(() -> "Cache hit for " + normalizedPath);
                return entry.result();
            } else {
                LOGGER.fine(() -> "Checking " + normalizedPath + " again, it was cached as missing in another case");
            }
        }

        return createEntry(normalizedPath, key, compile);
    }

    private CompilerCacheResult createEntry(
            String normalizedPath,
            String key,
            Function<RelativeFileInfo, CompilationResult> compile
    ) {
        // Watch before probing, so a file created right after the probe still expires the entry
        ChangeTrigger fileTrigger = fileProvider.watch(normalizedPath);
        FileInfo fileInfo = fileProvider.getFileInfo(normalizedPath);
        if (!fileInfo.exists()) {
            entries.put(key, CompilerCacheEntry.notFound(normalizedPath, fileTrigger));
            LOGGER.fine(() -> "File not found: " + normalizedPath);
            return CompilerCacheResult.FILE_NOT_FOUND;
        }

        // Watch before compiling, so changes made while compiling still expire the entry
        ChangeTrigger trigger = CompositeChangeTrigger.of(List.of(
                fileTrigger,
                fileProvider.watch(getWatchedPaths(normalizedPath))));

        LOGGER.fine(() -> "Compiling " + normalizedPath);
        CompilationResult compilationResult = compile.apply(new RelativeFileInfo(fileInfo, normalizedPath));
        if (compilationResult == null) {
            throw new IllegalStateException("Compiling " + normalizedPath + " returned no result");
        }
        compilationResult.ensureSuccessful();

        CompilationResult cachedResult = compilationResult instanceof UncachedCompilationResult
                ? CompilationResult.successful(compilationResult.compiledType())
                : compilationResult;
        entries.put(key, CompilerCacheEntry.compiled(normalizedPath, cachedResult, trigger));

        return CompilerCacheResult.found(compilationResult, false);
    }

    private List<String> getWatchedPaths(String normalizedPath) {
        List<String> watched = new ArrayList<>();
        watched.add(normalizedPath);
        for (String importPath : ImportPaths.getAncestorImportPaths(normalizedPath, options.getImportFileName())) {
            watched.add(importPath);
        }
        return watched;
    }

    private Map<String, CompilerCacheEntry> createPrecompiledEntries(Map<String, Class<?>> precompiledTypes) {
        Map<String, CompilerCacheEntry> result = new HashMap<>(precompiledTypes.size());
        Map<String, String> originalPaths = new HashMap<>(precompiledTypes.size());
        for (Map.Entry<String, Class<?>> precompiledType : precompiledTypes.entrySet()) {
            String path = precompiledType.getKey();
            if (path == null || path.isBlank()) {
                throw new IllegalArgumentException("Precompiled types must have a non-blank path");
            }
            if (precompiledType.getValue() == null) {
                throw new IllegalArgumentException("Precompiled type for " + path + " must not be null");
            }

            String key = toKey(FilePaths.normalize(path));
            String previous = originalPaths.putIfAbsent(key, path);
            if (previous != null) {
                throw new IllegalArgumentException(String.format(
                        "Precompiled paths '%s' and '%s' refer to the same file", previous, path));
            }
            result.put(key, CompilerCacheEntry.precompiled(precompiledType.getValue()));
        }

        LOGGER.fine(() -> "Registered " + result.size() + " precompiled type(s)");
        return Map.copyOf(result);
    }

    private String toKey(String normalizedPath) {
        return options.isCaseSensitive() ? normalizedPath : normalizedPath.toLowerCase(Locale.ROOT);
    }
}
