/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.compilercache;

/**
 * The result of {@link CompilerCache#getOrAdd}.
 *
 * <p>Callers can compare against {@link #FILE_NOT_FOUND} by identity.
 */
public final class CompilerCacheResult {
    /**
     * The result for a file that doesn't exist.
     */
    public static final CompilerCacheResult FILE_NOT_FOUND = new CompilerCacheResult(null, false);

    private final CompilationResult compilationResult;
    private final boolean fromCache;

    private CompilerCacheResult(CompilationResult compilationResult, boolean fromCache) {
        this.compilationResult = compilationResult;
        this.fromCache = fromCache;
    }

    static CompilerCacheResult found(CompilationResult compilationResult, boolean fromCache) {
        if (compilationResult == null) {
            throw new IllegalArgumentException("A found result requires a compilation result");
        }
        return new CompilerCacheResult(compilationResult, fromCache);
    }

    /**
     * @return The compilation result, or {@code null} if the file wasn't found
     */
    public CompilationResult compilationResult() {
        return compilationResult;
    }

    /**
     * @return Whether the file was found
     */
    public boolean isFound() {
        return compilationResult != null;
    }

    /**
     * @return Whether the compilation result was already cached, {@code false}
     *  if it was compiled by this lookup
     */
    public boolean isFromCache() {
        return fromCache;
    }

    @Override
    public String toString() {
        if (this == FILE_NOT_FOUND) {
            return "CompilerCacheResult{FILE_NOT_FOUND}";
        }
        return "CompilerCacheResult{compiledType=" + compilationResult.compiledType().getName()
               + ", fromCache=" + fromCache + '}';
    }
}
