/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.compilercache;

import software.amazon.smithy.compilercache.fs.ChangeTrigger;

/**
 * An immutable entry in a {@link CompilerCache}.
 */
final class CompilerCacheEntry {
    enum Type {
        /**
         * Supplied at construction, never invalidated.
         */
        PRECOMPILED,

        /**
         * Compiled at runtime, invalidated when the file or an ancestor import changes.
         */
        COMPILED,

        /**
         * The file didn't exist, invalidated when it is created.
         */
        NOT_FOUND
    }

    private final Type type;
    private final String path;
    private final ChangeTrigger trigger;
    private final CompilerCacheResult result;

    private CompilerCacheEntry(Type type, String path, ChangeTrigger trigger, CompilerCacheResult result) {
        this.type = type;
        this.path = path;
        this.trigger = trigger;
        this.result = result;
    }

    static CompilerCacheEntry precompiled(Class<?> compiledType) {
        CompilationResult compilationResult = CompilationResult.successful(compiledType);
        return new CompilerCacheEntry(Type.PRECOMPILED, null, null, CompilerCacheResult.found(compilationResult, true));
    }

    static CompilerCacheEntry compiled(String path, CompilationResult compilationResult, ChangeTrigger trigger) {
        CompilerCacheResult result = CompilerCacheResult.found(compilationResult, true);
        return new CompilerCacheEntry(Type.COMPILED, path, trigger, result);
    }

    static CompilerCacheEntry notFound(String path, ChangeTrigger trigger) {
        return new CompilerCacheEntry(Type.NOT_FOUND, path, trigger, CompilerCacheResult.FILE_NOT_FOUND);
    }

    Type type() {
        return type;
    }

    /**
     * @return The result to return for a lookup that hits this entry
     */
    CompilerCacheResult result() {
        return result;
    }

    /**
     * A missing file only answers lookups of the exact path that was probed.
     * Under case-insensitive keys, a lookup with different casing may name a
     * file that does exist, so it has to be probed again.
     *
     * @param normalizedPath The normalized path being looked up
     * @return Whether this entry can answer a lookup of {@code normalizedPath}
     */
    boolean appliesTo(String normalizedPath) {
        return type != Type.NOT_FOUND || path.equals(normalizedPath);
    }

    boolean isExpired() {
        return type != Type.PRECOMPILED && trigger.isExpired();
    }
}
