/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.compilercache;

import java.util.List;
import java.util.Objects;

/**
 * A successful {@link CompilationResult} that still holds the generated
 * source it was compiled from.
 *
 * <p>Compilers return this for fresh work. {@link CompilerCache} only keeps
 * the compiled type, so the generated content is only ever seen by the
 * caller that triggered the compilation.
 */
public final class UncachedCompilationResult extends CompilationResult {
    private final String compiledContent;

    private UncachedCompilationResult(Class<?> compiledType, String compiledContent) {
        super(compiledType, List.of());
        this.compiledContent = compiledContent;
    }

    /**
     * @param compiledType The type produced by compilation
     * @param compiledContent The generated source of {@code compiledType}
     * @return A successful, uncached result
     */
    public static UncachedCompilationResult successful(Class<?> compiledType, String compiledContent) {
        return new UncachedCompilationResult(
                Objects.requireNonNull(compiledType, "compiledType"),
                Objects.requireNonNull(compiledContent, "compiledContent"));
    }

    /**
     * @return The generated source of the compiled type
     */
    public String compiledContent() {
        return compiledContent;
    }
}
