/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.compilercache;

import java.util.List;
import java.util.Objects;
import software.amazon.smithy.model.validation.ValidationEvent;

/**
 * The result of compiling a file: either the compiled type, or the failures
 * that prevented compilation.
 */
public class CompilationResult {
    private final Class<?> compiledType;
    private final List<ValidationEvent> failures;

    CompilationResult(Class<?> compiledType, List<ValidationEvent> failures) {
        this.compiledType = compiledType;
        this.failures = failures;
    }

    /**
     * @param compiledType The type produced by compilation
     * @return A successful result
     */
    public static CompilationResult successful(Class<?> compiledType) {
        return new CompilationResult(Objects.requireNonNull(compiledType, "compiledType"), List.of());
    }

    /**
     * @param failures Events describing why compilation failed, must not be empty
     * @return A failed result
     */
    public static CompilationResult failed(List<ValidationEvent> failures) {
        if (failures.isEmpty()) {
            throw new IllegalArgumentException("A failed compilation result requires at least one failure");
        }
        return new CompilationResult(null, List.copyOf(failures));
    }

    /**
     * @return The compiled type, or {@code null} if compilation failed
     */
    public Class<?> compiledType() {
        return compiledType;
    }

    /**
     * @return The compilation failures, empty if compilation succeeded
     */
    public List<ValidationEvent> failures() {
        return failures;
    }

    /**
     * @return Whether compilation succeeded
     */
    public boolean isSuccessful() {
        return failures.isEmpty();
    }

    /**
     * @return This result, if successful
     * @throws CompilationFailedException If compilation failed
     */
    public CompilationResult ensureSuccessful() {
        if (!isSuccessful()) {
            throw new CompilationFailedException(failures);
        }
        return this;
    }
}
