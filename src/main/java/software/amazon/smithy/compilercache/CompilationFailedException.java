/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.compilercache;

import java.util.List;
import software.amazon.smithy.model.validation.ValidationEvent;

/**
 * Thrown when a file could not be compiled.
 */
public final class CompilationFailedException extends RuntimeException {
    private final transient List<ValidationEvent> failures;

    /**
     * @param failures The events describing why compilation failed
     */
    public CompilationFailedException(List<ValidationEvent> failures) {
        super(createMessage(failures));
        this.failures = List.copyOf(failures);
    }

    /**
     * @return The events describing why compilation failed
     */
    public List<ValidationEvent> failures() {
        return failures;
    }

    private static String createMessage(List<ValidationEvent> failures) {
        StringBuilder builder = new StringBuilder("Compilation failed with ")
                .append(failures.size())
                .append(failures.size() == 1 ? " error:" : " errors:");
        for (ValidationEvent failure : failures) {
            builder.append(System.lineSeparator()).append(failure);
        }
        return builder.toString();
    }
}
