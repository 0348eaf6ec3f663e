/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.compilercache.fs;

/**
 * Signals that a watched set of files has changed since the trigger was issued.
 *
 * <p>Triggers are one-shot: once {@link #isExpired()} returns {@code true} it
 * never returns {@code false} again, and the trigger should be discarded and a
 * new one acquired from the {@link FileProvider}.
 */
@FunctionalInterface
public interface ChangeTrigger {
    /**
     * @return Whether any watched file was created, changed, or deleted
     */
    boolean isExpired();
}
