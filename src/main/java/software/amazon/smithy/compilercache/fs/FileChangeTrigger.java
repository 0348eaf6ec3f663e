/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.compilercache.fs;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A {@link ChangeTrigger} for a single watched path, expired by whoever
 * observes the change.
 */
public final class FileChangeTrigger implements ChangeTrigger {
    private final AtomicBoolean expired = new AtomicBoolean(false);

    @Override
    public boolean isExpired() {
        return expired.get();
    }

    /**
     * Marks this trigger expired.
     *
     * @return Whether this call expired the trigger, {@code false} if it
     *  was already expired
     */
    public boolean expire() {
        return expired.compareAndSet(false, true);
    }
}
