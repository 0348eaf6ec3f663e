/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.compilercache.fs;

import java.util.List;

/**
 * A {@link ChangeTrigger} that is expired as soon as any of its components
 * is expired.
 */
public final class CompositeChangeTrigger implements ChangeTrigger {
    private final List<ChangeTrigger> triggers;

    private CompositeChangeTrigger(List<ChangeTrigger> triggers) {
        this.triggers = triggers;
    }

    /**
     * @param triggers The triggers to combine, must not be empty
     * @return A trigger that expires when any of {@code triggers} expires
     */
    public static CompositeChangeTrigger of(List<? extends ChangeTrigger> triggers) {
        if (triggers.isEmpty()) {
            throw new IllegalArgumentException("Composite trigger requires at least one trigger");
        }
        return new CompositeChangeTrigger(List.copyOf(triggers));
    }

    /**
     * @return The combined triggers
     */
    public List<ChangeTrigger> triggers() {
        return triggers;
    }

    @Override
    public boolean isExpired() {
        for (ChangeTrigger trigger : triggers) {
            if (trigger.isExpired()) {
                return true;
            }
        }
        return false;
    }
}
