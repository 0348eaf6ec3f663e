/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.compilercache;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import org.hamcrest.CustomTypeSafeMatcher;
import org.hamcrest.Description;
import org.hamcrest.Matcher;

/**
 * Utility hamcrest matchers.
 */
public final class UtilMatchers {
    private UtilMatchers() {}

    /**
     * @param path The path the glob pattern should match
     * @return A matcher for glob patterns, as sent to the client in file
     *  watcher registrations, that match {@code path}
     */
    public static Matcher<String> globMatches(Path path) {
        return new CustomTypeSafeMatcher<String>("A glob pattern that matches " + path) {
            @Override
            protected boolean matchesSafely(String item) {
                return FileSystems.getDefault().getPathMatcher("glob:" + item).matches(path);
            }

            @Override
            protected void describeMismatchSafely(String item, Description mismatchDescription) {
                mismatchDescription.appendText(item).appendText(" did not match");
            }
        };
    }
}
