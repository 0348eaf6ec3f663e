/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.compilercache.fs;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class FilePathsTest {
    @Test
    public void normalizesPaths() {
        assertThat(FilePaths.normalize("models/forecast.smithy"), equalTo("/models/forecast.smithy"));
        assertThat(FilePaths.normalize("/models//forecast.smithy"), equalTo("/models/forecast.smithy"));
        assertThat(FilePaths.normalize("models\\weather\\forecast.smithy"), equalTo("/models/weather/forecast.smithy"));
        assertThat(FilePaths.normalize("~/models/forecast.smithy"), equalTo("/models/forecast.smithy"));
        assertThat(FilePaths.normalize("./models/../other/./a.smithy"), equalTo("/other/a.smithy"));
        assertThat(FilePaths.normalize("models/"), equalTo("/models"));
    }

    @Test
    public void clampsAtRoot() {
        assertThat(FilePaths.normalize("../../a.smithy"), equalTo("/a.smithy"));
        assertThat(FilePaths.normalize("/.."), equalTo("/"));
    }

    @Test
    public void rejectsBlankPaths() {
        assertThrows(IllegalArgumentException.class, () -> FilePaths.normalize(null));
        assertThrows(IllegalArgumentException.class, () -> FilePaths.normalize("  "));
    }

    @Test
    public void getsParentsAndFileNames() {
        assertThat(FilePaths.getParent("/models/forecast.smithy"), equalTo("/models"));
        assertThat(FilePaths.getParent("/forecast.smithy"), equalTo("/"));
        assertThat(FilePaths.getParent("/"), nullValue());
        assertThat(FilePaths.getFileName("/models/forecast.smithy"), equalTo("forecast.smithy"));
        assertThat(FilePaths.getFileName("/"), equalTo(""));
    }

    @Test
    public void combinesDirectoryAndFileName() {
        assertThat(FilePaths.combine("/", "_imports.smithy"), equalTo("/_imports.smithy"));
        assertThat(FilePaths.combine("/models", "_imports.smithy"), equalTo("/models/_imports.smithy"));
        assertThat(FilePaths.isRoot("/"), is(true));
        assertThat(FilePaths.isRoot("/models"), is(false));
    }
}
