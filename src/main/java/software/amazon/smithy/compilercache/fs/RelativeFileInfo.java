/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.compilercache.fs;

/**
 * A file to compile, along with the normalized path it was requested by.
 *
 * @param fileInfo The file to compile
 * @param relativePath The normalized, root-relative path of the file
 */
public record RelativeFileInfo(FileInfo fileInfo, String relativePath) {
}
