/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

/**
 * Caches compiled Smithy files, invalidating them when the file or any of
 * its ancestor import files change.
 */
@SmithyUnstableApi
package software.amazon.smithy.compilercache;

import software.amazon.smithy.utils.SmithyUnstableApi;
