/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.compilercache;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import org.eclipse.lsp4j.InitializeParams;

/**
 * Options that control how a {@link CompilerCache} keys and invalidates entries.
 */
public final class CompilerCacheOptions {
    public static final String DEFAULT_IMPORT_FILE_NAME = "_imports.smithy";
    public static final List<String> DEFAULT_SOURCE_FILE_EXTENSIONS = List.of("smithy");

    static final String IMPORT_FILE_NAME_KEY = "compilerCache.importFileName";
    static final String CASE_SENSITIVE_KEY = "compilerCache.caseSensitive";
    static final String SOURCE_FILE_EXTENSIONS_KEY = "compilerCache.sourceFileExtensions";

    private static final Logger LOGGER = Logger.getLogger(CompilerCacheOptions.class.getName());

    private final String importFileName;
    private final boolean caseSensitive;
    private final List<String> sourceFileExtensions;

    private CompilerCacheOptions(Builder builder) {
        this.importFileName = builder.importFileName;
        this.caseSensitive = builder.caseSensitive;
        this.sourceFileExtensions = List.copyOf(builder.sourceFileExtensions);
    }

    /**
     * @return The name of the import file in each directory
     */
    public String getImportFileName() {
        return importFileName;
    }

    /**
     * @return Whether paths that differ only in case are different cache entries
     */
    public boolean isCaseSensitive() {
        return caseSensitive;
    }

    /**
     * @return Extensions, without the leading dot, of files that get compiled
     */
    public List<String> getSourceFileExtensions() {
        return sourceFileExtensions;
    }

    public static CompilerCacheOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates options from the initialization options provided by the client.
     *
     * @param params The params passed directly from the client
     * @return The configured options, with defaults for anything missing or invalid
     */
    public static CompilerCacheOptions fromInitializeParams(InitializeParams params) {
        return fromInitializationOptions(params.getInitializationOptions());
    }

    /**
     * @param initializationOptions The client's initialization options, expected
     *  to be a {@link JsonObject}
     * @return The configured options, with defaults for anything missing or invalid
     */
    public static CompilerCacheOptions fromInitializationOptions(Object initializationOptions) {
        Builder builder = builder();
        if (!(initializationOptions instanceof JsonObject jsonObject)) {
            return builder.build();
        }

        if (jsonObject.has(IMPORT_FILE_NAME_KEY)) {
            JsonElement value = jsonObject.get(IMPORT_FILE_NAME_KEY);
            if (isString(value) && isValidFileName(value.getAsString())) {
                builder.importFileName(value.getAsString());
            } else {
                LOGGER.warning(() -> String.format("""
                        Invalid value for '%s': %s.
                        Must be a file name without directories.""", IMPORT_FILE_NAME_KEY, value));
            }
        }

        if (jsonObject.has(CASE_SENSITIVE_KEY)) {
            JsonElement value = jsonObject.get(CASE_SENSITIVE_KEY);
            if (value.isJsonPrimitive() && value.getAsJsonPrimitive().isBoolean()) {
                builder.caseSensitive(value.getAsBoolean());
            } else {
                LOGGER.warning(() -> String.format(
                        "Invalid value for '%s': %s. Must be a boolean.", CASE_SENSITIVE_KEY, value));
            }
        }

        if (jsonObject.has(SOURCE_FILE_EXTENSIONS_KEY)) {
            List<String> extensions = parseExtensions(jsonObject.get(SOURCE_FILE_EXTENSIONS_KEY));
            if (extensions != null) {
                builder.sourceFileExtensions(extensions);
            }
        }

        return builder.build();
    }

    private static List<String> parseExtensions(JsonElement value) {
        if (!value.isJsonArray() || value.getAsJsonArray().isEmpty()) {
            LOGGER.warning(() -> String.format(
                    "Invalid value for '%s': %s. Must be a non-empty array of strings.",
                    SOURCE_FILE_EXTENSIONS_KEY, value));
            return null;
        }

        JsonArray array = value.getAsJsonArray();
        List<String> extensions = new ArrayList<>(array.size());
        for (JsonElement element : array) {
            if (!isString(element) || element.getAsString().isBlank()) {
                LOGGER.warning(() -> String.format(
                        "Invalid extension in '%s': %s.", SOURCE_FILE_EXTENSIONS_KEY, element));
                return null;
            }
            extensions.add(stripLeadingDot(element.getAsString()));
        }
        return extensions;
    }

    private static boolean isString(JsonElement element) {
        return element.isJsonPrimitive() && element.getAsJsonPrimitive().isString();
    }

    private static boolean isValidFileName(String name) {
        return !name.isBlank() && name.indexOf('/') < 0 && name.indexOf('\\') < 0;
    }

    private static String stripLeadingDot(String extension) {
        return extension.startsWith(".") ? extension.substring(1) : extension;
    }

    public static final class Builder {
        private String importFileName = DEFAULT_IMPORT_FILE_NAME;
        private boolean caseSensitive = false;
        private List<String> sourceFileExtensions = DEFAULT_SOURCE_FILE_EXTENSIONS;

        private Builder() {
        }

        public Builder importFileName(String importFileName) {
            if (importFileName == null || !isValidFileName(importFileName)) {
                throw new IllegalArgumentException("Invalid import file name: " + importFileName);
            }
            this.importFileName = importFileName;
            return this;
        }

        public Builder caseSensitive(boolean caseSensitive) {
            this.caseSensitive = caseSensitive;
            return this;
        }

        public Builder sourceFileExtensions(List<String> sourceFileExtensions) {
            if (sourceFileExtensions.isEmpty()) {
                throw new IllegalArgumentException("At least one source file extension is required");
            }
            List<String> extensions = new ArrayList<>(sourceFileExtensions.size());
            for (String extension : sourceFileExtensions) {
                extensions.add(stripLeadingDot(extension));
            }
            this.sourceFileExtensions = extensions;
            return this;
        }

        public CompilerCacheOptions build() {
            return new CompilerCacheOptions(this);
        }
    }
}
