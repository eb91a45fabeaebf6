package com.sdkforge.core.renderer;

import java.util.Objects;

/**
 * A generated source or documentation file.
 *
 * @param relativePath path relative to the output root (e.g. "lib/client.ts", "docs/QUICKSTART.md")
 * @param content file content
 * @param contentType media type of the content
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String contentType
) {
    public static final String TYPESCRIPT = "text/typescript";
    public static final String MARKDOWN = "text/markdown";

    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
        if (relativePath.isBlank() || relativePath.startsWith("/") || relativePath.contains("..")) {
            throw new IllegalArgumentException("relativePath must be a relative path inside the output root: "
                + relativePath);
        }
    }

    public static GeneratedFile markdown(String relativePath, String content) {
        return new GeneratedFile(relativePath, content, MARKDOWN);
    }
}
