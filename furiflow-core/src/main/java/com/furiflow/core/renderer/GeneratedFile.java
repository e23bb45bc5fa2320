package com.furiflow.core.renderer;

import java.util.Objects;

/**
 * A generated file to be rendered.
 *
 * @param relativePath path relative to the output directory (e.g., "main.c")
 * @param content file content
 * @param contentType content type, may be null
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String contentType
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }
}
