package com.furiflow.core.generator;

import com.furiflow.core.renderer.GeneratedFile;
import com.furiflow.core.renderer.GeneratedOutput;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a generation run: either generated files or a fatal error.
 *
 * @param files relative file name to source text, empty on failure
 * @param error fatal error, null on success
 */
public record GenerationResult(
    Map<String, String> files,
    GenerationError error
) {
    private static final String C_SOURCE_CONTENT_TYPE = "text/x-c";

    /**
     * Compact constructor with validation.
     */
    public GenerationResult {
        files = files == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(files));
        if (error != null && !files.isEmpty()) {
            throw new IllegalArgumentException("A failed generation must not carry files");
        }
    }

    public static GenerationResult success(Map<String, String> files) {
        Objects.requireNonNull(files, "files must not be null");
        return new GenerationResult(files, null);
    }

    public static GenerationResult failure(GenerationError error) {
        Objects.requireNonNull(error, "error must not be null");
        return new GenerationResult(Map.of(), error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Optional<String> file(String name) {
        return Optional.ofNullable(files.get(name));
    }

    /**
     * Converts the generated files for rendering.
     *
     * @return output with one C source entry per generated file
     * @throws IllegalStateException if the generation failed
     */
    public GeneratedOutput toOutput() {
        if (!isSuccess()) {
            throw new IllegalStateException("Generation failed: " + error.message());
        }
        return new GeneratedOutput(files.entrySet().stream()
            .map(e -> new GeneratedFile(e.getKey(), e.getValue(), C_SOURCE_CONTENT_TYPE))
            .toList());
    }
}
