package com.furiflow.core.renderer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered set of generated files to be rendered.
 *
 * @param files generated files
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }

    /**
     * Returns a copy of this output with one more file appended.
     *
     * @param file file to add
     * @return new output
     */
    public GeneratedOutput with(GeneratedFile file) {
        Objects.requireNonNull(file, "file must not be null");
        List<GeneratedFile> combined = new ArrayList<>(files);
        combined.add(file);
        return new GeneratedOutput(combined);
    }
}
