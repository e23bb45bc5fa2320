package com.furiflow.core.renderer.impl;

import com.furiflow.core.renderer.GeneratedFile;
import com.furiflow.core.renderer.GeneratedOutput;
import com.furiflow.core.renderer.RenderContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileSystemRendererTest {

    @TempDir
    Path tempDir;

    private final FileSystemRenderer renderer = new FileSystemRenderer();

    @Test
    void render_createsDirectoriesAndWritesFiles() throws IOException {
        Path outputDir = tempDir.resolve("build/app");
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("main.c", "int32_t demo_main(void* p) { return 0; }\n", "text/x-c"),
            new GeneratedFile("assets/readme.txt", "hello", "text/plain")
        ));

        renderer.render(output, new RenderContext(outputDir.toString(), Map.of()));

        assertThat(Files.readString(outputDir.resolve("main.c"))).startsWith("int32_t demo_main");
        assertThat(Files.readString(outputDir.resolve("assets/readme.txt"))).isEqualTo("hello");
    }

    @Test
    void render_existingFile_isOverwritten() throws IOException {
        Files.writeString(tempDir.resolve("main.c"), "old content that is longer");

        renderer.render(new GeneratedOutput(List.of(new GeneratedFile("main.c", "new", "text/x-c"))),
            new RenderContext(tempDir.toString(), Map.of()));

        assertThat(Files.readString(tempDir.resolve("main.c"))).isEqualTo("new");
    }

    @Test
    void render_outputDirectoryIsAFile_throwsIllegalState() throws IOException {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "");

        assertThatThrownBy(() -> renderer.render(
                new GeneratedOutput(List.of(new GeneratedFile("main.c", "x", "text/x-c"))),
                new RenderContext(blocker.toString(), Map.of())))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("output directory");
    }

    @Test
    void getId_returnsFilesystem() {
        assertThat(renderer.getId()).isEqualTo("filesystem");
    }
}
