package com.furiflow.cli;

import com.furiflow.FuriFlowCLI;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class GenerateCommandTest {

    private static final String GRAPH = """
        {
          "blocks": [
            {"id": "start", "type": "app_on_start", "x": 0, "y": 0},
            {"id": "hello", "type": "log_message", "x": 0, "y": 80, "properties": {"message": "hi"}}
          ],
          "connections": [
            {"from": {"block": "start", "port": "next"}, "to": {"block": "hello", "port": "prev"}}
          ]
        }
        """;

    private static final String MANIFEST = """
        name: "Demo"
        appid: demo
        entry_point: demo_main
        requires: [gui, storage]
        """;

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private PrintStream originalOut;

    private Path graphFile;
    private Path manifestFile;
    private Path outputDir;
    private Path configFile;

    @BeforeEach
    void setUp() throws IOException {
        originalOut = System.out;
        System.setOut(new PrintStream(stdout, true, StandardCharsets.UTF_8));

        graphFile = Files.writeString(tempDir.resolve("graph.json"), GRAPH);
        manifestFile = Files.writeString(tempDir.resolve("manifest.yaml"), MANIFEST);
        outputDir = tempDir.resolve("out");
        configFile = tempDir.resolve("furiflow.yaml");
    }

    @AfterEach
    void restoreOut() {
        System.setOut(originalOut);
    }

    @Test
    void generate_validInputs_writesSourceAndDescriptor() throws IOException {
        // When
        int exitCode = run("generate", "-g", graphFile.toString(), "-m", manifestFile.toString(),
            "-o", outputDir.toString(), "--config", configFile.toString());

        // Then
        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        String source = Files.readString(outputDir.resolve("main.c"));
        assertThat(source)
            .contains("    FURI_LOG_I(\"APP\", \"hi\");\n")
            .contains("int32_t demo_main(void* p) {")
            .contains("#include <storage/storage.h>");
        assertThat(Files.readString(outputDir.resolve("application.fam"))).contains("appid=\"demo\"");
        assertThat(stdout.toString(StandardCharsets.UTF_8)).contains("Validation passed");
    }

    @Test
    void generate_configDisablesManifest_writesSourceOnly() throws IOException {
        Files.writeString(configFile, """
            output:
              writeManifest: false
            """);

        int exitCode = run("generate", "-g", graphFile.toString(), "-m", manifestFile.toString(),
            "-o", outputDir.toString(), "--config", configFile.toString());

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        assertThat(outputDir.resolve("main.c")).exists();
        assertThat(outputDir.resolve("application.fam")).doesNotExist();
    }

    @Test
    void generate_stdout_printsInsteadOfWriting() {
        int exitCode = run("generate", "-g", graphFile.toString(), "-m", manifestFile.toString(),
            "-o", outputDir.toString(), "--config", configFile.toString(), "--stdout", "--no-validate");

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        assertThat(outputDir).doesNotExist();
        assertThat(stdout.toString(StandardCharsets.UTF_8))
            .contains("// ===== main.c =====")
            .contains("FURI_LOG_I(\"APP\", \"hi\");");
    }

    @Test
    void generate_graphWithoutEntryBlock_returnsNoEntryPoint() throws IOException {
        Files.writeString(graphFile, """
            {"blocks": [{"id": "hello", "type": "log_message"}], "connections": []}
            """);

        int exitCode = run("generate", "-g", graphFile.toString(), "-m", manifestFile.toString(),
            "-o", outputDir.toString(), "--config", configFile.toString());

        assertThat(exitCode).isEqualTo(ExitCodes.NO_ENTRY_POINT);
        assertThat(outputDir.resolve("main.c")).doesNotExist();
    }

    @Test
    void generate_invalidManifest_fails() throws IOException {
        Files.writeString(manifestFile, """
            name: "Demo"
            appid: Bad-Id
            requires: [gui]
            """);

        int exitCode = run("generate", "-g", graphFile.toString(), "-m", manifestFile.toString(),
            "-o", outputDir.toString(), "--config", configFile.toString());

        assertThat(exitCode).isEqualTo(ExitCodes.FAILURE);
        assertThat(outputDir).doesNotExist();
    }

    @Test
    void generate_missingGraphFile_fails() {
        int exitCode = run("generate", "-g", tempDir.resolve("missing.json").toString(),
            "-m", manifestFile.toString(), "--config", configFile.toString());

        assertThat(exitCode).isEqualTo(ExitCodes.FAILURE);
    }

    @Test
    void generate_customCatalog_isUsed() throws IOException {
        Path catalog = Files.writeString(tempDir.resolve("blocks.json"), """
            {"blockCategories": [{"id": "events", "blocks": [
              {"id": "app_on_start", "outputs": [{"id": "next", "type": "flow"}], "codeTemplate": "custom_start();${next_code}"}
            ]}]}
            """);
        Files.writeString(graphFile, """
            {"blocks": [{"id": "start", "type": "app_on_start"}]}
            """);

        int exitCode = run("generate", "-g", graphFile.toString(), "-m", manifestFile.toString(),
            "-c", catalog.toString(), "-o", outputDir.toString(), "--config", configFile.toString());

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        assertThat(Files.readString(outputDir.resolve("main.c"))).contains("    custom_start();\n");
    }

    private static int run(String... args) {
        return FuriFlowCLI.commandLine().execute(args);
    }
}
