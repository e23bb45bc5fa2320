package com.furiflow.cli;

import com.furiflow.core.config.ConfigLoader;
import com.furiflow.core.config.ProjectConfig;
import com.furiflow.core.generator.CodeGenerator;
import com.furiflow.core.generator.GenerationResult;
import com.furiflow.core.graph.BlockGraph;
import com.furiflow.core.graph.GraphSnapshot;
import com.furiflow.core.graph.GraphSnapshotCodec;
import com.furiflow.core.manifest.AppManifest;
import com.furiflow.core.manifest.ApplicationManifestWriter;
import com.furiflow.core.manifest.ManifestLoader;
import com.furiflow.core.manifest.ManifestValidator;
import com.furiflow.core.registry.BlockTypeRegistry;
import com.furiflow.core.registry.CatalogLoadException;
import com.furiflow.core.renderer.GeneratedFile;
import com.furiflow.core.renderer.GeneratedOutput;
import com.furiflow.core.renderer.OutputRenderer;
import com.furiflow.core.renderer.RenderContext;
import com.furiflow.core.renderer.impl.ConsoleRenderer;
import com.furiflow.core.renderer.impl.FileSystemRenderer;
import com.furiflow.core.validator.GccSyntaxChecker;
import com.furiflow.core.validator.StructuralValidator;
import com.furiflow.core.validator.ValidationReport;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Generates application source from a block graph and a manifest.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>Load configuration, catalog, manifest and graph</li>
 *   <li>Rebuild the graph against the catalog</li>
 *   <li>Generate {@code main.c} (and {@code application.fam} when enabled)</li>
 *   <li>Render to the output directory or standard output</li>
 *   <li>Validate the generated source when enabled</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * furiflow generate -g blinky.json -m manifest.yaml -o build/blinky
 * furiflow generate -g blinky.json -m application.fam --stdout --no-validate
 * }</pre>
 */
@Command(
    name = "generate",
    description = "Generate application source from a block graph",
    mixinStandardHelpOptions = true
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Option(names = {"-g", "--graph"}, description = "Block graph JSON file", required = true)
    private Path graphFile;

    @Option(names = {"-m", "--manifest"}, description = "Manifest file (.json, .yaml or application.fam)", required = true)
    private Path manifestFile;

    @Option(names = {"-c", "--catalog"}, description = "Block catalog JSON file (overrides config)")
    private Path catalogFile;

    @Option(names = {"-o", "--output"}, description = "Output directory (overrides config)")
    private Path outputDir;

    @Option(names = {"--config"}, description = "Configuration file (default: furiflow.yaml)")
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(names = {"--stdout"}, description = "Print generated files instead of writing them")
    private boolean toStdout;

    @Option(names = {"--validate"}, negatable = true, description = "Validate the generated source (overrides config)")
    private Boolean validate;

    @Option(names = {"--syntax-check"}, description = "Also run the C compiler in syntax-only mode")
    private boolean syntaxCheck;

    @Override
    public Integer call() {
        ProjectConfig config = ConfigLoader.load(configPath);

        BlockTypeRegistry registry;
        AppManifest manifest;
        GraphSnapshot snapshot;
        try {
            registry = Catalogs.load(resolveCatalog(config));
            manifest = ManifestLoader.load(manifestFile);
            snapshot = new GraphSnapshotCodec().read(graphFile);
        } catch (CatalogLoadException | IOException e) {
            log.error("Failed to load inputs: {}", e.getMessage());
            System.err.println("✗ " + e.getMessage());
            return ExitCodes.FAILURE;
        }

        List<String> manifestErrors = ManifestValidator.validate(manifest);
        if (!manifestErrors.isEmpty()) {
            System.err.println("✗ Invalid manifest:");
            manifestErrors.forEach(error -> System.err.println("  - " + error));
            return ExitCodes.FAILURE;
        }

        BlockGraph graph = BlockGraph.fromSnapshot(snapshot, registry);
        GenerationResult result = new CodeGenerator().generate(registry, manifest, graph.toSnapshot());
        if (!result.isSuccess()) {
            System.err.println("✗ " + result.error().message());
            return ExitCodes.NO_ENTRY_POINT;
        }

        GeneratedOutput output = result.toOutput();
        if (config.output().writeManifest()) {
            output = output.with(new GeneratedFile(
                ApplicationManifestWriter.FILE_NAME, ApplicationManifestWriter.render(manifest), "text/plain"));
        }

        try {
            render(output, config);
        } catch (IllegalStateException e) {
            log.error("Failed to write output", e);
            System.err.println("✗ " + e.getMessage());
            return ExitCodes.FAILURE;
        }

        boolean validationEnabled = validate != null ? validate : config.validation().enabled();
        if (!validationEnabled) {
            return ExitCodes.OK;
        }
        return validateSource(result.files().get(CodeGenerator.MAIN_FILE), manifest, config);
    }

    private Path resolveCatalog(ProjectConfig config) {
        if (catalogFile != null) {
            return catalogFile;
        }
        return config.catalog() == null ? null : Paths.get(config.catalog());
    }

    private void render(GeneratedOutput output, ProjectConfig config) {
        if (toStdout) {
            new ConsoleRenderer().render(output, new RenderContext(".", Map.of()));
            return;
        }
        String directory = outputDir != null ? outputDir.toString() : config.output().directory();
        OutputRenderer renderer = new FileSystemRenderer();
        renderer.render(output, new RenderContext(directory, Map.of()));
        System.out.println("✓ Generated " + output.files().size() + " file(s) in " + directory);
    }

    private int validateSource(String source, AppManifest manifest, ProjectConfig config) {
        ProjectConfig.ValidationConfig settings = config.validation();
        boolean runSyntaxCheck = syntaxCheck || settings.syntaxCheck();
        StructuralValidator validator = new StructuralValidator(runSyntaxCheck
            ? new GccSyntaxChecker(settings.compiler(), settings.timeout(), null)
            : null);

        ValidationReport report = validator.validate(source, manifest.appid(), manifest.entryPoint());
        if (report.valid()) {
            if (!toStdout) {
                System.out.println("✓ Validation passed");
            }
            return ExitCodes.OK;
        }
        System.err.println("✗ Validation failed:");
        report.diagnostics().forEach(diagnostic -> System.err.println("  - " + diagnostic));
        return ExitCodes.VALIDATION_FAILED;
    }
}
