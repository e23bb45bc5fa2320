package com.furiflow.cli;

import com.furiflow.core.validator.GccSyntaxChecker;
import com.furiflow.core.validator.StructuralValidator;
import com.furiflow.core.validator.ValidationReport;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Checks a C source file for the structure every application needs.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * furiflow validate build/blinky/main.c --app-id blinky --entry-point blinky_app
 * furiflow validate main.c --app-id blinky --entry-point blinky_app --syntax-check --compiler clang
 * }</pre>
 */
@Command(
    name = "validate",
    description = "Validate a generated C source file",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(index = "0", description = "C source file to validate")
    private Path sourceFile;

    @Option(names = {"--app-id"}, description = "Application id", required = true)
    private String appId;

    @Option(names = {"--entry-point"}, description = "Entry point function name", required = true)
    private String entryPoint;

    @Option(names = {"--syntax-check"}, description = "Also run the C compiler in syntax-only mode")
    private boolean syntaxCheck;

    @Option(names = {"--compiler"}, description = "Compiler for the syntax check (default: gcc)")
    private String compiler = GccSyntaxChecker.DEFAULT_COMPILER;

    @Option(names = {"--timeout"}, description = "Syntax check timeout in seconds (default: 30)")
    private int timeoutSeconds = (int) GccSyntaxChecker.DEFAULT_TIMEOUT.toSeconds();

    @Override
    public Integer call() {
        String source;
        try {
            source = Files.readString(sourceFile);
        } catch (IOException e) {
            log.error("Failed to read source file: {}", sourceFile, e);
            System.err.println("✗ Cannot read " + sourceFile + ": " + e.getMessage());
            return ExitCodes.FAILURE;
        }

        StructuralValidator validator = new StructuralValidator(syntaxCheck
            ? new GccSyntaxChecker(compiler, Duration.ofSeconds(timeoutSeconds), null)
            : null);
        ValidationReport report = validator.validate(source, appId, entryPoint);

        if (report.valid()) {
            System.out.println("✓ " + sourceFile + " is valid");
            return ExitCodes.OK;
        }
        System.out.println("✗ " + sourceFile + " has " + report.diagnostics().size() + " problem(s):");
        report.diagnostics().forEach(diagnostic -> System.out.println("  - " + diagnostic));
        return ExitCodes.VALIDATION_FAILED;
    }
}
