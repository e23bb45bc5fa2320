package com.furiflow.core.validator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs a C compiler in syntax-only mode ({@code -fsyntax-only -Wall}).
 *
 * <p>The source is written to a temporary file that is deleted on every exit
 * path, together with the captured compiler output. A compiler that cannot be
 * started, or that does not finish within the timeout, makes the check
 * unavailable rather than failed.
 */
public class GccSyntaxChecker implements SyntaxChecker {

    private static final Logger log = LoggerFactory.getLogger(GccSyntaxChecker.class);

    public static final String DEFAULT_COMPILER = "gcc";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final String compiler;
    private final Duration timeout;
    private final Path workDirectory;

    public GccSyntaxChecker() {
        this(DEFAULT_COMPILER, DEFAULT_TIMEOUT, null);
    }

    /**
     * Creates a checker.
     *
     * @param compiler compiler executable
     * @param timeout maximum time to wait for the compiler
     * @param workDirectory directory for temporary files, or null for the system default
     */
    public GccSyntaxChecker(String compiler, Duration timeout, Path workDirectory) {
        this.compiler = Objects.requireNonNull(compiler, "compiler must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.workDirectory = workDirectory;
    }

    @Override
    public SyntaxCheckResult check(String source) {
        Path sourceFile = null;
        Path outputFile = null;
        try {
            sourceFile = createTempFile(".c");
            outputFile = createTempFile(".log");
            Files.writeString(sourceFile, source);

            Process process;
            try {
                process = new ProcessBuilder(List.of(compiler, "-fsyntax-only", "-Wall", sourceFile.toString()))
                    .redirectErrorStream(true)
                    .redirectOutput(outputFile.toFile())
                    .start();
            } catch (IOException e) {
                log.warn("{} not available for syntax validation: {}", compiler, e.getMessage());
                return SyntaxCheckResult.unavailable(compiler + " not available: " + e.getMessage());
            }

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                log.warn("{} syntax check timed out after {}", compiler, timeout);
                return SyntaxCheckResult.unavailable(compiler + " timed out after " + timeout.toSeconds() + "s");
            }

            String output = Files.readString(outputFile);
            if (process.exitValue() != 0) {
                log.debug("{} rejected generated source: {}", compiler, output);
                return SyntaxCheckResult.failed(output);
            }
            return SyntaxCheckResult.passed();
        } catch (IOException e) {
            log.warn("Syntax check could not be prepared: {}", e.getMessage());
            return SyntaxCheckResult.unavailable("Validation error: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SyntaxCheckResult.unavailable("Syntax check interrupted");
        } finally {
            deleteQuietly(sourceFile);
            deleteQuietly(outputFile);
        }
    }

    private Path createTempFile(String suffix) throws IOException {
        return workDirectory != null
            ? Files.createTempFile(workDirectory, "furiflow-", suffix)
            : Files.createTempFile("furiflow-", suffix);
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete temporary file {}: {}", file, e.getMessage());
        }
    }
}
