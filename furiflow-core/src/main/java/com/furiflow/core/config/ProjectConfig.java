package com.furiflow.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Root configuration for FuriFlow projects.
 *
 * <p>Loaded from {@code furiflow.yaml}. Missing sections fall back to
 * {@link #defaults()} through the accessors below.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * catalog: "blocks.json"
 *
 * output:
 *   directory: "./build/app"
 *   writeManifest: true
 *
 * validation:
 *   enabled: true
 *   syntaxCheck: false
 *   compiler: gcc
 *   timeoutSeconds: 30
 * }</pre>
 *
 * @param catalog block catalog path, null for the bundled catalog
 * @param output output configuration
 * @param validation validation configuration
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(
    @JsonProperty("catalog") String catalog,
    @JsonProperty("output") OutputConfig output,
    @JsonProperty("validation") ValidationConfig validation
) {
    /**
     * Compact constructor filling absent sections.
     */
    public ProjectConfig {
        if (output == null) {
            output = OutputConfig.defaults();
        }
        if (validation == null) {
            validation = ValidationConfig.defaults();
        }
    }

    public static ProjectConfig defaults() {
        return new ProjectConfig(null, OutputConfig.defaults(), ValidationConfig.defaults());
    }

    /**
     * Output configuration.
     *
     * @param directory output directory path
     * @param writeManifest whether to write {@code application.fam} next to the source
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("writeManifest") Boolean writeManifest
    ) {
        public OutputConfig {
            if (directory == null || directory.isBlank()) {
                directory = "./build/app";
            }
            if (writeManifest == null) {
                writeManifest = Boolean.TRUE;
            }
        }

        public static OutputConfig defaults() {
            return new OutputConfig(null, null);
        }
    }

    /**
     * Validation configuration.
     *
     * @param enabled run structural validation after generation
     * @param syntaxCheck also run the compiler in syntax-only mode
     * @param compiler compiler executable
     * @param timeoutSeconds compiler timeout
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ValidationConfig(
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("syntaxCheck") Boolean syntaxCheck,
        @JsonProperty("compiler") String compiler,
        @JsonProperty("timeoutSeconds") Integer timeoutSeconds
    ) {
        public ValidationConfig {
            if (enabled == null) {
                enabled = Boolean.TRUE;
            }
            if (syntaxCheck == null) {
                syntaxCheck = Boolean.FALSE;
            }
            if (compiler == null || compiler.isBlank()) {
                compiler = "gcc";
            }
            if (timeoutSeconds == null || timeoutSeconds <= 0) {
                timeoutSeconds = 30;
            }
        }

        public static ValidationConfig defaults() {
            return new ValidationConfig(null, null, null, null);
        }

        public Duration timeout() {
            return Duration.ofSeconds(timeoutSeconds);
        }
    }
}
