package com.furiflow.core.validator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Checks generated source for the elements every application needs.
 *
 * <p>Mandatory checks, each adding its own diagnostic:
 * <ul>
 *   <li>the {@code furi.h} and {@code gui/gui.h} includes;</li>
 *   <li>an {@code int32_t <entry point>(...) {} definition;</li>
 *   <li>a {@code typedef struct {...} <app id>_state_t;} definition;</li>
 *   <li>view port allocation and opening of the GUI record.</li>
 * </ul>
 * When a {@link SyntaxChecker} is configured its failures are reported as
 * {@code Syntax error: ...}; an unavailable tool is skipped.
 */
public class StructuralValidator {

    private static final Logger log = LoggerFactory.getLogger(StructuralValidator.class);

    static final List<String> REQUIRED_INCLUDES = List.of(
        "#include <furi.h>",
        "#include <gui/gui.h>"
    );

    private static final String VIEW_PORT_ALLOC = "view_port_alloc";
    private static final String GUI_RECORD_OPEN = "furi_record_open(RECORD_GUI)";

    private final SyntaxChecker syntaxChecker;

    public StructuralValidator() {
        this(null);
    }

    /**
     * Creates a validator.
     *
     * @param syntaxChecker optional external syntax check, may be null
     */
    public StructuralValidator(SyntaxChecker syntaxChecker) {
        this.syntaxChecker = syntaxChecker;
    }

    /**
     * Validates source text.
     *
     * @param code generated source
     * @param appName application id
     * @param entryPoint entry point function name
     * @return report with all diagnostics
     */
    public ValidationReport validate(String code, String appName, String entryPoint) {
        List<String> diagnostics = new ArrayList<>();

        for (String include : REQUIRED_INCLUDES) {
            if (!code.contains(include)) {
                diagnostics.add("Missing required include: " + include);
            }
        }

        Pattern entryPattern = Pattern.compile(
            "int32_t\\s+" + Pattern.quote(entryPoint) + "\\s*\\([^)]*\\)\\s*\\{");
        if (!entryPattern.matcher(code).find()) {
            diagnostics.add("Missing entry point function: " + entryPoint);
        }

        Pattern statePattern = Pattern.compile(
            "typedef\\s+struct\\s*\\{.*?}\\s*" + Pattern.quote(appName) + "_state_t\\s*;", Pattern.DOTALL);
        if (!statePattern.matcher(code).find()) {
            diagnostics.add("Missing app state structure: " + appName + "_state_t");
        }

        if (!code.contains(VIEW_PORT_ALLOC)) {
            diagnostics.add("Missing view port allocation");
        }
        if (!code.contains(GUI_RECORD_OPEN)) {
            diagnostics.add("Missing GUI initialization");
        }

        SyntaxCheckResult.Status syntaxStatus = null;
        if (syntaxChecker != null) {
            SyntaxCheckResult syntax = syntaxChecker.check(code);
            syntaxStatus = syntax.status();
            switch (syntax.status()) {
                case FAILED -> diagnostics.add("Syntax error: " + syntax.output().strip());
                case UNAVAILABLE -> log.warn("Syntax check skipped: {}", syntax.output());
                case PASSED -> log.debug("Syntax check passed");
            }
        }

        if (diagnostics.isEmpty()) {
            log.debug("Validation passed for app '{}'", appName);
        } else {
            log.info("Validation found {} problems for app '{}'", diagnostics.size(), appName);
        }
        return new ValidationReport(diagnostics.isEmpty(), diagnostics, syntaxStatus);
    }
}
