package com.furiflow.core.validator;

import java.util.List;
import java.util.Objects;

/**
 * Result of structural validation.
 *
 * @param valid true if no diagnostics were produced
 * @param diagnostics problems found, in check order
 * @param syntaxCheckStatus outcome of the external syntax check, null when none was configured
 */
public record ValidationReport(
    boolean valid,
    List<String> diagnostics,
    SyntaxCheckResult.Status syntaxCheckStatus
) {
    /**
     * Compact constructor with validation.
     */
    public ValidationReport {
        Objects.requireNonNull(diagnostics, "diagnostics must not be null");
        diagnostics = List.copyOf(diagnostics);
    }
}
