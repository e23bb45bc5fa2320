package com.furiflow.core.validator;

import java.util.Objects;

/**
 * Outcome of an external syntax check.
 *
 * @param status check status
 * @param output tool output (diagnostics on failure, reason when unavailable)
 */
public record SyntaxCheckResult(
    Status status,
    String output
) {
    /**
     * Syntax check status.
     */
    public enum Status {
        /** The tool ran and accepted the source. */
        PASSED,
        /** The tool ran and rejected the source. */
        FAILED,
        /** The tool could not be run or did not finish; the check is skipped. */
        UNAVAILABLE
    }

    /**
     * Compact constructor with validation.
     */
    public SyntaxCheckResult {
        Objects.requireNonNull(status, "status must not be null");
        if (output == null) {
            output = "";
        }
    }

    public static SyntaxCheckResult passed() {
        return new SyntaxCheckResult(Status.PASSED, "");
    }

    public static SyntaxCheckResult failed(String output) {
        return new SyntaxCheckResult(Status.FAILED, output);
    }

    public static SyntaxCheckResult unavailable(String reason) {
        return new SyntaxCheckResult(Status.UNAVAILABLE, reason);
    }
}
