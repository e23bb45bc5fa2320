package com.furiflow.core.validator;

/**
 * Syntax-only check of generated source by an external tool.
 */
public interface SyntaxChecker {

    /**
     * Checks source text. Implementations must not throw when the tool is
     * missing; they report {@link SyntaxCheckResult.Status#UNAVAILABLE} instead.
     *
     * @param source source text
     * @return check outcome
     */
    SyntaxCheckResult check(String source);
}
