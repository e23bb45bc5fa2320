package com.furiflow.core.generator;

/**
 * Fatal generation outcomes.
 */
public enum GenerationError {
    NO_ENTRY_POINT("No entry point block found");

    private final String message;

    GenerationError(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }
}
