package com.furiflow.core.registry;

/**
 * Thrown when a block catalog cannot be read or is malformed at the top level.
 *
 * <p>A failed load never modifies the registry.
 */
public class CatalogLoadException extends Exception {

    public CatalogLoadException(String message) {
        super(message);
    }

    public CatalogLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
