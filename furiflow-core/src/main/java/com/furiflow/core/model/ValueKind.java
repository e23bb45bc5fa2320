package com.furiflow.core.model;

/**
 * Literal kind of a block property value.
 */
public enum ValueKind {
    STRING,
    BOOLEAN,
    NUMBER;

    /**
     * Resolves a catalog type name ({@code string}, {@code bool}/{@code boolean},
     * {@code number}/{@code int}/{@code float}) to a kind.
     *
     * @param name type name from the catalog, may be null
     * @return matching kind, or null when the name is unknown or absent
     */
    public static ValueKind fromCatalogName(String name) {
        if (name == null) {
            return null;
        }
        return switch (name.trim().toLowerCase()) {
            case "string", "str", "text" -> STRING;
            case "bool", "boolean" -> BOOLEAN;
            case "number", "int", "integer", "float", "double" -> NUMBER;
            default -> null;
        };
    }
}
