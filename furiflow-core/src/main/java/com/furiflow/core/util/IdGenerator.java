package com.furiflow.core.util;

import java.util.UUID;

/**
 * Generates block instance identifiers.
 */
public final class IdGenerator {

    private static final int SUFFIX_LENGTH = 8;

    private IdGenerator() {
        // Utility class
    }

    /**
     * Generates a unique id of the form {@code <typeId>_<8 hex chars>}.
     *
     * @param typeId block type id used as prefix
     * @return new block id
     * @throws IllegalArgumentException if typeId is null or blank
     */
    public static String newBlockId(String typeId) {
        if (typeId == null || typeId.isBlank()) {
            throw new IllegalArgumentException("typeId is required");
        }
        String hex = UUID.randomUUID().toString().replace("-", "");
        return typeId + "_" + hex.substring(0, SUFFIX_LENGTH);
    }
}
