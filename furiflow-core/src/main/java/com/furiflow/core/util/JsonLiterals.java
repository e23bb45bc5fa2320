package com.furiflow.core.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.furiflow.core.model.PropertyValue;

import java.util.Optional;

/**
 * Conversion between JSON literal nodes and {@link PropertyValue}s.
 *
 * <p>The kind of the resulting value follows the JSON token: strings become
 * {@code STRING}, booleans {@code BOOLEAN}, numbers {@code NUMBER}. Arrays,
 * objects and nulls have no literal form and yield empty.
 */
public final class JsonLiterals {

    private JsonLiterals() {
        // Utility class
    }

    /**
     * Reads a literal node.
     *
     * @param node JSON node, may be null
     * @return tagged value, or empty for missing, null or structured nodes
     */
    public static Optional<PropertyValue> toPropertyValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Optional.empty();
        }
        if (node.isTextual()) {
            return Optional.of(PropertyValue.ofString(node.textValue()));
        }
        if (node.isBoolean()) {
            return Optional.of(PropertyValue.ofBoolean(node.booleanValue()));
        }
        if (node.isNumber()) {
            return Optional.of(PropertyValue.ofNumber(node.numberValue()));
        }
        return Optional.empty();
    }
}
