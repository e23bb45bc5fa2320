package com.furiflow.core.registry;

import com.furiflow.core.model.PropertyValue;
import com.furiflow.core.model.ValueKind;

import java.util.Objects;
import java.util.Optional;

/**
 * Declared property of a block type.
 *
 * @param id property id, also the template placeholder name
 * @param kind declared literal kind
 * @param defaultValue optional default literal
 */
public record PropertySpec(
    String id,
    ValueKind kind,
    PropertyValue defaultValue
) {
    /**
     * Compact constructor with validation.
     */
    public PropertySpec {
        Objects.requireNonNull(id, "id must not be null");
        if (kind == null) {
            kind = defaultValue != null ? defaultValue.kind() : ValueKind.STRING;
        }
    }

    public Optional<PropertyValue> defaultLiteral() {
        return Optional.ofNullable(defaultValue);
    }
}
