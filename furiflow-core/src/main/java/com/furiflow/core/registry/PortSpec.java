package com.furiflow.core.registry;

import com.furiflow.core.model.PortKind;
import com.furiflow.core.model.PropertyValue;

import java.util.Objects;
import java.util.Optional;

/**
 * Declared input or output port of a block type.
 *
 * @param id port id, unique per direction within the type
 * @param kind flow or data
 * @param description human readable description
 * @param defaultValue optional default, applied as a property of the same name on instantiation
 */
public record PortSpec(
    String id,
    PortKind kind,
    String description,
    PropertyValue defaultValue
) {
    /**
     * Compact constructor with validation.
     */
    public PortSpec {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (description == null) {
            description = id;
        }
    }

    public Optional<PropertyValue> defaultLiteral() {
        return Optional.ofNullable(defaultValue);
    }
}
