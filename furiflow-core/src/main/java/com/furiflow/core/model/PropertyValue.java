package com.furiflow.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * Tagged literal value of a block property.
 *
 * <p>The kind is decided when the value enters the system (catalog schema or
 * snapshot token type) and drives how the value is rendered into generated
 * source:
 * <ul>
 *   <li>{@link ValueKind#STRING} - wrapped in double quotes, no escaping</li>
 *   <li>{@link ValueKind#BOOLEAN} - the bare words {@code true} / {@code false}</li>
 *   <li>{@link ValueKind#NUMBER} - plain text form of the number</li>
 * </ul>
 *
 * @param kind literal kind
 * @param literal the value: a {@link String}, {@link Boolean} or {@link Number} matching {@code kind}
 */
public record PropertyValue(
    ValueKind kind,
    Object literal
) {
    /**
     * Compact constructor with validation.
     */
    public PropertyValue {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(literal, "literal must not be null");
        boolean matches = switch (kind) {
            case STRING -> literal instanceof String;
            case BOOLEAN -> literal instanceof Boolean;
            case NUMBER -> literal instanceof Number;
        };
        if (!matches) {
            throw new IllegalArgumentException(
                "Literal of type " + literal.getClass().getSimpleName() + " does not match kind " + kind);
        }
    }

    public static PropertyValue ofString(String value) {
        return new PropertyValue(ValueKind.STRING, value);
    }

    public static PropertyValue ofBoolean(boolean value) {
        return new PropertyValue(ValueKind.BOOLEAN, value);
    }

    public static PropertyValue ofNumber(Number value) {
        return new PropertyValue(ValueKind.NUMBER, value);
    }

    /**
     * Returns the bare literal for serialization.
     *
     * @return the wrapped literal
     */
    @JsonValue
    public Object jsonValue() {
        return literal;
    }

    /**
     * Renders the value as it is substituted into a code template.
     *
     * @return source text for this value
     */
    public String render() {
        return switch (kind) {
            case STRING -> "\"" + literal + "\"";
            case BOOLEAN -> ((Boolean) literal) ? "true" : "false";
            case NUMBER -> literal.toString();
        };
    }

    /**
     * Converts this value to another kind when its text allows it.
     *
     * @param target requested kind
     * @return converted value, or empty if the text cannot be read as {@code target}
     */
    public Optional<PropertyValue> coerceTo(ValueKind target) {
        if (target == kind) {
            return Optional.of(this);
        }
        String text = literal.toString().trim();
        return switch (target) {
            case STRING -> Optional.of(ofString(literal.toString()));
            case BOOLEAN -> {
                if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
                    yield Optional.of(ofBoolean(Boolean.parseBoolean(text)));
                }
                yield Optional.empty();
            }
            case NUMBER -> {
                try {
                    yield Optional.of(ofNumber(new BigDecimal(text)));
                } catch (NumberFormatException e) {
                    yield Optional.empty();
                }
            }
        };
    }

    @Override
    public String toString() {
        return render();
    }
}
