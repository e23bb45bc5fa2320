package com.furiflow.core.registry;

import java.util.Objects;

/**
 * Palette category grouping block types.
 *
 * @param id category id
 * @param name display name
 * @param color display color, e.g. {@code #4a90d9}
 * @param description optional description
 */
public record BlockCategory(
    String id,
    String name,
    String color,
    String description
) {
    public static final String DEFAULT_COLOR = "#808080";

    /**
     * Compact constructor with validation.
     */
    public BlockCategory {
        Objects.requireNonNull(id, "id must not be null");
        if (name == null) {
            name = id;
        }
        if (color == null) {
            color = DEFAULT_COLOR;
        }
        if (description == null) {
            description = "";
        }
    }
}
