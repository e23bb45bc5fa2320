package com.furiflow.core.graph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.furiflow.core.model.PropertyValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Serialized block instance.
 *
 * @param id block id
 * @param type block type id
 * @param x canvas x position, ignored by code generation
 * @param y canvas y position, ignored by code generation
 * @param properties property values in assignment order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BlockSnapshot(
    @JsonProperty("id") String id,
    @JsonProperty("type") String type,
    @JsonProperty("x") double x,
    @JsonProperty("y") double y,
    @JsonProperty("properties") Map<String, PropertyValue> properties
) {
    /**
     * Compact constructor; drops null property values and keeps insertion order.
     */
    public BlockSnapshot {
        Map<String, PropertyValue> copy = new LinkedHashMap<>();
        if (properties != null) {
            properties.forEach((name, value) -> {
                if (name != null && value != null) {
                    copy.put(name, value);
                }
            });
        }
        properties = Collections.unmodifiableMap(copy);
    }

    public static BlockSnapshot of(String id, String type, Map<String, PropertyValue> properties) {
        return new BlockSnapshot(id, type, 0, 0, properties);
    }
}
