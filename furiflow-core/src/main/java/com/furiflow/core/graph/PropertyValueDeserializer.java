package com.furiflow.core.graph;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.furiflow.core.model.PropertyValue;
import com.furiflow.core.util.JsonLiterals;

import java.io.IOException;

/**
 * Reads a bare JSON literal as a {@link PropertyValue}, tagging it by token type.
 *
 * <p>Structured values (arrays, objects) have no literal form and read as null,
 * which {@link BlockSnapshot} then drops.
 */
class PropertyValueDeserializer extends StdDeserializer<PropertyValue> {

    PropertyValueDeserializer() {
        super(PropertyValue.class);
    }

    @Override
    public PropertyValue deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonNode node = parser.readValueAsTree();
        return JsonLiterals.toPropertyValue(node).orElse(null);
    }
}
