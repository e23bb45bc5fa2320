package com.furiflow.core.registry;

import com.furiflow.core.template.CodeTemplate;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable definition of a block type loaded from the catalog.
 *
 * <p>The code template is parsed once when the definition is created.
 *
 * @param id type id
 * @param categoryId owning category id
 * @param name display name
 * @param type free-form type tag from the catalog (e.g. {@code event}, {@code action})
 * @param description description
 * @param inputs input ports in declared order
 * @param outputs output ports in declared order
 * @param properties property specs in declared order
 * @param template parsed code template
 */
public record BlockTypeDefinition(
    String id,
    String categoryId,
    String name,
    String type,
    String description,
    List<PortSpec> inputs,
    List<PortSpec> outputs,
    List<PropertySpec> properties,
    CodeTemplate template
) {
    public static final String DEFAULT_TYPE = "generic";

    /**
     * Compact constructor with validation.
     */
    public BlockTypeDefinition {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(categoryId, "categoryId must not be null");
        if (name == null) {
            name = id;
        }
        if (type == null) {
            type = DEFAULT_TYPE;
        }
        if (description == null) {
            description = "";
        }
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
        properties = properties == null ? List.of() : List.copyOf(properties);
        if (template == null) {
            template = CodeTemplate.empty();
        }
    }

    /**
     * Returns the raw template text.
     *
     * @return template source, empty when the type has no template
     */
    public String codeTemplate() {
        return template.source();
    }

    public Optional<PropertySpec> property(String propertyId) {
        return properties.stream().filter(p -> p.id().equals(propertyId)).findFirst();
    }

    public Optional<PortSpec> input(String portId) {
        return inputs.stream().filter(p -> p.id().equals(portId)).findFirst();
    }

    public Optional<PortSpec> output(String portId) {
        return outputs.stream().filter(p -> p.id().equals(portId)).findFirst();
    }
}
