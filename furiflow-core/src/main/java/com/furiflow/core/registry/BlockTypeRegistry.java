package com.furiflow.core.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.furiflow.core.graph.BlockInstance;
import com.furiflow.core.model.Connector;
import com.furiflow.core.model.ConnectorDirection;
import com.furiflow.core.model.PortKind;
import com.furiflow.core.model.PropertyValue;
import com.furiflow.core.model.ValueKind;
import com.furiflow.core.template.CodeTemplate;
import com.furiflow.core.util.IdGenerator;
import com.furiflow.core.util.JsonLiterals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Catalog of block categories and block types.
 *
 * <p>Catalogs are JSON documents of the form:
 * <pre>{@code
 * {
 *   "blockCategories": [
 *     {
 *       "id": "events", "name": "Events", "color": "#e67e22", "description": "...",
 *       "blocks": [
 *         {
 *           "id": "app_on_start", "name": "On Start", "type": "event",
 *           "inputs": [],
 *           "outputs": [{"id": "next", "type": "flow", "description": "Then"}],
 *           "properties": [],
 *           "codeTemplate": "${next_code}"
 *         }
 *       ]
 *     }
 *   ]
 * }
 * }</pre>
 *
 * <p>Entries without an id (categories, blocks, ports, properties) are skipped
 * with a warning. A document that is not a JSON object, or whose
 * {@code blockCategories} is not an array, fails the whole load and leaves the
 * registry unchanged. Successive loads merge into the registry; categories and
 * types keep their first-seen enumeration order.
 */
public class BlockTypeRegistry {

    private static final Logger log = LoggerFactory.getLogger(BlockTypeRegistry.class);

    /** Classpath location of the bundled catalog. */
    public static final String DEFAULT_CATALOG_RESOURCE = "/catalog/default-blocks.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Map<String, BlockCategory> categories = new LinkedHashMap<>();
    private Map<String, BlockTypeDefinition> blockTypes = new LinkedHashMap<>();

    /**
     * Creates a registry pre-loaded with the bundled default catalog.
     *
     * @return loaded registry
     * @throws IllegalStateException if the bundled catalog is missing or invalid
     */
    public static BlockTypeRegistry withDefaultCatalog() {
        BlockTypeRegistry registry = new BlockTypeRegistry();
        try {
            registry.loadDefault();
        } catch (CatalogLoadException e) {
            throw new IllegalStateException("Bundled block catalog is unusable", e);
        }
        return registry;
    }

    /**
     * Loads the bundled catalog from {@value #DEFAULT_CATALOG_RESOURCE}.
     *
     * @throws CatalogLoadException if the resource is missing or malformed
     */
    public void loadDefault() throws CatalogLoadException {
        try (InputStream in = BlockTypeRegistry.class.getResourceAsStream(DEFAULT_CATALOG_RESOURCE)) {
            if (in == null) {
                throw new CatalogLoadException("Catalog resource not found: " + DEFAULT_CATALOG_RESOURCE);
            }
            load(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new CatalogLoadException("Failed to read catalog resource: " + DEFAULT_CATALOG_RESOURCE, e);
        }
    }

    /**
     * Loads a catalog file.
     *
     * @param catalogFile path to the JSON catalog
     * @throws CatalogLoadException if the file cannot be read or is malformed
     */
    public void load(Path catalogFile) throws CatalogLoadException {
        if (catalogFile == null || !Files.isRegularFile(catalogFile)) {
            throw new CatalogLoadException("Catalog file not found: " + catalogFile);
        }
        try {
            log.debug("Loading block catalog from: {}", catalogFile);
            load(Files.readString(catalogFile));
        } catch (IOException e) {
            throw new CatalogLoadException("Failed to read catalog file: " + catalogFile, e);
        }
    }

    /**
     * Loads catalog text.
     *
     * @param catalogText JSON catalog document
     * @throws CatalogLoadException if the text is empty or malformed at the top level
     */
    public void load(String catalogText) throws CatalogLoadException {
        if (catalogText == null || catalogText.isBlank()) {
            throw new CatalogLoadException("Catalog text is empty");
        }

        JsonNode root;
        try {
            root = MAPPER.readTree(catalogText);
        } catch (JsonProcessingException e) {
            throw new CatalogLoadException("Malformed catalog JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new CatalogLoadException("Catalog root must be a JSON object");
        }
        JsonNode categoryNodes = root.path("blockCategories");
        if (!categoryNodes.isMissingNode() && !categoryNodes.isArray()) {
            throw new CatalogLoadException("'blockCategories' must be an array");
        }

        Map<String, BlockCategory> newCategories = new LinkedHashMap<>(categories);
        Map<String, BlockTypeDefinition> newTypes = new LinkedHashMap<>(blockTypes);
        int loadedTypes = 0;

        for (JsonNode categoryNode : categoryNodes) {
            String categoryId = text(categoryNode, "id");
            if (categoryId == null) {
                log.warn("Skipping block category without id");
                continue;
            }
            newCategories.put(categoryId, new BlockCategory(
                categoryId,
                text(categoryNode, "name"),
                text(categoryNode, "color"),
                text(categoryNode, "description")
            ));

            for (JsonNode blockNode : categoryNode.path("blocks")) {
                Optional<BlockTypeDefinition> definition = parseBlockType(categoryId, blockNode);
                if (definition.isPresent()) {
                    newTypes.put(definition.get().id(), definition.get());
                    loadedTypes++;
                }
            }
        }

        categories = newCategories;
        blockTypes = newTypes;
        log.info("Loaded {} block types in {} categories", loadedTypes, categoryNodes.size());
    }

    /**
     * Returns all categories in declaration order.
     *
     * @return category id to category
     */
    public Map<String, BlockCategory> categories() {
        return Collections.unmodifiableMap(categories);
    }

    /**
     * Returns the type ids of a category in declaration order.
     *
     * @param categoryId category id
     * @return type ids, empty for unknown categories
     */
    public List<String> typesInCategory(String categoryId) {
        return blockTypes.values().stream()
            .filter(t -> t.categoryId().equals(categoryId))
            .map(BlockTypeDefinition::id)
            .toList();
    }

    public List<BlockTypeDefinition> blockTypes() {
        return List.copyOf(blockTypes.values());
    }

    public Optional<BlockTypeDefinition> typeInfo(String typeId) {
        return Optional.ofNullable(typeId == null ? null : blockTypes.get(typeId));
    }

    public boolean hasType(String typeId) {
        return typeId != null && blockTypes.containsKey(typeId);
    }

    /**
     * Creates a new instance of a block type with a generated id.
     *
     * @param typeId block type id
     * @return new instance, or empty for an unknown type
     */
    public Optional<BlockInstance> instantiate(String typeId) {
        return instantiate(typeId, null);
    }

    /**
     * Creates a new instance of a block type.
     *
     * <p>Connectors are built from the input then output port specs in
     * declared order. Port defaults and then property defaults are assigned as
     * properties, so a property default wins over a port default of the same name.
     *
     * @param typeId block type id
     * @param explicitId id to use, or null/blank to generate one
     * @return new instance, or empty for an unknown type
     */
    public Optional<BlockInstance> instantiate(String typeId, String explicitId) {
        BlockTypeDefinition definition = typeId == null ? null : blockTypes.get(typeId);
        if (definition == null) {
            log.debug("Cannot instantiate unknown block type: {}", typeId);
            return Optional.empty();
        }

        String id = explicitId == null || explicitId.isBlank() ? IdGenerator.newBlockId(typeId) : explicitId;

        List<Connector> connectors = new ArrayList<>();
        for (PortSpec input : definition.inputs()) {
            connectors.add(new Connector(id, input.id(), ConnectorDirection.INPUT, input.kind()));
        }
        for (PortSpec output : definition.outputs()) {
            connectors.add(new Connector(id, output.id(), ConnectorDirection.OUTPUT, output.kind()));
        }

        BlockInstance instance = new BlockInstance(id, typeId, connectors);
        for (PortSpec port : definition.inputs()) {
            port.defaultLiteral().ifPresent(value -> instance.setProperty(port.id(), value));
        }
        for (PortSpec port : definition.outputs()) {
            port.defaultLiteral().ifPresent(value -> instance.setProperty(port.id(), value));
        }
        for (PropertySpec property : definition.properties()) {
            property.defaultLiteral().ifPresent(value -> instance.setProperty(property.id(), value));
        }
        return Optional.of(instance);
    }

    private Optional<BlockTypeDefinition> parseBlockType(String categoryId, JsonNode blockNode) {
        String blockId = text(blockNode, "id");
        if (blockId == null) {
            log.warn("Skipping block type without id in category '{}'", categoryId);
            return Optional.empty();
        }

        String template = text(blockNode, "codeTemplate");
        return Optional.of(new BlockTypeDefinition(
            blockId,
            categoryId,
            text(blockNode, "name"),
            text(blockNode, "type"),
            text(blockNode, "description"),
            parsePorts(blockId, blockNode.path("inputs")),
            parsePorts(blockId, blockNode.path("outputs")),
            parseProperties(blockId, blockNode.path("properties")),
            CodeTemplate.parse(template)
        ));
    }

    private List<PortSpec> parsePorts(String blockId, JsonNode portNodes) {
        List<PortSpec> ports = new ArrayList<>();
        for (JsonNode portNode : portNodes) {
            String portId = text(portNode, "id");
            if (portId == null) {
                log.warn("Skipping port without id on block type '{}'", blockId);
                continue;
            }
            ports.add(new PortSpec(
                portId,
                PortKind.fromId(text(portNode, "type")),
                text(portNode, "description"),
                JsonLiterals.toPropertyValue(portNode.get("default")).orElse(null)
            ));
        }
        return ports;
    }

    private List<PropertySpec> parseProperties(String blockId, JsonNode propertyNodes) {
        List<PropertySpec> properties = new ArrayList<>();
        for (JsonNode propertyNode : propertyNodes) {
            String propertyId = text(propertyNode, "id");
            if (propertyId == null) {
                log.warn("Skipping property without id on block type '{}'", blockId);
                continue;
            }
            ValueKind declared = ValueKind.fromCatalogName(text(propertyNode, "type"));
            PropertyValue defaultValue = JsonLiterals.toPropertyValue(propertyNode.get("default")).orElse(null);
            if (declared != null && defaultValue != null) {
                PropertyValue original = defaultValue;
                defaultValue = defaultValue.coerceTo(declared).orElseGet(() -> {
                    log.warn("Default of property '{}.{}' does not match declared type {}",
                        blockId, propertyId, declared);
                    return original;
                });
            }
            properties.add(new PropertySpec(propertyId, declared, defaultValue));
        }
        return properties;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return null;
        }
        String text = value.asText();
        return text.isEmpty() ? null : text;
    }
}
