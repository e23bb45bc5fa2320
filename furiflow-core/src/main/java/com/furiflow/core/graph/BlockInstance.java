package com.furiflow.core.graph;

import com.furiflow.core.model.Connector;
import com.furiflow.core.model.ConnectorDirection;
import com.furiflow.core.model.PropertyValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A placed block: an instance of a block type with its own property values.
 *
 * <p>Instances are created by
 * {@link com.furiflow.core.registry.BlockTypeRegistry#instantiate(String, String)}.
 * The connector list is fixed at creation; only properties and the opaque
 * canvas position change afterwards.
 */
public class BlockInstance {

    private final String id;
    private final String typeId;
    private final List<Connector> connectors;
    private final Map<String, PropertyValue> properties = new LinkedHashMap<>();
    private double x;
    private double y;

    /**
     * Creates a block instance.
     *
     * @param id unique id within a graph
     * @param typeId block type id
     * @param connectors connectors in declared order (inputs first, then outputs)
     */
    public BlockInstance(String id, String typeId, List<Connector> connectors) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.typeId = Objects.requireNonNull(typeId, "typeId must not be null");
        this.connectors = connectors == null ? List.of() : List.copyOf(connectors);
        for (Connector connector : this.connectors) {
            if (!connector.blockId().equals(id)) {
                throw new IllegalArgumentException(
                    "Connector " + connector.ref() + " does not belong to block " + id);
            }
        }
    }

    public String id() {
        return id;
    }

    public String typeId() {
        return typeId;
    }

    public List<Connector> connectors() {
        return connectors;
    }

    public List<Connector> inputs() {
        return connectors.stream().filter(Connector::isInput).toList();
    }

    public List<Connector> outputs() {
        return connectors.stream().filter(c -> !c.isInput()).toList();
    }

    /**
     * Looks up a connector by port id and direction.
     *
     * @param portId port id
     * @param direction connector direction
     * @return the connector, or empty if the block has no such port
     */
    public Optional<Connector> connector(String portId, ConnectorDirection direction) {
        return connectors.stream()
            .filter(c -> c.portId().equals(portId) && c.direction() == direction)
            .findFirst();
    }

    public Optional<Connector> input(String portId) {
        return connector(portId, ConnectorDirection.INPUT);
    }

    public Optional<Connector> output(String portId) {
        return connector(portId, ConnectorDirection.OUTPUT);
    }

    /**
     * Returns an unmodifiable view of the properties in assignment order.
     *
     * @return property name to value
     */
    public Map<String, PropertyValue> properties() {
        return Collections.unmodifiableMap(properties);
    }

    public Optional<PropertyValue> property(String name) {
        return Optional.ofNullable(properties.get(name));
    }

    /**
     * Assigns a property value.
     *
     * @param name property name
     * @param value new value
     * @return true if the stored value changed
     */
    public boolean setProperty(String name, PropertyValue value) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(value, "value must not be null");
        return !value.equals(properties.put(name, value));
    }

    public double x() {
        return x;
    }

    public double y() {
        return y;
    }

    public void moveTo(double x, double y) {
        this.x = x;
        this.y = y;
    }

    @Override
    public String toString() {
        return typeId + "#" + id;
    }
}
