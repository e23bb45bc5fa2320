package com.furiflow.core.model;

import java.util.Objects;

/**
 * Typed attachment point on a block instance.
 *
 * <p>Connectors are derived from the port specs of the block type and are not
 * persisted on their own; a snapshot only records connections.
 *
 * @param blockId owning block id
 * @param portId port id
 * @param direction input or output
 * @param kind flow or data
 */
public record Connector(
    String blockId,
    String portId,
    ConnectorDirection direction,
    PortKind kind
) {
    /**
     * Compact constructor with validation.
     */
    public Connector {
        Objects.requireNonNull(blockId, "blockId must not be null");
        Objects.requireNonNull(portId, "portId must not be null");
        Objects.requireNonNull(direction, "direction must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
    }

    public boolean isInput() {
        return direction == ConnectorDirection.INPUT;
    }

    public PortRef ref() {
        return new PortRef(blockId, portId);
    }

    /**
     * Checks whether a connection between this connector and {@code other} is
     * structurally valid: one input and one output of the same kind.
     *
     * @param other the other endpoint
     * @return true if the two connectors may be joined
     */
    public boolean isCompatibleWith(Connector other) {
        return other != null && direction != other.direction && kind == other.kind;
    }
}
