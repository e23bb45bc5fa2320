package com.furiflow.core.model;

import java.util.Objects;

/**
 * Reference to a port on a block instance.
 *
 * @param blockId owning block id
 * @param portId port id within the block type
 */
public record PortRef(
    String blockId,
    String portId
) {
    /**
     * Compact constructor with validation.
     */
    public PortRef {
        Objects.requireNonNull(blockId, "blockId must not be null");
        Objects.requireNonNull(portId, "portId must not be null");
    }

    @Override
    public String toString() {
        return blockId + "." + portId;
    }
}
