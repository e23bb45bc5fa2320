package com.furiflow.core.model;

import java.util.Objects;

/**
 * Directed connection from an output port to an input port.
 *
 * <p>The canonical {@link #id()} is derived from both endpoints ordered by
 * block id (then port id), so the same physical connection always maps to the
 * same identifier no matter which end it was declared from.
 *
 * @param source output endpoint
 * @param target input endpoint
 * @param kind connector family shared by both endpoints
 */
public record Connection(
    PortRef source,
    PortRef target,
    PortKind kind
) {
    /**
     * Compact constructor with validation.
     */
    public Connection {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
    }

    /**
     * Builds a connection from two compatible connectors given in any order.
     *
     * @param a first connector
     * @param b second connector
     * @return connection oriented output to input
     * @throws IllegalArgumentException if the connectors are not compatible
     */
    public static Connection between(Connector a, Connector b) {
        if (!a.isCompatibleWith(b)) {
            throw new IllegalArgumentException("Incompatible connectors: " + a.ref() + " and " + b.ref());
        }
        Connector output = a.isInput() ? b : a;
        Connector input = a.isInput() ? a : b;
        return new Connection(output.ref(), input.ref(), a.kind());
    }

    /**
     * Returns the canonical identifier of the connection between two ports.
     *
     * @param a one endpoint
     * @param b the other endpoint
     * @return identifier of the form {@code lowBlock.port-highBlock.port}
     */
    public static String canonicalId(PortRef a, PortRef b) {
        int order = a.blockId().compareTo(b.blockId());
        if (order == 0) {
            order = a.portId().compareTo(b.portId());
        }
        return order <= 0 ? a + "-" + b : b + "-" + a;
    }

    public String id() {
        return canonicalId(source, target);
    }

    /**
     * Checks whether either endpoint belongs to the given block.
     *
     * @param blockId block id
     * @return true if the connection touches the block
     */
    public boolean touches(String blockId) {
        return source.blockId().equals(blockId) || target.blockId().equals(blockId);
    }
}
