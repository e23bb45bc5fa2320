package com.furiflow.core.graph;

import com.furiflow.core.model.Connection;
import com.furiflow.core.model.Connector;
import com.furiflow.core.model.PortRef;
import com.furiflow.core.model.PropertyValue;
import com.furiflow.core.registry.BlockTypeDefinition;
import com.furiflow.core.registry.BlockTypeRegistry;
import com.furiflow.core.registry.PropertySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Mutable graph of block instances and the connections between their connectors.
 *
 * <p>Invariants maintained by every mutation:
 * <ul>
 *   <li>a connection always joins an output and an input connector of the same kind;</li>
 *   <li>each connector takes part in at most one connection, so connecting an
 *       already attached connector first severs its previous connection;</li>
 *   <li>removing a block removes every connection touching it.</li>
 * </ul>
 *
 * <p>Code generation never reads a live graph; callers freeze it with
 * {@link #toSnapshot()} first.
 */
public class BlockGraph {

    private static final Logger log = LoggerFactory.getLogger(BlockGraph.class);

    private final Map<String, BlockInstance> blocks = new LinkedHashMap<>();
    private final Map<String, Connection> connections = new LinkedHashMap<>();
    private final Map<Connector, String> attachments = new HashMap<>();

    /**
     * Adds a block.
     *
     * @param instance block to add
     * @throws IllegalArgumentException if a block with the same id is already present
     */
    public void addBlock(BlockInstance instance) {
        Objects.requireNonNull(instance, "instance must not be null");
        if (blocks.containsKey(instance.id())) {
            throw new IllegalArgumentException("Duplicate block id: " + instance.id());
        }
        blocks.put(instance.id(), instance);
    }

    /**
     * Removes a block and every connection touching any of its connectors.
     *
     * @param blockId block id
     * @return true if the block was present
     */
    public boolean removeBlock(String blockId) {
        BlockInstance removed = blocks.remove(blockId);
        if (removed == null) {
            return false;
        }
        List<Connection> touching = connectionsOf(blockId);
        touching.forEach(this::detach);
        log.debug("Removed block {} and {} connections", blockId, touching.size());
        return true;
    }

    public Optional<BlockInstance> block(String blockId) {
        return Optional.ofNullable(blockId == null ? null : blocks.get(blockId));
    }

    public Collection<BlockInstance> blocks() {
        return Collections.unmodifiableCollection(blocks.values());
    }

    public Collection<Connection> connections() {
        return Collections.unmodifiableCollection(connections.values());
    }

    /**
     * Returns every connection with an endpoint on the given block.
     *
     * @param blockId block id
     * @return matching connections in creation order
     */
    public List<Connection> connectionsOf(String blockId) {
        return connections.values().stream().filter(c -> c.touches(blockId)).toList();
    }

    public Optional<Connection> connectionAt(Connector connector) {
        String id = attachments.get(connector);
        return Optional.ofNullable(id == null ? null : connections.get(id));
    }

    /**
     * Looks up the input port an output port is connected to.
     *
     * @param source output port
     * @return connected input port, or empty if the port is unconnected
     */
    public Optional<PortRef> target(PortRef source) {
        return connections.values().stream()
            .filter(c -> c.source().equals(source))
            .map(Connection::target)
            .findFirst();
    }

    /**
     * Connects two connectors given in either order.
     *
     * <p>Fails without changing the graph unless one connector is an input and
     * the other an output of the same kind, and both belong to blocks in this
     * graph. On success any connection previously attached to either connector
     * is severed first.
     *
     * @param a first connector
     * @param b second connector
     * @return true if the connection was made
     */
    public boolean connect(Connector a, Connector b) {
        if (a == null || b == null || !a.isCompatibleWith(b)) {
            log.debug("Rejected incompatible connection {} - {}", a, b);
            return false;
        }
        if (!owns(a) || !owns(b)) {
            log.debug("Rejected connection to a connector outside the graph: {} - {}", a.ref(), b.ref());
            return false;
        }

        connectionAt(a).ifPresent(this::detach);
        connectionAt(b).ifPresent(this::detach);

        Connection connection = Connection.between(a, b);
        connections.put(connection.id(), connection);
        attachments.put(a, connection.id());
        attachments.put(b, connection.id());
        log.debug("Connected {} -> {}", connection.source(), connection.target());
        return true;
    }

    /**
     * Removes the connection between two connectors if it exists.
     *
     * @param a first connector
     * @param b second connector
     * @return true if a connection was removed
     */
    public boolean disconnect(Connector a, Connector b) {
        if (a == null || b == null) {
            return false;
        }
        String id = Connection.canonicalId(a.ref(), b.ref());
        Connection connection = connections.get(id);
        if (connection == null) {
            return false;
        }
        detach(connection);
        return true;
    }

    /**
     * Assigns a property on a block in this graph.
     *
     * @param blockId block id
     * @param name property name
     * @param value new value
     * @return true if the stored value changed
     * @throws IllegalArgumentException if the block is not in the graph
     */
    public boolean setProperty(String blockId, String name, PropertyValue value) {
        BlockInstance block = blocks.get(blockId);
        if (block == null) {
            throw new IllegalArgumentException("Unknown block: " + blockId);
        }
        return block.setProperty(name, value);
    }

    /**
     * Freezes the graph into a snapshot.
     *
     * @return snapshot of the current blocks and connections
     */
    public GraphSnapshot toSnapshot() {
        List<BlockSnapshot> blockSnapshots = blocks.values().stream()
            .map(b -> new BlockSnapshot(b.id(), b.typeId(), b.x(), b.y(), b.properties()))
            .toList();
        List<ConnectionSnapshot> connectionSnapshots = connections.values().stream()
            .map(c -> new ConnectionSnapshot(EndpointSnapshot.of(c.source()), EndpointSnapshot.of(c.target())))
            .toList();
        return new GraphSnapshot(blockSnapshots, connectionSnapshots);
    }

    /**
     * Rebuilds a graph from a snapshot.
     *
     * <p>Blocks without an id, with a duplicate id or with a type the registry
     * does not know are skipped. Connections whose blocks or ports cannot be
     * resolved, or whose ports are incompatible, are skipped. Every skip is
     * logged; none fails the load. Property values whose kind differs from the
     * kind declared by the block type are coerced when their text allows it.
     *
     * @param snapshot snapshot to read
     * @param registry registry used to instantiate blocks
     * @return rebuilt graph
     */
    public static BlockGraph fromSnapshot(GraphSnapshot snapshot, BlockTypeRegistry registry) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        Objects.requireNonNull(registry, "registry must not be null");

        BlockGraph graph = new BlockGraph();
        List<String> skipped = new ArrayList<>();

        for (BlockSnapshot blockSnapshot : snapshot.blocks()) {
            if (blockSnapshot.id() == null || blockSnapshot.id().isBlank()) {
                log.warn("Skipping block without id (type '{}')", blockSnapshot.type());
                skipped.add("<no id>");
                continue;
            }
            if (graph.blocks.containsKey(blockSnapshot.id())) {
                log.warn("Skipping duplicate block id '{}'", blockSnapshot.id());
                skipped.add(blockSnapshot.id());
                continue;
            }
            Optional<BlockInstance> instance = registry.instantiate(blockSnapshot.type(), blockSnapshot.id());
            if (instance.isEmpty()) {
                log.warn("Skipping block '{}' of unknown type '{}'", blockSnapshot.id(), blockSnapshot.type());
                skipped.add(blockSnapshot.id());
                continue;
            }
            BlockInstance block = instance.get();
            block.moveTo(blockSnapshot.x(), blockSnapshot.y());
            BlockTypeDefinition definition = registry.typeInfo(block.typeId()).orElseThrow();
            blockSnapshot.properties().forEach((name, value) ->
                block.setProperty(name, conformToSchema(definition, name, value)));
            graph.addBlock(block);
        }

        for (ConnectionSnapshot connectionSnapshot : snapshot.connections()) {
            if (!graph.restore(connectionSnapshot)) {
                skipped.add(String.valueOf(connectionSnapshot));
            }
        }

        if (!skipped.isEmpty()) {
            log.info("Snapshot loaded with {} skipped entries", skipped.size());
        }
        return graph;
    }

    private boolean restore(ConnectionSnapshot snapshot) {
        if (!snapshot.isComplete()) {
            log.warn("Skipping incomplete connection: {}", snapshot);
            return false;
        }
        Optional<Connector> from = block(snapshot.from().block()).flatMap(b -> b.output(snapshot.from().port()));
        Optional<Connector> to = block(snapshot.to().block()).flatMap(b -> b.input(snapshot.to().port()));
        if (from.isEmpty() || to.isEmpty()) {
            log.warn("Skipping connection with unresolved endpoint: {}.{} -> {}.{}",
                snapshot.from().block(), snapshot.from().port(), snapshot.to().block(), snapshot.to().port());
            return false;
        }
        if (!connect(from.get(), to.get())) {
            log.warn("Skipping incompatible connection: {} -> {}", from.get().ref(), to.get().ref());
            return false;
        }
        return true;
    }

    private static PropertyValue conformToSchema(BlockTypeDefinition definition, String name, PropertyValue value) {
        Optional<PropertySpec> spec = definition.property(name);
        if (spec.isEmpty() || spec.get().kind() == value.kind()) {
            return value;
        }
        return value.coerceTo(spec.get().kind()).orElseGet(() -> {
            log.warn("Property '{}' of block type '{}' expects {} but got {}; keeping value as given",
                name, definition.id(), spec.get().kind(), value.kind());
            return value;
        });
    }

    private boolean owns(Connector connector) {
        BlockInstance block = blocks.get(connector.blockId());
        return block != null && block.connectors().contains(connector);
    }

    private void detach(Connection connection) {
        connections.remove(connection.id());
        attachments.values().removeIf(id -> id.equals(connection.id()));
    }
}
