package com.furiflow.core.graph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Immutable serialized form of a block graph.
 *
 * <p>This is the only thing code generation reads: editing happens on a
 * {@link BlockGraph}, which is then frozen with {@link BlockGraph#toSnapshot()}.
 *
 * @param blocks blocks in graph order
 * @param connections connections in creation order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GraphSnapshot(
    @JsonProperty("blocks") List<BlockSnapshot> blocks,
    @JsonProperty("connections") List<ConnectionSnapshot> connections
) {
    /**
     * Compact constructor; null lists become empty and null entries are dropped.
     */
    public GraphSnapshot {
        blocks = blocks == null ? List.of() : blocks.stream().filter(Objects::nonNull).toList();
        connections = connections == null ? List.of() : connections.stream().filter(Objects::nonNull).toList();
    }

    public static GraphSnapshot empty() {
        return new GraphSnapshot(List.of(), List.of());
    }
}
