package com.furiflow.core.graph;

import com.furiflow.core.TestCatalogs;
import com.furiflow.core.model.Connection;
import com.furiflow.core.model.Connector;
import com.furiflow.core.model.ConnectorDirection;
import com.furiflow.core.model.PortKind;
import com.furiflow.core.model.PortRef;
import com.furiflow.core.model.PropertyValue;
import com.furiflow.core.model.ValueKind;
import com.furiflow.core.registry.BlockTypeRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BlockGraphTest {

    private BlockTypeRegistry registry;
    private BlockGraph graph;
    private BlockInstance start;
    private BlockInstance log;
    private BlockInstance sum;

    @BeforeEach
    void setUp() {
        registry = TestCatalogs.basic();
        graph = new BlockGraph();
        start = registry.instantiate("app_on_start", "start").orElseThrow();
        log = registry.instantiate("log", "log").orElseThrow();
        sum = registry.instantiate("sum", "sum").orElseThrow();
        graph.addBlock(start);
        graph.addBlock(log);
        graph.addBlock(sum);
    }

    @Test
    void connect_outputToInputOfSameKind_succeedsInEitherOrder() {
        boolean connected = graph.connect(log.input("prev").orElseThrow(), start.output("next").orElseThrow());

        assertThat(connected).isTrue();
        assertThat(graph.connections()).singleElement()
            .satisfies(c -> {
                assertThat(c.source()).isEqualTo(new PortRef("start", "next"));
                assertThat(c.target()).isEqualTo(new PortRef("log", "prev"));
            });
        assertThat(graph.target(new PortRef("start", "next"))).contains(new PortRef("log", "prev"));
    }

    @Test
    void connect_kindMismatch_failsWithoutChange() {
        boolean connected = graph.connect(start.output("next").orElseThrow(), sum.input("a").orElseThrow());

        assertThat(connected).isFalse();
        assertThat(graph.connections()).isEmpty();
    }

    @Test
    void connect_twoInputs_fails() {
        assertThat(graph.connect(log.input("prev").orElseThrow(), sum.input("prev").orElseThrow())).isFalse();
        assertThat(graph.connect(null, sum.input("prev").orElseThrow())).isFalse();
    }

    @Test
    void connect_connectorOfForeignBlock_fails() {
        Connector foreign = new Connector("elsewhere", "prev", ConnectorDirection.INPUT, PortKind.FLOW);

        assertThat(graph.connect(start.output("next").orElseThrow(), foreign)).isFalse();
    }

    @Test
    void connect_outputAlreadyConnected_replacesPreviousConnection() {
        Connector next = start.output("next").orElseThrow();
        graph.connect(next, log.input("prev").orElseThrow());

        graph.connect(next, sum.input("prev").orElseThrow());

        assertThat(graph.connections()).extracting(Connection::target)
            .containsExactly(new PortRef("sum", "prev"));
        assertThat(graph.connectionAt(log.input("prev").orElseThrow())).isEmpty();
        assertThat(graph.target(new PortRef("start", "next"))).contains(new PortRef("sum", "prev"));
    }

    @Test
    void connect_samePairTwice_keepsSingleConnection() {
        graph.connect(start.output("next").orElseThrow(), log.input("prev").orElseThrow());
        graph.connect(log.input("prev").orElseThrow(), start.output("next").orElseThrow());

        assertThat(graph.connections()).hasSize(1);
    }

    @Test
    void disconnect_existingConnection_removesIt() {
        graph.connect(start.output("next").orElseThrow(), log.input("prev").orElseThrow());

        assertThat(graph.disconnect(log.input("prev").orElseThrow(), start.output("next").orElseThrow())).isTrue();
        assertThat(graph.connections()).isEmpty();
        assertThat(graph.disconnect(log.input("prev").orElseThrow(), start.output("next").orElseThrow())).isFalse();
    }

    @Test
    void removeBlock_removesEveryTouchingConnection() {
        graph.connect(start.output("next").orElseThrow(), log.input("prev").orElseThrow());
        graph.connect(log.output("next").orElseThrow(), sum.input("prev").orElseThrow());

        boolean removed = graph.removeBlock("log");

        assertThat(removed).isTrue();
        assertThat(graph.connections()).isEmpty();
        assertThat(graph.connectionAt(start.output("next").orElseThrow())).isEmpty();
        assertThat(graph.block("log")).isEmpty();
        assertThat(graph.removeBlock("log")).isFalse();
    }

    @Test
    void addBlock_duplicateId_throws() {
        BlockInstance duplicate = registry.instantiate("log", "log").orElseThrow();

        assertThatThrownBy(() -> graph.addBlock(duplicate))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("log");
    }

    @Test
    void setProperty_reportsWhetherValueChanged() {
        assertThat(graph.setProperty("log", "msg", PropertyValue.ofString("hi"))).isTrue();
        assertThat(graph.setProperty("log", "msg", PropertyValue.ofString("hi"))).isFalse();
        assertThatThrownBy(() -> graph.setProperty("nope", "msg", PropertyValue.ofString("hi")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void toSnapshot_fromSnapshot_restoresBlocksAndConnections() {
        graph.connect(start.output("next").orElseThrow(), log.input("prev").orElseThrow());
        graph.setProperty("log", "msg", PropertyValue.ofString("hi"));
        log.moveTo(120, 40);

        BlockGraph restored = BlockGraph.fromSnapshot(graph.toSnapshot(), registry);

        assertThat(restored.blocks()).extracting(BlockInstance::id).containsExactly("start", "log", "sum");
        assertThat(restored.block("log").orElseThrow().property("msg")).contains(PropertyValue.ofString("hi"));
        assertThat(restored.block("log").orElseThrow().x()).isEqualTo(120);
        assertThat(restored.target(new PortRef("start", "next"))).contains(new PortRef("log", "prev"));
    }

    @Test
    void fromSnapshot_skipsUnknownTypesDuplicatesAndDanglingConnections() {
        GraphSnapshot snapshot = new GraphSnapshot(
            List.of(
                BlockSnapshot.of("start", "app_on_start", Map.of()),
                BlockSnapshot.of("start", "log", Map.of()),
                BlockSnapshot.of("ghost", "mystery", Map.of()),
                BlockSnapshot.of(null, "log", Map.of())
            ),
            List.of(
                ConnectionSnapshot.of("start", "next", "ghost", "prev"),
                ConnectionSnapshot.of("start", "nope", "start", "prev")
            ));

        BlockGraph restored = BlockGraph.fromSnapshot(snapshot, registry);

        assertThat(restored.blocks()).singleElement()
            .satisfies(b -> assertThat(b.typeId()).isEqualTo("app_on_start"));
        assertThat(restored.connections()).isEmpty();
    }

    @Test
    void fromSnapshot_propertyOfWrongKind_isCoercedToDeclaredKind() {
        GraphSnapshot snapshot = new GraphSnapshot(
            List.of(BlockSnapshot.of("w", "wait", Map.of("ms", PropertyValue.ofString("250")))),
            List.of());

        BlockGraph restored = BlockGraph.fromSnapshot(snapshot, registry);

        PropertyValue ms = restored.block("w").orElseThrow().property("ms").orElseThrow();
        assertThat(ms.kind()).isEqualTo(ValueKind.NUMBER);
        assertThat(ms.render()).isEqualTo("250");
    }

    @Test
    void fromSnapshot_duplicateOutputConnections_lastWins() {
        GraphSnapshot snapshot = new GraphSnapshot(
            List.of(
                BlockSnapshot.of("start", "app_on_start", Map.of()),
                BlockSnapshot.of("a", "log", Map.of()),
                BlockSnapshot.of("b", "log", Map.of())
            ),
            List.of(
                ConnectionSnapshot.of("start", "next", "a", "prev"),
                ConnectionSnapshot.of("start", "next", "b", "prev")
            ));

        BlockGraph restored = BlockGraph.fromSnapshot(snapshot, registry);

        assertThat(restored.target(new PortRef("start", "next"))).contains(new PortRef("b", "prev"));
        assertThat(restored.connections()).hasSize(1);
    }
}
