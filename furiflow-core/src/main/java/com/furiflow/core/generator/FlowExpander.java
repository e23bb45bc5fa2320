package com.furiflow.core.generator;

import com.furiflow.core.graph.BlockSnapshot;
import com.furiflow.core.graph.ConnectionSnapshot;
import com.furiflow.core.graph.GraphSnapshot;
import com.furiflow.core.model.PortRef;
import com.furiflow.core.model.PropertyValue;
import com.furiflow.core.registry.BlockTypeDefinition;
import com.furiflow.core.registry.BlockTypeRegistry;
import com.furiflow.core.template.CodeTemplate;
import com.furiflow.core.template.TemplateSegment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Expands block templates along flow connections.
 *
 * <p>Each call to {@link #expand(BlockSnapshot)} walks from one root with its
 * own visited set. A block reached a second time within the same walk (cycle
 * or converging paths) contributes nothing. Unknown types, empty templates
 * and dangling connection targets also contribute nothing and are logged.
 *
 * <p>Only the {@value #NEXT_PORT} output port is followed. Connections on any
 * other port are indexed but never consulted, so a data placeholder that no
 * property resolves stays in the output as written.
 */
class FlowExpander {

    private static final Logger log = LoggerFactory.getLogger(FlowExpander.class);

    static final String NEXT_PORT = "next";

    private final BlockTypeRegistry registry;
    private final String appName;
    private final Map<String, BlockSnapshot> blocksById = new LinkedHashMap<>();
    private final Map<PortRef, PortRef> targetsBySource = new HashMap<>();

    FlowExpander(BlockTypeRegistry registry, String appName, GraphSnapshot snapshot) {
        this.registry = registry;
        this.appName = appName;
        for (BlockSnapshot block : snapshot.blocks()) {
            if (block.id() != null) {
                blocksById.putIfAbsent(block.id(), block);
            }
        }
        indexConnections(snapshot);
    }

    /**
     * Expands the flow starting at a root block.
     *
     * <p>The chain is collected first and then folded from its last block back
     * to the root, each expansion becoming the continuation of its
     * predecessor. Chain length is bounded by the graph, not by the stack.
     *
     * @param root traversal root
     * @return concatenated template expansion
     */
    String expand(BlockSnapshot root) {
        List<BlockSnapshot> chain = new ArrayList<>();
        List<CodeTemplate> templates = new ArrayList<>();
        Set<String> visited = new HashSet<>();

        BlockSnapshot block = root;
        while (block != null) {
            if (!visited.add(block.id())) {
                log.debug("Block {} already expanded in this flow, skipping", block.id());
                break;
            }
            Optional<CodeTemplate> template = templateOf(block);
            if (template.isEmpty()) {
                break;
            }
            chain.add(block);
            templates.add(template.get());
            block = nextOf(block);
        }

        String continuation = "";
        for (int i = chain.size() - 1; i >= 0; i--) {
            continuation = render(chain.get(i), templates.get(i), continuation);
        }
        return continuation;
    }

    private Optional<CodeTemplate> templateOf(BlockSnapshot block) {
        Optional<BlockTypeDefinition> definition = registry.typeInfo(block.type());
        if (definition.isEmpty()) {
            log.warn("Unknown block type: {} (block {})", block.type(), block.id());
            return Optional.empty();
        }
        CodeTemplate template = definition.get().template();
        if (template.isEmpty()) {
            log.warn("No code template for block type: {} (block {})", block.type(), block.id());
            return Optional.empty();
        }
        return Optional.of(template);
    }

    private BlockSnapshot nextOf(BlockSnapshot block) {
        PortRef target = targetsBySource.get(new PortRef(block.id(), NEXT_PORT));
        if (target == null) {
            return null;
        }
        BlockSnapshot next = blocksById.get(target.blockId());
        if (next == null) {
            log.warn("Flow from {} points to missing block {}", block.id(), target.blockId());
        }
        return next;
    }

    private String render(BlockSnapshot block, CodeTemplate template, String continuation) {
        StringBuilder code = new StringBuilder();
        for (TemplateSegment segment : template.segments()) {
            switch (segment.type()) {
                case LITERAL -> code.append(segment.text());
                case APP_NAME -> code.append(appName);
                case CONTINUATION -> code.append(continuation);
                case PROPERTY -> {
                    PropertyValue value = block.properties().get(segment.text());
                    code.append(value != null ? value.render() : segment.sourceText());
                }
            }
        }
        return code.toString();
    }

    /**
     * Builds the source port index. A second connection from the same output
     * port replaces the first; the replacement is logged.
     */
    private void indexConnections(GraphSnapshot snapshot) {
        for (ConnectionSnapshot connection : snapshot.connections()) {
            if (!connection.isComplete()) {
                log.warn("Ignoring incomplete connection: {}", connection);
                continue;
            }
            PortRef source = new PortRef(connection.from().block(), connection.from().port());
            PortRef target = new PortRef(connection.to().block(), connection.to().port());
            PortRef previous = targetsBySource.put(source, target);
            if (previous != null && !previous.equals(target)) {
                log.warn("Output {} has more than one connection; {} replaces {}", source, target, previous);
            }
        }
    }
}
