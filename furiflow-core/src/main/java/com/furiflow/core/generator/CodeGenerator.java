package com.furiflow.core.generator;

import com.furiflow.core.graph.BlockSnapshot;
import com.furiflow.core.graph.GraphSnapshot;
import com.furiflow.core.manifest.AppManifest;
import com.furiflow.core.registry.BlockTypeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Translates a block graph snapshot into application source.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>Resolve the manifest's {@code requires} against the {@link Capability} table.</li>
 *   <li>Find every {@value #ENTRY_BLOCK_TYPE} block; none is fatal.</li>
 *   <li>Expand each entry flow with a {@link FlowExpander}.</li>
 *   <li>Assemble includes, state struct, callbacks, cleanup and entry point
 *       with a {@link SourceAssembler}.</li>
 * </ol>
 *
 * <p>All working state is local to one {@link #generate} call, so a generator
 * can be reused and the output depends only on the three inputs.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * BlockTypeRegistry registry = BlockTypeRegistry.withDefaultCatalog();
 * GraphSnapshot snapshot = new GraphSnapshotCodec().read(Path.of("graph.json"));
 * AppManifest manifest = ManifestLoader.load(Path.of("manifest.yaml"));
 *
 * GenerationResult result = new CodeGenerator().generate(registry, manifest, snapshot);
 * if (result.isSuccess()) {
 *     String source = result.files().get(CodeGenerator.MAIN_FILE);
 * }
 * }</pre>
 */
public class CodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CodeGenerator.class);

    /** Block type marking a traversal root. */
    public static final String ENTRY_BLOCK_TYPE = "app_on_start";

    /** Name of the generated source unit. */
    public static final String MAIN_FILE = "main.c";

    /**
     * Generates application source.
     *
     * @param registry block type catalog
     * @param manifest application manifest
     * @param snapshot frozen block graph
     * @return generated files, or {@link GenerationError#NO_ENTRY_POINT}
     */
    public GenerationResult generate(BlockTypeRegistry registry, AppManifest manifest, GraphSnapshot snapshot) {
        Objects.requireNonNull(registry, "registry must not be null");
        Objects.requireNonNull(manifest, "manifest must not be null");
        Objects.requireNonNull(snapshot, "snapshot must not be null");

        String appName = manifest.appid();
        log.debug("Generating source for app '{}' from {} blocks and {} connections",
            appName, snapshot.blocks().size(), snapshot.connections().size());

        Set<Capability> capabilities = Capability.resolve(manifest.requires());

        List<BlockSnapshot> entryBlocks = snapshot.blocks().stream()
            .filter(b -> ENTRY_BLOCK_TYPE.equals(b.type()) && b.id() != null)
            .toList();
        if (entryBlocks.isEmpty()) {
            log.warn("No entry point block found");
            return GenerationResult.failure(GenerationError.NO_ENTRY_POINT);
        }

        FlowExpander expander = new FlowExpander(registry, appName, snapshot);
        List<String> flowCode = new ArrayList<>();
        for (BlockSnapshot entry : entryBlocks) {
            flowCode.add(expander.expand(entry));
        }

        String source = new SourceAssembler(appName, manifest.entryPoint(), capabilities).assemble(flowCode);

        Map<String, String> files = new LinkedHashMap<>();
        files.put(MAIN_FILE, source);
        log.info("Generated {} for app '{}' ({} entry flows, capabilities {})",
            MAIN_FILE, appName, entryBlocks.size(), capabilities);
        return GenerationResult.success(files);
    }
}
