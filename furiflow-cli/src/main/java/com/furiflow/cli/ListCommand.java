package com.furiflow.cli;

import com.furiflow.core.registry.BlockCategory;
import com.furiflow.core.registry.BlockTypeDefinition;
import com.furiflow.core.registry.BlockTypeRegistry;
import com.furiflow.core.registry.CatalogLoadException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Lists the block categories or block types of a catalog.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # List categories of the bundled catalog
 * furiflow list categories
 *
 * # List block types of one category
 * furiflow list blocks --category actions
 *
 * # List block types of a custom catalog
 * furiflow list blocks -c my-blocks.json
 * }</pre>
 */
@Command(
    name = "list",
    description = "List block categories or block types",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(index = "0", description = "Type to list: categories or blocks")
    private String type;

    @Option(names = {"--category"}, description = "Only list block types of this category")
    private String category;

    @Option(names = {"-c", "--catalog"}, description = "Block catalog JSON file (default: bundled catalog)")
    private Path catalogFile;

    @Override
    public Integer call() {
        BlockTypeRegistry registry;
        try {
            registry = Catalogs.load(catalogFile);
        } catch (CatalogLoadException e) {
            log.error("Failed to load catalog: {}", e.getMessage());
            System.err.println("✗ " + e.getMessage());
            return ExitCodes.FAILURE;
        }

        return switch (type.toLowerCase()) {
            case "categories", "category" -> listCategories(registry);
            case "blocks", "block" -> listBlocks(registry);
            default -> {
                log.error("Unknown type: {}. Use: categories or blocks", type);
                yield ExitCodes.FAILURE;
            }
        };
    }

    private int listCategories(BlockTypeRegistry registry) {
        System.out.println("Block Categories:");
        System.out.println();

        for (BlockCategory blockCategory : registry.categories().values()) {
            System.out.printf("  • %s (ID: %s)%n", blockCategory.name(), blockCategory.id());
            if (!blockCategory.description().isEmpty()) {
                System.out.printf("    %s%n", blockCategory.description());
            }
            System.out.printf("    Blocks: %d%n", registry.typesInCategory(blockCategory.id()).size());
            System.out.println();
        }

        if (registry.categories().isEmpty()) {
            System.out.println("  No categories found.");
        }
        return ExitCodes.OK;
    }

    private int listBlocks(BlockTypeRegistry registry) {
        if (category != null && !registry.categories().containsKey(category)) {
            System.err.println("✗ Unknown category: " + category);
            return ExitCodes.FAILURE;
        }

        List<BlockTypeDefinition> types = registry.blockTypes().stream()
            .filter(t -> category == null || t.categoryId().equals(category))
            .toList();

        System.out.println("Block Types:");
        System.out.println();
        for (BlockTypeDefinition definition : types) {
            System.out.printf("  • %s (ID: %s, category: %s)%n", definition.name(), definition.id(), definition.categoryId());
            if (!definition.description().isEmpty()) {
                System.out.printf("    %s%n", definition.description());
            }
            if (!definition.properties().isEmpty()) {
                System.out.printf("    Properties: %s%n", definition.properties().stream()
                    .map(p -> p.id() + ":" + p.kind().name().toLowerCase())
                    .toList());
            }
            System.out.println();
        }

        if (types.isEmpty()) {
            System.out.println("  No block types found.");
        }
        return ExitCodes.OK;
    }
}
