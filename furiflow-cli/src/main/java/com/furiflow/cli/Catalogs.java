package com.furiflow.cli;

import com.furiflow.core.registry.BlockTypeRegistry;
import com.furiflow.core.registry.CatalogLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Loads the block catalog a command works with.
 */
final class Catalogs {

    private static final Logger log = LoggerFactory.getLogger(Catalogs.class);

    private Catalogs() {
    }

    /**
     * Loads the given catalog file, or the bundled catalog when none is given.
     *
     * @param catalogFile catalog path, may be null
     * @return loaded registry
     * @throws CatalogLoadException if the catalog cannot be loaded
     */
    static BlockTypeRegistry load(Path catalogFile) throws CatalogLoadException {
        BlockTypeRegistry registry = new BlockTypeRegistry();
        if (catalogFile == null) {
            log.debug("Using bundled block catalog");
            registry.loadDefault();
        } else {
            log.debug("Using block catalog: {}", catalogFile);
            registry.load(catalogFile);
        }
        return registry;
    }
}
