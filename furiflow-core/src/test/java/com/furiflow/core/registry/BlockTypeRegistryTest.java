package com.furiflow.core.registry;

import com.furiflow.core.TestCatalogs;
import com.furiflow.core.graph.BlockInstance;
import com.furiflow.core.model.Connector;
import com.furiflow.core.model.ConnectorDirection;
import com.furiflow.core.model.PortKind;
import com.furiflow.core.model.PropertyValue;
import com.furiflow.core.model.ValueKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BlockTypeRegistryTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validCatalog_keepsDeclarationOrder() {
        BlockTypeRegistry registry = TestCatalogs.basic();

        assertThat(registry.categories().keySet()).containsExactly("events", "actions");
        assertThat(registry.typesInCategory("actions"))
            .containsExactly("log", "flag", "wait", "sum", "silent", "tick");
        assertThat(registry.typesInCategory("nope")).isEmpty();
        assertThat(registry.categories().get("actions").color()).isEqualTo(BlockCategory.DEFAULT_COLOR);
    }

    @Test
    void load_entriesWithoutId_areSkipped() throws CatalogLoadException {
        BlockTypeRegistry registry = new BlockTypeRegistry();

        registry.load("""
            {"blockCategories": [
              {"name": "No id", "blocks": [{"id": "lost"}]},
              {"id": "ok", "blocks": [
                {"name": "No id"},
                {"id": "kept", "inputs": [{"type": "flow"}, {"id": "prev", "type": "flow"}]}
              ]}
            ]}
            """);

        assertThat(registry.categories()).containsOnlyKeys("ok");
        assertThat(registry.hasType("lost")).isFalse();
        assertThat(registry.typeInfo("kept").orElseThrow().inputs())
            .extracting(PortSpec::id)
            .containsExactly("prev");
    }

    @Test
    void load_malformedJson_throwsAndKeepsPriorState() {
        BlockTypeRegistry registry = TestCatalogs.basic();

        assertThatThrownBy(() -> registry.load("{\"blockCategories\": ["))
            .isInstanceOf(CatalogLoadException.class);
        assertThatThrownBy(() -> registry.load("[]"))
            .isInstanceOf(CatalogLoadException.class);
        assertThatThrownBy(() -> registry.load("{\"blockCategories\": {}}"))
            .isInstanceOf(CatalogLoadException.class);
        assertThatThrownBy(() -> registry.load("  "))
            .isInstanceOf(CatalogLoadException.class);

        assertThat(registry.hasType("log")).isTrue();
        assertThat(registry.categories()).hasSize(2);
    }

    @Test
    void load_secondCatalog_mergesIntoRegistry() throws CatalogLoadException {
        BlockTypeRegistry registry = TestCatalogs.basic();

        registry.load("""
            {"blockCategories": [{"id": "extra", "blocks": [{"id": "beep", "codeTemplate": "BEEP;"}]}]}
            """);

        assertThat(registry.categories().keySet()).containsExactly("events", "actions", "extra");
        assertThat(registry.hasType("log")).isTrue();
        assertThat(registry.typeInfo("beep").orElseThrow().codeTemplate()).isEqualTo("BEEP;");
    }

    @Test
    void load_missingFile_throws() {
        BlockTypeRegistry registry = new BlockTypeRegistry();

        assertThatThrownBy(() -> registry.load(tempDir.resolve("missing.json")))
            .isInstanceOf(CatalogLoadException.class)
            .hasMessageContaining("missing.json");
    }

    @Test
    void load_file_readsCatalog() throws IOException, CatalogLoadException {
        Path catalog = tempDir.resolve("blocks.json");
        Files.writeString(catalog, TestCatalogs.BASIC);
        BlockTypeRegistry registry = new BlockTypeRegistry();

        registry.load(catalog);

        assertThat(registry.blockTypes()).hasSize(7);
    }

    @Test
    void load_declaredPropertyType_coercesDefault() throws CatalogLoadException {
        BlockTypeRegistry registry = new BlockTypeRegistry();

        registry.load("""
            {"blockCategories": [{"id": "c", "blocks": [{"id": "t", "properties": [
              {"id": "n", "type": "number", "default": "5"},
              {"id": "b", "type": "bool", "default": "yes"},
              {"id": "s", "default": true}
            ]}]}]}
            """);

        BlockTypeDefinition definition = registry.typeInfo("t").orElseThrow();
        assertThat(definition.property("n").orElseThrow().defaultLiteral().orElseThrow().render()).isEqualTo("5");
        assertThat(definition.property("n").orElseThrow().kind()).isEqualTo(ValueKind.NUMBER);
        assertThat(definition.property("b").orElseThrow().defaultLiteral()).contains(PropertyValue.ofString("yes"));
        assertThat(definition.property("s").orElseThrow().kind()).isEqualTo(ValueKind.BOOLEAN);
    }

    @Test
    void instantiate_knownType_buildsConnectorsAndDefaults() {
        BlockTypeRegistry registry = TestCatalogs.basic();

        BlockInstance block = registry.instantiate("sum").orElseThrow();

        assertThat(block.id()).matches("sum_[0-9a-f]{8}");
        assertThat(block.connectors()).containsExactly(
            new Connector(block.id(), "prev", ConnectorDirection.INPUT, PortKind.FLOW),
            new Connector(block.id(), "a", ConnectorDirection.INPUT, PortKind.DATA),
            new Connector(block.id(), "next", ConnectorDirection.OUTPUT, PortKind.FLOW),
            new Connector(block.id(), "result", ConnectorDirection.OUTPUT, PortKind.DATA)
        );
        assertThat(registry.instantiate("wait", "w1").orElseThrow().property("ms"))
            .contains(PropertyValue.ofNumber(100));
    }

    @Test
    void instantiate_twice_generatesDistinctIds() {
        BlockTypeRegistry registry = TestCatalogs.basic();

        String first = registry.instantiate("log").orElseThrow().id();
        String second = registry.instantiate("log").orElseThrow().id();

        assertThat(first).isNotEqualTo(second);
    }

    @Test
    void instantiate_unknownType_returnsEmpty() {
        assertThat(TestCatalogs.basic().instantiate("mystery")).isEmpty();
        assertThat(TestCatalogs.basic().typeInfo(null)).isEmpty();
    }

    @Test
    void withDefaultCatalog_loadsBundledBlocks() {
        BlockTypeRegistry registry = BlockTypeRegistry.withDefaultCatalog();

        assertThat(registry.hasType("app_on_start")).isTrue();
        assertThat(registry.categories()).containsKeys("events", "actions", "display", "storage");
        assertThat(registry.blockTypes())
            .allSatisfy(definition -> assertThat(definition.template().isEmpty()).isFalse());
    }
}
