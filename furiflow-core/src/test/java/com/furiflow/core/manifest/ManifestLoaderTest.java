package com.furiflow.core.manifest;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ManifestLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_yaml_readsAllFields() throws IOException {
        Path file = tempDir.resolve("manifest.yaml");
        Files.writeString(file, """
            name: "Blinky"
            appid: blinky
            version: "2.1"
            entry_point: blinky_app
            requires: [gui, storage]
            stack_size: 2048
            icon: assets/blinky.png
            unknown_field: ignored
            """);

        AppManifest manifest = ManifestLoader.load(file);

        assertThat(manifest.name()).isEqualTo("Blinky");
        assertThat(manifest.appid()).isEqualTo("blinky");
        assertThat(manifest.version()).isEqualTo("2.1");
        assertThat(manifest.entryPoint()).isEqualTo("blinky_app");
        assertThat(manifest.requires()).containsExactly("gui", "storage");
        assertThat(manifest.stackSize()).isEqualTo(2048);
        assertThat(manifest.icon()).isEqualTo("assets/blinky.png");
    }

    @Test
    void load_jsonWithMissingFields_appliesDefaults() throws IOException {
        Path file = tempDir.resolve("manifest.json");
        Files.writeString(file, "{\"appid\": \"demo\"}");

        AppManifest manifest = ManifestLoader.load(file);

        assertThat(manifest.appid()).isEqualTo("demo");
        assertThat(manifest.entryPoint()).isEqualTo(AppManifest.DEFAULT_ENTRY_POINT);
        assertThat(manifest.version()).isEqualTo(AppManifest.DEFAULT_VERSION);
        assertThat(manifest.stackSize()).isEqualTo(AppManifest.DEFAULT_STACK_SIZE);
        assertThat(manifest.requires()).isEmpty();
    }

    @Test
    void fromJson_nullRequirement_isDropped() throws IOException {
        AppManifest manifest = ManifestLoader.fromJson(
            "{\"appid\": \"demo\", \"requires\": [\"gui\", null, \"storage\"]}");

        assertThat(manifest.requires()).containsExactly("gui", "storage");
    }

    @Test
    void load_applicationFam_readsDescriptor() throws IOException {
        Path file = tempDir.resolve("application.fam");
        Files.writeString(file, ApplicationManifestWriter.render(
            new AppManifest("Blinky", "blinky", "1.2", "blinky_app", List.of("gui", "nfc"), 4096, "icon.png")));

        AppManifest manifest = ManifestLoader.load(file);

        assertThat(manifest.name()).isEqualTo("Blinky");
        assertThat(manifest.appid()).isEqualTo("blinky");
        assertThat(manifest.version()).isEqualTo("1.2");
        assertThat(manifest.entryPoint()).isEqualTo("blinky_app");
        assertThat(manifest.requires()).containsExactly("gui", "nfc");
        assertThat(manifest.stackSize()).isEqualTo(4096);
        assertThat(manifest.icon()).isEqualTo("icon.png");
    }

    @Test
    void parseApplicationFam_sparseDescriptor_usesDefaults() {
        AppManifest manifest = ManifestLoader.parseApplicationFam("App(appid=\"tiny\")");

        assertThat(manifest.appid()).isEqualTo("tiny");
        assertThat(manifest.name()).isEqualTo(AppManifest.DEFAULT_NAME);
        assertThat(manifest.requires()).containsExactly("gui");
        assertThat(manifest.icon()).isNull();
    }

    @Test
    void load_malformedJson_throws() throws IOException {
        Path file = tempDir.resolve("manifest.json");
        Files.writeString(file, "{\"appid\": ");

        assertThatThrownBy(() -> ManifestLoader.load(file)).isInstanceOf(IOException.class);
    }

    @Test
    void load_missingFile_throws() {
        assertThatThrownBy(() -> ManifestLoader.load(tempDir.resolve("none.yaml"))).isInstanceOf(IOException.class);
    }
}
