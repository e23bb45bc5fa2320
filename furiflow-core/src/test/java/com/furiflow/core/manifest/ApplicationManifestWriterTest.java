package com.furiflow.core.manifest;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ApplicationManifestWriterTest {

    @Test
    void render_fullManifest_writesDescriptor() {
        AppManifest manifest = new AppManifest("Blinky", "blinky", "1.2", "blinky_app",
            List.of("gui", "storage"), 2048, "assets/icons/blinky.png");

        String descriptor = ApplicationManifestWriter.render(manifest);

        assertThat(descriptor).isEqualTo("""
            App(
                appid="blinky",
                name="Blinky",
                apptype=FlipperAppType.EXTERNAL,
                entry_point="blinky_app",
                stack_size=2048,
                fap_version="1.2",
                fap_icon="blinky.png",
                requires=[
                    "gui",
                    "storage",
                ],
            )
            """);
    }

    @Test
    void render_withoutIconOrRequirements_omitsThoseEntries() {
        AppManifest manifest = new AppManifest(null, "tiny", "1.0", "tiny_main", List.of(), 1024, null);

        String descriptor = ApplicationManifestWriter.render(manifest);

        assertThat(descriptor)
            .contains("name=\"tiny\",")
            .doesNotContain("fap_icon")
            .doesNotContain("requires");
    }
}
