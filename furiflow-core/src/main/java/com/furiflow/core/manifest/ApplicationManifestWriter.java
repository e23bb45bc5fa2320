package com.furiflow.core.manifest;

import java.nio.file.Path;

/**
 * Renders the {@code application.fam} descriptor the Flipper build tool reads.
 */
public final class ApplicationManifestWriter {

    /** File name of the rendered descriptor. */
    public static final String FILE_NAME = "application.fam";

    private ApplicationManifestWriter() {
        // Utility class
    }

    /**
     * Renders a manifest.
     *
     * <p>The icon, when set, is referenced by file name only; the caller is
     * responsible for copying the icon next to the descriptor.
     *
     * @param manifest manifest to render
     * @return descriptor text
     */
    public static String render(AppManifest manifest) {
        StringBuilder sb = new StringBuilder();
        sb.append("App(\n");
        appendQuoted(sb, "appid", manifest.appid());
        appendQuoted(sb, "name", manifest.name() != null ? manifest.name() : manifest.appid());
        sb.append("    apptype=FlipperAppType.EXTERNAL,\n");
        appendQuoted(sb, "entry_point", manifest.entryPoint());
        sb.append("    stack_size=").append(manifest.stackSize()).append(",\n");
        appendQuoted(sb, "fap_version", manifest.version());

        if (manifest.icon() != null && !manifest.icon().isBlank()) {
            Path iconName = Path.of(manifest.icon()).getFileName();
            appendQuoted(sb, "fap_icon", iconName != null ? iconName.toString() : manifest.icon());
        }

        if (!manifest.requires().isEmpty()) {
            sb.append("    requires=[\n");
            for (String requirement : manifest.requires()) {
                sb.append("        \"").append(requirement).append("\",\n");
            }
            sb.append("    ],\n");
        }

        sb.append(")\n");
        return sb.toString();
    }

    private static void appendQuoted(StringBuilder sb, String key, String value) {
        sb.append("    ").append(key).append("=\"").append(value).append("\",\n");
    }
}
