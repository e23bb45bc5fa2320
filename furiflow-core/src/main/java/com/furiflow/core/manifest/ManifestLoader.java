package com.furiflow.core.manifest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads {@link AppManifest}s from JSON, YAML or {@code application.fam} files.
 *
 * <p>The format is chosen by file extension: {@code .yaml}/{@code .yml} for
 * YAML, {@code .fam} for the build tool descriptor, anything else for JSON.
 */
public final class ManifestLoader {

    private static final Logger log = LoggerFactory.getLogger(ManifestLoader.class);

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private static final Pattern FAM_APP_ID = Pattern.compile("appid=\"([^\"]+)\"");
    private static final Pattern FAM_NAME = Pattern.compile("\\bname=\"([^\"]+)\"");
    private static final Pattern FAM_ENTRY_POINT = Pattern.compile("entry_point=\"([^\"]+)\"");
    private static final Pattern FAM_STACK_SIZE = Pattern.compile("stack_size=(\\d+)");
    private static final Pattern FAM_VERSION = Pattern.compile("(?:fap_)?version=\"([^\"]+)\"");
    private static final Pattern FAM_ICON = Pattern.compile("(?:fap_)?icon=\"([^\"]+)\"");
    private static final Pattern FAM_REQUIRES = Pattern.compile("requires=\\[(.*?)]", Pattern.DOTALL);
    private static final Pattern QUOTED = Pattern.compile("\"([^\"]+)\"");

    private ManifestLoader() {
        // Utility class
    }

    /**
     * Loads a manifest file.
     *
     * @param file manifest file
     * @return parsed manifest
     * @throws IOException if the file cannot be read or parsed
     */
    public static AppManifest load(Path file) throws IOException {
        String fileName = file.getFileName().toString().toLowerCase(Locale.ROOT);
        log.debug("Loading manifest from: {}", file);
        String content = Files.readString(file);

        AppManifest manifest;
        if (fileName.endsWith(".yaml") || fileName.endsWith(".yml")) {
            manifest = YAML_MAPPER.readValue(content, AppManifest.class);
        } else if (fileName.endsWith(".fam")) {
            manifest = parseApplicationFam(content);
        } else {
            manifest = JSON_MAPPER.readValue(content, AppManifest.class);
        }

        if (manifest == null) {
            throw new IOException("Manifest file is empty: " + file);
        }
        log.info("Loaded manifest for app '{}' from: {}", manifest.appid(), file);
        return manifest;
    }

    /**
     * Parses a JSON manifest document.
     *
     * @param json manifest JSON
     * @return parsed manifest
     * @throws IOException if the JSON is malformed
     */
    public static AppManifest fromJson(String json) throws IOException {
        return JSON_MAPPER.readValue(json, AppManifest.class);
    }

    /**
     * Reads the fields of an {@code application.fam} descriptor.
     *
     * <p>Fields that are not present keep the manifest defaults.
     *
     * @param text descriptor text
     * @return parsed manifest
     */
    public static AppManifest parseApplicationFam(String text) {
        AppManifest defaults = AppManifest.defaults();

        String stackSize = find(FAM_STACK_SIZE, text);
        List<String> requires = defaults.requires();
        Matcher requiresMatcher = FAM_REQUIRES.matcher(text);
        if (requiresMatcher.find()) {
            requires = new ArrayList<>();
            Matcher quoted = QUOTED.matcher(requiresMatcher.group(1));
            while (quoted.find()) {
                requires.add(quoted.group(1));
            }
        }

        return new AppManifest(
            orDefault(find(FAM_NAME, text), defaults.name()),
            orDefault(find(FAM_APP_ID, text), defaults.appid()),
            orDefault(find(FAM_VERSION, text), defaults.version()),
            orDefault(find(FAM_ENTRY_POINT, text), defaults.entryPoint()),
            requires,
            stackSize != null ? Integer.valueOf(stackSize) : defaults.stackSize(),
            find(FAM_ICON, text)
        );
    }

    private static String find(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.group(1) : null;
    }

    private static String orDefault(String value, String defaultValue) {
        return value != null ? value : defaultValue;
    }
}
