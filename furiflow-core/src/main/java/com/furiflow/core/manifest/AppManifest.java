package com.furiflow.core.manifest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Application manifest consumed by code generation.
 *
 * <p>Generation reads {@code appid}, {@code entry_point} and {@code requires};
 * the remaining fields only feed the {@code application.fam} output.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * name: "Hello Flipper"
 * appid: "hello_flipper"
 * version: "1.0"
 * entry_point: "hello_flipper_app"
 * requires:
 *   - gui
 *   - storage
 * stack_size: 2048
 * }</pre>
 *
 * @param name display name
 * @param appid application id, also the C identifier prefix
 * @param version application version
 * @param entryPoint entry point function name
 * @param requires required capabilities in declared order
 * @param stackSize stack size in bytes
 * @param icon optional icon path
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AppManifest(
    @JsonProperty("name") String name,
    @JsonProperty("appid") String appid,
    @JsonProperty("version") String version,
    @JsonProperty("entry_point") String entryPoint,
    @JsonProperty("requires") List<String> requires,
    @JsonProperty("stack_size") Integer stackSize,
    @JsonProperty("icon") String icon
) {
    public static final String DEFAULT_NAME = "New Flipper App";
    public static final String DEFAULT_APP_ID = "new_flipper_app";
    public static final String DEFAULT_VERSION = "1.0";
    public static final String DEFAULT_ENTRY_POINT = "app_main";
    public static final int DEFAULT_STACK_SIZE = 1024;

    /**
     * Compact constructor; missing fields take their defaults, except
     * {@code name} and {@code icon} which may stay null.
     */
    public AppManifest {
        if (appid == null) {
            appid = DEFAULT_APP_ID;
        }
        if (version == null) {
            version = DEFAULT_VERSION;
        }
        if (entryPoint == null) {
            entryPoint = DEFAULT_ENTRY_POINT;
        }
        requires = requires == null ? List.of() : requires.stream().filter(Objects::nonNull).toList();
        if (stackSize == null) {
            stackSize = DEFAULT_STACK_SIZE;
        }
    }

    /**
     * Creates the manifest a new project starts with.
     *
     * @return default manifest requiring {@code gui}
     */
    public static AppManifest defaults() {
        return new AppManifest(DEFAULT_NAME, DEFAULT_APP_ID, DEFAULT_VERSION, DEFAULT_ENTRY_POINT,
            List.of("gui"), DEFAULT_STACK_SIZE, null);
    }

    /**
     * Convenience factory for the fields code generation reads.
     *
     * @param appid application id
     * @param entryPoint entry point function name
     * @param requires required capabilities
     * @return manifest with default name, version and stack size
     */
    public static AppManifest of(String appid, String entryPoint, List<String> requires) {
        return new AppManifest(DEFAULT_NAME, appid, DEFAULT_VERSION, entryPoint, requires, DEFAULT_STACK_SIZE, null);
    }
}
