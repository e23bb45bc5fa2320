package com.furiflow.core.manifest;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Checks a manifest for the fields the build toolchain requires.
 */
public final class ManifestValidator {

    private static final Pattern APP_ID = Pattern.compile("^[a-z0-9_]+$");

    private ManifestValidator() {
        // Utility class
    }

    /**
     * Validates a manifest.
     *
     * @param manifest manifest to check
     * @return problems found, empty when the manifest is valid
     */
    public static List<String> validate(AppManifest manifest) {
        List<String> problems = new ArrayList<>();

        if (isBlank(manifest.name())) {
            problems.add("App Name is required");
        }
        if (isBlank(manifest.appid())) {
            problems.add("App ID is required");
        } else if (!APP_ID.matcher(manifest.appid()).matches()) {
            problems.add("App ID must contain only lowercase letters, numbers, and underscores");
        }
        if (isBlank(manifest.version())) {
            problems.add("Version is required");
        }
        if (isBlank(manifest.entryPoint())) {
            problems.add("Entry Point is required");
        }
        if (manifest.requires().isEmpty()) {
            problems.add("At least one requirement must be selected");
        }

        return problems;
    }

    public static boolean isValid(AppManifest manifest) {
        return validate(manifest).isEmpty();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
