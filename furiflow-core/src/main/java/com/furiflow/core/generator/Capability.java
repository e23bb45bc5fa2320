package com.furiflow.core.generator;

import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed table of platform capabilities an application may require.
 *
 * <p>Each capability contributes include directives, app-state fields, and
 * init/cleanup statements. Declaration order is the table order: state fields
 * and init statements follow it, cleanup statements run in reverse.
 */
public enum Capability {

    GUI("gui",
        List.of("#include <gui/view_port.h>"),
        List.of(),
        List.of(),
        List.of()),

    STORAGE("storage",
        List.of("#include <storage/storage.h>"),
        List.of("Storage* storage;"),
        List.of("app->storage = furi_record_open(RECORD_STORAGE);"),
        List.of("furi_record_close(RECORD_STORAGE);")),

    SUBGHZ("subghz",
        List.of("#include <lib/subghz/subghz.h>"),
        List.of("SubGhz* subghz;"),
        List.of("app->subghz = furi_record_open(RECORD_SUBGHZ);"),
        List.of("furi_record_close(RECORD_SUBGHZ);")),

    NFC("nfc",
        List.of("#include <lib/nfc/nfc.h>"),
        List.of("Nfc* nfc;"),
        List.of("app->nfc = furi_record_open(RECORD_NFC);"),
        List.of("furi_record_close(RECORD_NFC);")),

    INFRARED("infrared",
        List.of("#include <lib/infrared/infrared.h>"),
        List.of("Infrared* infrared;"),
        List.of("app->infrared = furi_record_open(RECORD_INFRARED);"),
        List.of("furi_record_close(RECORD_INFRARED);")),

    BT("bt",
        List.of("#include <bt/bt_service.h>"),
        List.of("BtService* bt;"),
        List.of("app->bt = furi_record_open(RECORD_BT);"),
        List.of("furi_record_close(RECORD_BT);"));

    private static final Logger log = LoggerFactory.getLogger(Capability.class);

    private final String id;
    private final List<String> includes;
    private final List<String> stateFields;
    private final List<String> initCode;
    private final List<String> cleanupCode;

    Capability(String id, List<String> includes, List<String> stateFields,
               List<String> initCode, List<String> cleanupCode) {
        this.id = id;
        this.includes = includes;
        this.stateFields = stateFields;
        this.initCode = initCode;
        this.cleanupCode = cleanupCode;
    }

    public String id() {
        return id;
    }

    public List<String> includes() {
        return includes;
    }

    public List<String> stateFields() {
        return stateFields;
    }

    public List<String> initCode() {
        return initCode;
    }

    public List<String> cleanupCode() {
        return cleanupCode;
    }

    /**
     * Looks up a capability by manifest name.
     *
     * @param id capability name, matched exactly
     * @return matching capability, or empty if the name is not in the table
     */
    public static Optional<Capability> fromId(String id) {
        for (Capability capability : values()) {
            if (capability.id.equals(id)) {
                return Optional.of(capability);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves manifest requirements to a deduplicated set in table order.
     * Unknown names are logged and ignored.
     *
     * @param requires requirement names as declared
     * @return required capabilities, iterated in table order
     */
    public static Set<Capability> resolve(Collection<String> requires) {
        Set<Capability> capabilities = EnumSet.noneOf(Capability.class);
        if (requires == null) {
            return capabilities;
        }
        for (String requirement : requires) {
            Optional<Capability> capability = fromId(requirement);
            if (capability.isPresent()) {
                capabilities.add(capability.get());
            } else {
                log.warn("Ignoring unknown capability: {}", requirement);
            }
        }
        return capabilities;
    }
}
