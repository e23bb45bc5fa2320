package com.furiflow.core.model;

/**
 * Semantic family of a connector.
 *
 * <p>{@link #FLOW} connectors transfer control and drive traversal order.
 * {@link #DATA} connectors carry values; they are validated when connected
 * but never resolved during code generation.
 */
public enum PortKind {
    FLOW("flow"),
    DATA("data");

    private final String id;

    PortKind(String id) {
        this.id = id;
    }

    /**
     * Returns the catalog identifier of this kind.
     *
     * @return {@code "flow"} or {@code "data"}
     */
    public String id() {
        return id;
    }

    /**
     * Resolves a catalog port type. Anything other than {@code flow} is data.
     *
     * @param id port type from the catalog, may be null
     * @return resolved kind
     */
    public static PortKind fromId(String id) {
        return FLOW.id.equalsIgnoreCase(id) ? FLOW : DATA;
    }
}
