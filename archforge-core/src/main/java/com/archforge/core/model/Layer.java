package com.archforge.core.model;

/**
 * Architectural layer a unit or symbol belongs to.
 *
 * <p>The {@link #prefix()} is the first segment of every symbol id in that layer
 * (e.g. {@code entity_Order_total}, {@code backend_OrderService_total}).
 */
public enum Layer {
    ENTITY("entity", "backend"),
    BACKEND("backend", "backend"),
    FRONTEND("frontend", "frontend"),
    SHARED("shared", "shared");

    private final String prefix;
    private final String outputRoot;

    Layer(String prefix, String outputRoot) {
        this.prefix = prefix;
        this.outputRoot = outputRoot;
    }

    /**
     * Returns the symbol id prefix for this layer.
     *
     * @return lowercase prefix
     */
    public String prefix() {
        return prefix;
    }

    /**
     * Returns the top-level output directory that holds this layer's artifacts.
     *
     * @return output root directory name
     */
    public String outputRoot() {
        return outputRoot;
    }
}
