package com.archforge.core.model;

import java.util.Locale;

/**
 * Kind of a class-like unit in the architecture model.
 *
 * <p>Each kind knows its layer and where its artifact lives, so that parsers,
 * the registry and the planner agree on file paths without passing them around.
 */
public enum UnitKind {
    DATA_ENTITY(Layer.ENTITY, "models", ".ts"),
    SERVICE(Layer.BACKEND, "services", ".ts"),
    CONTROLLER(Layer.BACKEND, "controllers", ".ts"),
    REPOSITORY(Layer.BACKEND, "repositories", ".ts"),
    MIDDLEWARE(Layer.BACKEND, "middleware", ".ts"),
    UTILITY(Layer.BACKEND, "utils", ".ts"),
    UI_COMPONENT(Layer.FRONTEND, "components", ".tsx"),
    UI_PAGE(Layer.FRONTEND, "pages", ".tsx"),
    HOOK(Layer.FRONTEND, "hooks", ".ts");

    private final Layer layer;
    private final String folder;
    private final String extension;

    UnitKind(Layer layer, String folder, String extension) {
        this.layer = layer;
        this.folder = folder;
        this.extension = extension;
    }

    public Layer layer() {
        return layer;
    }

    public String folder() {
        return folder;
    }

    public String extension() {
        return extension;
    }

    /**
     * Returns the conventional artifact path for a unit of this kind.
     *
     * <p>Example: {@code DATA_ENTITY.defaultPath("Order")} returns
     * {@code backend/src/models/Order.ts}.
     *
     * @param unitName unit name
     * @return output-root relative path using forward slashes
     */
    public String defaultPath(String unitName) {
        return layer.outputRoot() + "/src/" + folder + "/" + unitName + extension;
    }

    /**
     * Returns true for the backend component kinds (everything in the backend layer).
     *
     * @return true if the kind lives in the backend layer
     */
    public boolean isBackendComponent() {
        return layer == Layer.BACKEND;
    }

    /**
     * Infers the kind of a class declared in a structural diagram from its name suffix.
     *
     * @param className declared class name
     * @return inferred kind, {@link #DATA_ENTITY} when no suffix matches
     */
    public static UnitKind fromClassName(String className) {
        if (className.endsWith("Controller")) {
            return CONTROLLER;
        }
        if (className.endsWith("Service")) {
            return SERVICE;
        }
        if (className.endsWith("Repository")) {
            return REPOSITORY;
        }
        if (className.endsWith("Middleware")) {
            return MIDDLEWARE;
        }
        if (className.endsWith("Util") || className.endsWith("Utils") || className.endsWith("Helper")) {
            return UTILITY;
        }
        return DATA_ENTITY;
    }

    /**
     * Infers the kind of a backend component node from its label.
     *
     * <p>Matching is case-insensitive and defaults to {@link #SERVICE}.
     *
     * @param label node label
     * @return inferred backend kind
     */
    public static UnitKind fromBackendLabel(String label) {
        String lower = label.toLowerCase(Locale.ROOT);
        if (lower.contains("controller")) {
            return CONTROLLER;
        }
        if (lower.contains("service")) {
            return SERVICE;
        }
        if (lower.contains("repository")) {
            return REPOSITORY;
        }
        if (lower.contains("middleware")) {
            return MIDDLEWARE;
        }
        if (lower.contains("util")) {
            return UTILITY;
        }
        if (lower.contains("model")) {
            return DATA_ENTITY;
        }
        return SERVICE;
    }

    /**
     * Infers the kind of a frontend component node from its label.
     *
     * @param label node label
     * @return {@link #UI_PAGE}, {@link #HOOK} or {@link #UI_COMPONENT}
     */
    public static UnitKind fromFrontendLabel(String label) {
        if (label.endsWith("Page") || label.endsWith("App")) {
            return UI_PAGE;
        }
        if (label.startsWith("use") && label.length() > 3 && Character.isUpperCase(label.charAt(3))) {
            return HOOK;
        }
        return UI_COMPONENT;
    }
}
