package com.archforge.core.planner;

import com.archforge.core.model.Layer;

/**
 * Generation task categories. Each category has exactly one generator.
 */
public enum TaskCategory {
    BACKEND(Layer.BACKEND),
    FRONTEND(Layer.FRONTEND),
    SHARED(Layer.SHARED),
    TEST(Layer.BACKEND),
    BUILD(Layer.SHARED),
    DEPLOY(Layer.SHARED);

    private final Layer layer;

    TaskCategory(Layer layer) {
        this.layer = layer;
    }

    /**
     * Returns the layer under which names exported by this category's artifacts are registered.
     *
     * @return export layer
     */
    public Layer layer() {
        return layer;
    }
}
