package com.archforge.core.external;

import com.archforge.core.model.DiagramSources;

/**
 * External source of diagram text, keyed by project id.
 */
public interface DiagramSource {

    /**
     * Loads the diagram blocks of a project.
     *
     * @param projectId project id
     * @return diagram blocks; missing blocks are empty
     * @throws IllegalStateException if the source cannot be read
     */
    DiagramSources load(String projectId);
}
