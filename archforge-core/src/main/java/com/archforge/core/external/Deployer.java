package com.archforge.core.external;

import com.archforge.core.model.InfraContext;

import java.nio.file.Path;

/**
 * External deployment collaborator.
 */
public interface Deployer {

    String getId();

    /**
     * Deploys the composed output.
     *
     * @param outputRoot root of the composed output
     * @param infraContext infrastructure settings from the model
     * @return deployment URL and errors; never null
     */
    DeploymentResult deploy(Path outputRoot, InfraContext infraContext);
}
