package com.archforge.core.external.impl;

import com.archforge.core.external.Deployer;
import com.archforge.core.external.DeploymentResult;
import com.archforge.core.model.InfraContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Deployer that records the skip and deploys nothing.
 */
public class NoOpDeployer implements Deployer {

    private static final Logger log = LoggerFactory.getLogger(NoOpDeployer.class);

    @Override
    public String getId() {
        return "none";
    }

    @Override
    public DeploymentResult deploy(Path outputRoot, InfraContext infraContext) {
        log.info("Deployment skipped for {} (stage: {})", outputRoot, infraContext.get("stage").orElse("default"));
        return DeploymentResult.skipped();
    }
}
