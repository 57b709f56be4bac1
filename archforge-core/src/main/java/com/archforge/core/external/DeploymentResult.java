package com.archforge.core.external;

import java.util.List;
import java.util.Optional;

/**
 * Result of a deployment.
 *
 * @param url public URL of the deployment, null when nothing was deployed
 * @param errors deployment errors
 */
public record DeploymentResult(String url, List<String> errors) {

    /**
     * Compact constructor with validation.
     */
    public DeploymentResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static DeploymentResult skipped() {
        return new DeploymentResult(null, List.of());
    }

    public static DeploymentResult failed(String error) {
        return new DeploymentResult(null, List.of(error));
    }

    public Optional<String> deployedUrl() {
        return Optional.ofNullable(url);
    }

    public boolean succeeded() {
        return errors.isEmpty();
    }
}
