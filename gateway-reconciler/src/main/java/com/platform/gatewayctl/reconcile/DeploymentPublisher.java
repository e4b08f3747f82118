package com.platform.gatewayctl.reconcile;

import com.platform.gatewayctl.client.ControlPlaneClient;
import com.platform.gatewayctl.model.Deployment;
import lombok.extern.slf4j.Slf4j;

/**
 * Publishes the current configuration of an API as a new deployment and repoints the stage to it.
 * Not idempotent: every call creates a deployment.
 */
@Slf4j
public class DeploymentPublisher {

    private final ControlPlaneClient client;

    public DeploymentPublisher(ControlPlaneClient client) {
        this.client = client;
    }

    public Deployment publish(String apiId, String stageName, String description) {
        Deployment deployment = client.createDeployment(apiId, stageName, description);
        log.info("Deployment {} published to stage {}: {}", deployment.id(), stageName, description);
        return deployment;
    }
}
