package it.unimib.datai.berth.controlplane.deploy;

import it.unimib.datai.berth.common.model.Deployment;
import it.unimib.datai.berth.common.model.ServiceDefinition;

/**
 * @param authToken         token presented to the service's health endpoint
 * @param retryUntilHealthy keep polling until healthy or out of budget, instead of
 *                          returning the first observed status
 */
public record DeploymentRequest(
        ServiceDefinition definition,
        Deployment deployment,
        String authToken,
        boolean retryUntilHealthy
) {
    public DeploymentRequest {
        if (definition == null || deployment == null) {
            throw new IllegalArgumentException("definition and deployment are required");
        }
    }
}
