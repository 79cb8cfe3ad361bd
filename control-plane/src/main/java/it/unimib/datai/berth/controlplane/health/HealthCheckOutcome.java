package it.unimib.datai.berth.controlplane.health;

import it.unimib.datai.berth.common.model.DeploymentStatus;

public record HealthCheckOutcome(DeploymentStatus status, String reason) {
    public boolean healthy() {
        return status == DeploymentStatus.HEALTHY;
    }
}
