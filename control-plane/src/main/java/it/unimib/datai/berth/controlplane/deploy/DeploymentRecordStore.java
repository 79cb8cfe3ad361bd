package it.unimib.datai.berth.controlplane.deploy;

import it.unimib.datai.berth.common.model.DeploymentStatus;

/**
 * Where deployment status transitions are recorded. The metadata store lives outside the
 * control plane; without one, transitions are only logged.
 */
@FunctionalInterface
public interface DeploymentRecordStore {
    void updateStatus(String deploymentHash, DeploymentStatus status, String reason);

    static DeploymentRecordStore noOp() {
        return (hash, status, reason) -> {};
    }
}
