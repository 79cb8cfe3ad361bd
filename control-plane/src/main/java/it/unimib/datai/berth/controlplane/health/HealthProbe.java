package it.unimib.datai.berth.controlplane.health;

import it.unimib.datai.berth.common.model.Deployment;
import it.unimib.datai.berth.common.model.HealthCheckKind;
import it.unimib.datai.berth.controlplane.cluster.ClusterTask;
import it.unimib.datai.berth.controlplane.wait.Deadline;

/**
 * A user-defined readiness check run against a running task.
 */
public interface HealthProbe {

    HealthCheckKind kind();

    /**
     * @param deadline the health check's remaining budget; the probe must not outlive it
     * @throws ProbeTimeoutException when the deadline passes before the probe answers
     */
    ProbeResult probe(Deployment deployment, ClusterTask task, String authToken, Deadline deadline);
}
