package it.unimib.datai.berth.controlplane.health;

import it.unimib.datai.berth.common.model.Deployment;
import it.unimib.datai.berth.common.model.HealthCheckKind;
import it.unimib.datai.berth.controlplane.cluster.ClusterClient;
import it.unimib.datai.berth.controlplane.cluster.ClusterRequestTimeoutException;
import it.unimib.datai.berth.controlplane.cluster.ClusterTask;
import it.unimib.datai.berth.controlplane.cluster.ExecResult;
import it.unimib.datai.berth.controlplane.cluster.ShellWords;
import it.unimib.datai.berth.controlplane.wait.Deadline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Runs the health check command inside the task's container; exit code 0 means healthy.
 */
@Component
public class CommandHealthProbe implements HealthProbe {
    private static final Logger log = LoggerFactory.getLogger(CommandHealthProbe.class);

    private final ClusterClient client;

    public CommandHealthProbe(ClusterClient client) {
        this.client = client;
    }

    @Override
    public HealthCheckKind kind() {
        return HealthCheckKind.COMMAND;
    }

    @Override
    public ProbeResult probe(Deployment deployment, ClusterTask task, String authToken, Deadline deadline) {
        if (task.containerId() == null) {
            return ProbeResult.unhealthy("The task " + task.id() + " has no container to run the healthcheck in");
        }
        Duration budget = deadline.remaining();
        if (budget.isZero()) {
            throw new ProbeTimeoutException(HealthMonitor.PROBE_TIMEOUT_REASON);
        }
        String command = deployment.service().healthCheck().value();
        log.debug("Running healthcheck command for deployment {}: {}", deployment.hash(), command);
        try {
            ExecResult result = client.exec(task.containerId(), ShellWords.split(command), budget);
            return new ProbeResult(result.succeeded(), result.output());
        } catch (ClusterRequestTimeoutException e) {
            throw new ProbeTimeoutException(HealthMonitor.PROBE_TIMEOUT_REASON, e);
        }
    }
}
