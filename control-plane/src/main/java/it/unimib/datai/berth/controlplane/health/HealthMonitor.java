package it.unimib.datai.berth.controlplane.health;

import it.unimib.datai.berth.common.model.Deployment;
import it.unimib.datai.berth.common.model.DeploymentStatus;
import it.unimib.datai.berth.common.model.HealthCheckKind;
import it.unimib.datai.berth.common.model.HealthCheckSpec;
import it.unimib.datai.berth.common.model.ServiceDefinition;
import it.unimib.datai.berth.controlplane.cluster.ClusterApiException;
import it.unimib.datai.berth.controlplane.cluster.ClusterClient;
import it.unimib.datai.berth.controlplane.cluster.ClusterTask;
import it.unimib.datai.berth.controlplane.cluster.ResourceLabels;
import it.unimib.datai.berth.controlplane.cluster.ResourceNames;
import it.unimib.datai.berth.controlplane.cluster.TaskState;
import it.unimib.datai.berth.controlplane.config.HealthCheckProperties;
import it.unimib.datai.berth.controlplane.wait.CancellationSignal;
import it.unimib.datai.berth.controlplane.wait.Deadline;
import it.unimib.datai.berth.controlplane.wait.OperationCancelledException;
import it.unimib.datai.berth.controlplane.wait.WaitClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Polls a deployment's tasks until they reach a conclusive state or the health check
 * budget runs out.
 *
 * <p>Each iteration lists the tasks carrying the deployment hash, maps the most recent one
 * to a status and, when it is running and the service declares a health check, runs the
 * matching {@link HealthProbe}. Without {@code retryUntilHealthy} the first observation is
 * returned as is.</p>
 */
@Component
public class HealthMonitor {
    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    static final String INITIAL_REASON =
            "The service failed to meet the healthcheck requirements when starting the service.";
    static final String SCALED_DOWN_REASON =
            "An unknown error occurred, did you manually scale down the service?";
    static final String PROBE_TIMEOUT_REASON =
            "The service failed to meet the healthcheck in the timeout provided";
    static final String CANCELLED_REASON = "The deployment was cancelled";
    static final String TASKS_UNAVAILABLE_REASON = "Could not read the state of the service: ";

    private static final double MIN_BUDGET_SECONDS = 1.0;

    private final ClusterClient client;
    private final Map<HealthCheckKind, HealthProbe> probes;
    private final HealthCheckProperties properties;
    private final WaitClock clock;

    @Autowired
    public HealthMonitor(ClusterClient client, List<HealthProbe> probes, HealthCheckProperties properties) {
        this(client, probes, properties, WaitClock.system());
    }

    HealthMonitor(ClusterClient client, List<HealthProbe> probes, HealthCheckProperties properties, WaitClock clock) {
        this.client = client;
        this.probes = new EnumMap<>(HealthCheckKind.class);
        for (HealthProbe probe : probes) {
            this.probes.put(probe.kind(), probe);
        }
        this.properties = properties;
        this.clock = clock;
    }

    public HealthCheckOutcome await(Deployment deployment, String authToken, boolean retryUntilHealthy,
                                    CancellationSignal signal) {
        ServiceDefinition service = deployment.service();
        HealthCheckSpec healthCheck = service.healthCheck();
        int timeoutSeconds = healthCheck != null
                ? healthCheck.timeoutSeconds()
                : properties.defaultTimeoutSecondsOrDefault();
        Deadline deadline = Deadline.after(clock, Duration.ofSeconds(timeoutSeconds));
        String workloadName = ResourceNames.workload(service.projectId(), service.serviceId());
        double waitInterval = properties.waitIntervalSecondsOrDefault();

        DeploymentStatus status = DeploymentStatus.UNHEALTHY;
        String reason = INITIAL_REASON;
        int attempt = 0;

        while (!deadline.expired()) {
            attempt++;
            if (signal.cancelled()) {
                log.info("Healthcheck of deployment {} cancelled at attempt #{}", deployment.hash(), attempt);
                return new HealthCheckOutcome(DeploymentStatus.CANCELLED, CANCELLED_REASON);
            }

            List<ClusterTask> tasks;
            try {
                tasks = client.listTasksByLabel(workloadName, ResourceLabels.DEPLOYMENT_HASH, deployment.hash());
            } catch (ClusterApiException e) {
                log.warn("Healthcheck of deployment {} | attempt #{} | listing tasks failed: {}",
                        deployment.hash(), attempt, e.getMessage());
                tasks = null;
                status = DeploymentStatus.UNHEALTHY;
                reason = TASKS_UNAVAILABLE_REASON + e.getMessage();
            }
            double timeLeft = deadline.remainingSeconds();
            if (timeLeft < MIN_BUDGET_SECONDS) {
                if (reason == null) {
                    throw new HealthCheckTimeoutException("Failed to run the healthcheck because there is no time left,"
                            + " please make sure the healthcheck timeout is large enough");
                }
                break;
            }
            double sleepSeconds = Math.min(waitInterval, Math.min(timeLeft - 1, timeLeft));
            log.debug("Healthcheck of deployment {} | attempt #{} | {}s left",
                    deployment.hash(), attempt, String.format("%.2f", timeLeft));

            if (tasks == null) {
                if (!retryUntilHealthy) {
                    return new HealthCheckOutcome(status, reason);
                }
                sleep(sleepSeconds, deployment);
                continue;
            }

            if (tasks.isEmpty()) {
                if (deployment.status().expectsTasks()) {
                    return new HealthCheckOutcome(DeploymentStatus.UNHEALTHY, SCALED_DOWN_REASON);
                }
                sleep(sleepSeconds, deployment);
                continue;
            }

            ClusterTask task = TaskStatusMapper.mostRecent(tasks).orElseThrow();
            HealthCheckOutcome observed = TaskStatusMapper.outcomeOf(task, tasks.size());
            status = observed.status();
            reason = observed.reason();

            boolean probeTimedOut = false;
            if (task.state() == TaskState.RUNNING && healthCheck != null) {
                Optional<HealthProbe> probe = Optional.ofNullable(probes.get(healthCheck.kind()));
                if (probe.isEmpty()) {
                    log.warn("No probe registered for healthcheck kind {}", healthCheck.kind());
                } else {
                    try {
                        ProbeResult result = probe.get().probe(deployment, task, authToken, deadline);
                        status = result.healthy() ? DeploymentStatus.HEALTHY : DeploymentStatus.UNHEALTHY;
                        reason = result.output();
                    } catch (ProbeTimeoutException e) {
                        status = DeploymentStatus.UNHEALTHY;
                        reason = e.getMessage();
                        probeTimedOut = true;
                    } catch (ClusterApiException e) {
                        // the container can stop between the task listing and the probe
                        log.warn("Healthcheck of deployment {} | attempt #{} | probe failed: {}",
                                deployment.hash(), attempt, e.getMessage());
                        status = DeploymentStatus.UNHEALTHY;
                        reason = e.getMessage();
                    }
                }
            }
            if (probeTimedOut) {
                break;
            }

            if (retryUntilHealthy && status != DeploymentStatus.HEALTHY) {
                log.debug("Healthcheck of deployment {} | attempt #{} | {}, retrying in {}s",
                        deployment.hash(), attempt, status, String.format("%.2f", sleepSeconds));
                sleep(sleepSeconds, deployment);
                continue;
            }

            log.info("Healthcheck of deployment {} finished after {} attempt(s) with {}",
                    deployment.hash(), attempt, status);
            return new HealthCheckOutcome(status, reason);
        }

        log.info("Healthcheck of deployment {} ran out of time with {}", deployment.hash(), status);
        return new HealthCheckOutcome(status, reason);
    }

    private void sleep(double seconds, Deployment deployment) {
        if (seconds <= 0) {
            return;
        }
        try {
            clock.sleep(Duration.ofNanos((long) (seconds * 1_000_000_000L)));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("Interrupted during healthcheck of deployment " + deployment.hash());
        }
    }
}
