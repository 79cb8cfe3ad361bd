package it.unimib.datai.berth.controlplane.deploy;

import it.unimib.datai.berth.common.model.ArchivedProject;
import it.unimib.datai.berth.common.model.ArchivedService;
import it.unimib.datai.berth.common.model.Deployment;
import it.unimib.datai.berth.common.model.DeploymentStatus;
import it.unimib.datai.berth.common.model.ServiceDefinition;
import it.unimib.datai.berth.common.model.VolumeMount;
import it.unimib.datai.berth.controlplane.cluster.ClusterNetwork;
import it.unimib.datai.berth.controlplane.cluster.ClusterVolume;
import it.unimib.datai.berth.controlplane.health.HealthCheckOutcome;
import it.unimib.datai.berth.controlplane.health.HealthCheckTimeoutException;
import it.unimib.datai.berth.controlplane.health.HealthMonitor;
import it.unimib.datai.berth.controlplane.provision.ProjectResourceProvisioner;
import it.unimib.datai.berth.controlplane.provision.WorkloadProvisioner;
import it.unimib.datai.berth.controlplane.proxy.ProxyRouteManager;
import it.unimib.datai.berth.controlplane.reclaim.ResourceReclaimer;
import it.unimib.datai.berth.controlplane.registry.ImageValidator;
import it.unimib.datai.berth.controlplane.wait.CancellationSignal;
import it.unimib.datai.berth.controlplane.wait.OperationCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Entry point of the control plane. Each public method is one unit of work, run to
 * completion on the caller's thread by the external job executor.
 */
@Service
public class DeploymentOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(DeploymentOrchestrator.class);

    private final ImageValidator imageValidator;
    private final WorkloadProvisioner workloadProvisioner;
    private final ProjectResourceProvisioner projectProvisioner;
    private final ProxyRouteManager routes;
    private final HealthMonitor healthMonitor;
    private final ResourceReclaimer reclaimer;
    private final DeploymentRecordStore records;
    private final DeploymentMetrics metrics;

    public DeploymentOrchestrator(ImageValidator imageValidator,
                                  WorkloadProvisioner workloadProvisioner,
                                  ProjectResourceProvisioner projectProvisioner,
                                  ProxyRouteManager routes,
                                  HealthMonitor healthMonitor,
                                  ResourceReclaimer reclaimer,
                                  DeploymentRecordStore records,
                                  DeploymentMetrics metrics) {
        this.imageValidator = imageValidator;
        this.workloadProvisioner = workloadProvisioner;
        this.projectProvisioner = projectProvisioner;
        this.routes = routes;
        this.healthMonitor = healthMonitor;
        this.reclaimer = reclaimer;
        this.records = records;
        this.metrics = metrics;
    }

    /**
     * Provisions the deployment, exposes it and waits for it to become healthy.
     *
     * @throws DeploymentFailedException when provisioning or routing fails; FAILED has been
     *                                   recorded by then
     * @throws HealthCheckTimeoutException when the health check had no time to observe anything;
     *                                   FAILED has been recorded by then
     */
    public HealthCheckOutcome deploy(DeploymentRequest request, CancellationSignal signal) {
        Deployment deployment = request.deployment();
        ServiceDefinition definition = request.definition();
        String hash = deployment.hash();

        if (signal.cancelled()) {
            return finish(hash, new HealthCheckOutcome(DeploymentStatus.CANCELLED, "The deployment was cancelled"));
        }

        record(hash, DeploymentStatus.PREPARING, null);
        try {
            imageValidator.validate(deployment.service());
            workloadProvisioner.provision(definition, deployment);
            record(hash, DeploymentStatus.STARTING, null);
            if (definition.httpPort().isPresent()) {
                routes.exposeService(definition);
                routes.exposeDeployment(deployment);
            }
        } catch (RuntimeException e) {
            log.error("Deployment {} of service {} failed: {}", hash, definition.slug(), e.getMessage(), e);
            record(hash, DeploymentStatus.FAILED, e.getMessage());
            metrics.deployment(DeploymentStatus.FAILED);
            throw new DeploymentFailedException(hash, "Deployment " + hash + " failed: " + e.getMessage(), e);
        }

        // The workload was just submitted: its tasks may not be listed yet.
        Deployment submitted = deployment.withStatus(DeploymentStatus.PREPARING, null);
        long start = System.nanoTime();
        HealthCheckOutcome outcome;
        try {
            outcome = healthMonitor.await(submitted, request.authToken(), request.retryUntilHealthy(), signal);
        } catch (OperationCancelledException e) {
            finish(hash, new HealthCheckOutcome(DeploymentStatus.CANCELLED, e.getMessage()));
            throw e;
        } catch (RuntimeException e) {
            log.error("Healthcheck of deployment {} failed: {}", hash, e.getMessage(), e);
            finish(hash, new HealthCheckOutcome(DeploymentStatus.FAILED, e.getMessage()));
            throw e;
        }
        metrics.healthCheck(Duration.ofNanos(System.nanoTime() - start));
        return finish(hash, outcome);
    }

    /**
     * Single health observation of an already running deployment, as done by periodic monitoring.
     */
    public HealthCheckOutcome monitor(Deployment deployment, String authToken, CancellationSignal signal) {
        HealthCheckOutcome outcome = healthMonitor.await(deployment, authToken, false, signal);
        if (outcome.status() != deployment.status()) {
            log.info("Deployment {} moved from {} to {}", deployment.hash(), deployment.status(), outcome.status());
        }
        record(deployment.hash(), outcome.status(), outcome.reason());
        return outcome;
    }

    public ClusterNetwork createProject(String projectId) {
        return projectProvisioner.createProjectResources(projectId);
    }

    public ClusterVolume createVolume(ServiceDefinition definition, VolumeMount mount) {
        return projectProvisioner.createVolume(definition, mount);
    }

    public void scaleDown(ServiceDefinition definition) {
        workloadProvisioner.scaleDown(definition);
    }

    public void archiveService(ArchivedService service, CancellationSignal signal) {
        try {
            reclaimer.reclaimService(service, signal);
            metrics.reclaim("service", true);
        } catch (RuntimeException e) {
            log.error("Failed to reclaim service {}: {}", service.slug(), e.getMessage(), e);
            metrics.reclaim("service", false);
            throw e;
        }
    }

    public void archiveProject(ArchivedProject project, CancellationSignal signal) {
        try {
            reclaimer.reclaimProject(project, signal);
            metrics.reclaim("project", true);
        } catch (RuntimeException e) {
            log.error("Failed to reclaim project {}: {}", project.slug(), e.getMessage(), e);
            metrics.reclaim("project", false);
            throw e;
        }
    }

    private HealthCheckOutcome finish(String hash, HealthCheckOutcome outcome) {
        record(hash, outcome.status(), outcome.reason());
        metrics.deployment(outcome.status());
        log.info("Deployment {} finished with {}", hash, outcome.status());
        return outcome;
    }

    private void record(String hash, DeploymentStatus status, String reason) {
        log.debug("Deployment {} -> {}", hash, status);
        records.updateStatus(hash, status, reason);
    }
}
