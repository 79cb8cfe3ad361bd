package it.unimib.datai.berth.controlplane.provision;

import it.unimib.datai.berth.common.model.Deployment;
import it.unimib.datai.berth.common.model.ServiceDefinition;
import it.unimib.datai.berth.controlplane.cluster.ClusterClient;
import it.unimib.datai.berth.controlplane.cluster.ClusterVolume;
import it.unimib.datai.berth.controlplane.cluster.ResourceLabels;
import it.unimib.datai.berth.controlplane.cluster.ResourceNames;
import it.unimib.datai.berth.controlplane.cluster.WorkloadHandle;
import it.unimib.datai.berth.controlplane.cluster.WorkloadInfo;
import it.unimib.datai.berth.controlplane.cluster.WorkloadSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Creates or updates the single workload backing a service. Calls converge: the same
 * deployment provisioned twice leaves one workload with the same spec.
 */
@Component
public class WorkloadProvisioner {
    private static final Logger log = LoggerFactory.getLogger(WorkloadProvisioner.class);

    private final ClusterClient client;
    private final WorkloadSpecBuilder specBuilder;

    public WorkloadProvisioner(ClusterClient client, WorkloadSpecBuilder specBuilder) {
        this.client = client;
        this.specBuilder = specBuilder;
    }

    public WorkloadHandle provision(ServiceDefinition definition, Deployment deployment) {
        ServiceDefinition snapshot = deployment.service();
        if (!definition.projectId().equals(snapshot.projectId())
                || !definition.serviceId().equals(snapshot.serviceId())) {
            throw new IllegalArgumentException("Deployment " + deployment.hash()
                    + " does not belong to service " + definition.serviceId());
        }

        checkHostPorts(snapshot);
        client.pullImage(snapshot.image(), snapshot.credentials());

        List<ClusterVolume> volumes = client.listVolumesByLabel(
                ResourceLabels.serviceVolumes(snapshot.projectId(), snapshot.serviceId()));
        WorkloadSpec spec = specBuilder.build(deployment, volumes);

        Optional<WorkloadInfo> existing = client.findWorkload(spec.name());
        if (existing.isPresent()) {
            log.info("Updating workload {} for deployment {}", spec.name(), deployment.hash());
            return client.updateWorkload(existing.get(), spec, snapshot.credentials());
        }
        log.info("Creating workload {} for deployment {}", spec.name(), deployment.hash());
        return client.createWorkload(spec, snapshot.credentials());
    }

    /**
     * Fails before anything is pulled or submitted when a host port of the service is
     * published by another workload. Ports already held by this service's own workload are
     * kept across redeployments.
     */
    void checkHostPorts(ServiceDefinition service) {
        List<WorkloadSpec.PublishedPort> ports = WorkloadSpecBuilder.publishedPorts(service.ports());
        if (ports.isEmpty()) {
            return;
        }
        String own = ResourceNames.workload(service.projectId(), service.serviceId());
        Map<Integer, String> published = client.publishedPorts();
        for (WorkloadSpec.PublishedPort port : ports) {
            String owner = published.get(port.published());
            if (owner != null && !owner.equals(own)) {
                throw new HostPortUnavailableException(port.published(), owner);
            }
        }
    }

    /**
     * Scales the service's workload to zero replicas, keeping it and its volumes.
     */
    public void scaleDown(ServiceDefinition definition) {
        String name = ResourceNames.workload(definition.projectId(), definition.serviceId());
        client.findWorkload(name).ifPresentOrElse(
                workload -> client.scaleWorkload(workload, 0),
                () -> log.debug("Workload {} does not exist, nothing to scale down", name));
    }
}
