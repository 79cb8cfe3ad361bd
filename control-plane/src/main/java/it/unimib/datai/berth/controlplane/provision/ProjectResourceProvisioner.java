package it.unimib.datai.berth.controlplane.provision;

import it.unimib.datai.berth.common.model.ServiceDefinition;
import it.unimib.datai.berth.common.model.VolumeMount;
import it.unimib.datai.berth.controlplane.cluster.ClusterClient;
import it.unimib.datai.berth.controlplane.cluster.ClusterNetwork;
import it.unimib.datai.berth.controlplane.cluster.ClusterVolume;
import it.unimib.datai.berth.controlplane.cluster.ResourceLabels;
import it.unimib.datai.berth.controlplane.cluster.ResourceNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Project-scoped resources that outlive individual deployments.
 */
@Component
public class ProjectResourceProvisioner {
    private static final Logger log = LoggerFactory.getLogger(ProjectResourceProvisioner.class);

    private final ClusterClient client;
    private final ProxyNetworkAttacher proxyNetworks;

    public ProjectResourceProvisioner(ClusterClient client, ProxyNetworkAttacher proxyNetworks) {
        this.client = client;
        this.proxyNetworks = proxyNetworks;
    }

    public ClusterNetwork createProjectResources(String projectId) {
        String name = ResourceNames.network(projectId);
        ClusterNetwork network = client.findNetwork(name)
                .orElseGet(() -> client.createNetwork(name, ResourceLabels.project(projectId)));
        proxyNetworks.attach(network.id());
        log.info("Project {} resources ready (network {})", projectId, network.name());
        return network;
    }

    public ClusterVolume createVolume(ServiceDefinition service, VolumeMount mount) {
        if (mount.hostBound()) {
            throw new IllegalArgumentException("Volume " + mount.id() + " is bound to host path " + mount.hostPath());
        }
        if (mount.createdAt() == null) {
            throw new IllegalArgumentException("Volume " + mount.id() + " has no creation time");
        }
        String name = ResourceNames.volume(mount);
        ClusterVolume volume = client.createVolume(name,
                ResourceLabels.volume(service.projectId(), service.serviceId(), mount.id()));
        log.info("Created volume {} for service {}", name, service.serviceId());
        return volume;
    }
}
