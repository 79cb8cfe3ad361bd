package it.unimib.datai.berth.controlplane.provision;

import it.unimib.datai.berth.common.model.Deployment;
import it.unimib.datai.berth.common.model.EnvVar;
import it.unimib.datai.berth.common.model.PortBinding;
import it.unimib.datai.berth.common.model.ServiceDefinition;
import it.unimib.datai.berth.common.model.VolumeMount;
import it.unimib.datai.berth.controlplane.cluster.ClusterResourceNotFoundException;
import it.unimib.datai.berth.controlplane.cluster.ClusterVolume;
import it.unimib.datai.berth.controlplane.cluster.ResourceLabels;
import it.unimib.datai.berth.controlplane.cluster.ResourceNames;
import it.unimib.datai.berth.controlplane.cluster.ShellWords;
import it.unimib.datai.berth.controlplane.cluster.WorkloadSpec;
import it.unimib.datai.berth.controlplane.config.PlatformProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Translates a deployment into the declarative workload spec submitted to the cluster.
 */
@Component
public class WorkloadSpecBuilder {
    private static final Logger log = LoggerFactory.getLogger(WorkloadSpecBuilder.class);

    static final Duration RESTART_DELAY = Duration.ofSeconds(5);
    static final int RESTART_MAX_ATTEMPTS = 3;

    private final String privateDomain;

    @Autowired
    public WorkloadSpecBuilder(PlatformProperties platformProperties) {
        this(platformProperties.privateDomainOrDefault());
    }

    WorkloadSpecBuilder(String privateDomain) {
        this.privateDomain = privateDomain;
    }

    /**
     * @param volumes the service's cluster volumes, in the order the cluster listed them
     */
    public WorkloadSpec build(Deployment deployment, List<ClusterVolume> volumes) {
        ServiceDefinition service = deployment.service();

        Map<String, String> labels = ResourceLabels.workload(service.projectId(), deployment.hash());
        Map<String, String> containerLabels = new LinkedHashMap<>(labels);

        return new WorkloadSpec(
                ResourceNames.workload(service.projectId(), service.serviceId()),
                service.image().fullName(),
                service.command() == null || service.command().isBlank()
                        ? List.of()
                        : ShellWords.split(service.command()),
                service.env().stream().map(EnvVar::asAssignment).toList(),
                mounts(service, volumes),
                publishedPorts(service.ports()),
                labels,
                containerLabels,
                List.of(new WorkloadSpec.NetworkAttachment(
                        ResourceNames.network(service.projectId()),
                        deployment.networkAliases(privateDomain))),
                WorkloadSpec.RestartPolicy.onFailure(RESTART_DELAY, RESTART_MAX_ATTEMPTS),
                1);
    }

    /**
     * Ports published 1:1 on every cluster node. Bindings without a host port, or bound to
     * 80/443, are served by the reverse proxy and never published.
     */
    static List<WorkloadSpec.PublishedPort> publishedPorts(List<PortBinding> ports) {
        return ports.stream()
                .filter(PortBinding::publishedOnHost)
                .map(p -> new WorkloadSpec.PublishedPort(p.hostPort(), p.containerPort()))
                .toList();
    }

    static List<WorkloadSpec.Mount> mounts(ServiceDefinition service, List<ClusterVolume> volumes) {
        Map<String, VolumeMount> namedById = new LinkedHashMap<>();
        List<VolumeMount> hostBound = new ArrayList<>();
        for (VolumeMount mount : service.volumes()) {
            if (mount.hostBound()) {
                hostBound.add(mount);
            } else {
                namedById.put(mount.id(), mount);
            }
        }

        List<WorkloadSpec.Mount> mounts = new ArrayList<>();
        Set<String> bound = new HashSet<>();
        for (ClusterVolume volume : volumes) {
            String volumeId = volume.label(ResourceLabels.VOLUME_ID);
            VolumeMount mount = volumeId != null ? namedById.get(volumeId) : null;
            if (mount == null) {
                log.debug("Cluster volume {} has no matching mount on service {}", volume.name(), service.serviceId());
                continue;
            }
            if (bound.add(volumeId)) {
                mounts.add(new WorkloadSpec.Mount(WorkloadSpec.MountType.VOLUME, volume.name(),
                        mount.containerPath(), mount.mode().readOnly()));
            }
        }

        for (VolumeMount mount : namedById.values()) {
            if (!bound.contains(mount.id())) {
                throw new ClusterResourceNotFoundException(
                        "Volume " + mount.id() + " of service " + service.serviceId() + " has not been created", null);
            }
        }

        for (VolumeMount mount : hostBound) {
            mounts.add(new WorkloadSpec.Mount(WorkloadSpec.MountType.BIND, mount.hostPath(),
                    mount.containerPath(), mount.mode().readOnly()));
        }
        return mounts;
    }
}
