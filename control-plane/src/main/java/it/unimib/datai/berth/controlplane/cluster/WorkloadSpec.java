package it.unimib.datai.berth.controlplane.cluster;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Declarative description of a replicated Swarm workload, independent of the wire format.
 */
public record WorkloadSpec(
        String name,
        String image,
        List<String> command,
        List<String> env,
        List<Mount> mounts,
        List<PublishedPort> ports,
        Map<String, String> labels,
        Map<String, String> containerLabels,
        List<NetworkAttachment> networks,
        RestartPolicy restartPolicy,
        int replicas
) {
    public WorkloadSpec {
        command = command == null ? List.of() : List.copyOf(command);
        env = env == null ? List.of() : List.copyOf(env);
        mounts = mounts == null ? List.of() : List.copyOf(mounts);
        ports = ports == null ? List.of() : List.copyOf(ports);
        labels = labels == null ? Map.of() : Map.copyOf(labels);
        containerLabels = containerLabels == null ? Map.of() : Map.copyOf(containerLabels);
        networks = networks == null ? List.of() : List.copyOf(networks);
    }

    public enum MountType {
        VOLUME,
        BIND
    }

    public record Mount(MountType type, String source, String target, boolean readOnly) {
    }

    public record PublishedPort(int published, int target) {
    }

    public record NetworkAttachment(String target, List<String> aliases) {
        public NetworkAttachment {
            aliases = aliases == null ? List.of() : List.copyOf(aliases);
        }
    }

    public record RestartPolicy(String condition, Duration delay, int maxAttempts) {
        public static RestartPolicy onFailure(Duration delay, int maxAttempts) {
            return new RestartPolicy("on-failure", delay, maxAttempts);
        }
    }
}
