package it.unimib.datai.berth.common.model;

import java.util.List;
import java.util.Optional;

/**
 * A logical service built from a container image, as edited in the metadata store.
 */
public record ServiceDefinition(
        String projectId,
        String serviceId,
        String slug,
        ImageReference image,
        String command,
        RegistryCredentials credentials,
        List<PortBinding> ports,
        List<VolumeMount> volumes,
        List<EnvVar> env,
        HealthCheckSpec healthCheck,
        String networkAlias,
        List<RouteSpec> routes
) {
    public ServiceDefinition {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("projectId is required");
        }
        if (serviceId == null || serviceId.isBlank()) {
            throw new IllegalArgumentException("serviceId is required");
        }
        ports = ports == null ? List.of() : List.copyOf(ports);
        volumes = volumes == null ? List.of() : List.copyOf(volumes);
        env = env == null ? List.of() : List.copyOf(env);
        routes = routes == null ? List.of() : List.copyOf(routes);
    }

    /**
     * The port the reverse proxy dials, i.e. the first binding without a host port.
     */
    public Optional<PortBinding> httpPort() {
        return ports.stream().filter(PortBinding::proxyRouted).findFirst();
    }

    public List<String> networkAliases(String privateDomain) {
        if (networkAlias == null || networkAlias.isBlank()) {
            return List.of();
        }
        return List.of(networkAlias + "." + privateDomain, networkAlias);
    }

    public ServiceDefinition withImageTag(String tag) {
        return new ServiceDefinition(projectId, serviceId, slug, image.withTag(tag), command, credentials,
                ports, volumes, env, healthCheck, networkAlias, routes);
    }
}
