package it.unimib.datai.berth.common.model;

import java.util.List;
import java.util.Objects;

/**
 * Point-in-time copy of a service taken when it is archived. It carries everything needed
 * to locate and destroy the service's cluster resources after the live records are gone.
 */
public record ArchivedService(
        String originalId,
        String projectOriginalId,
        String slug,
        ImageReference image,
        String command,
        RegistryCredentials credentials,
        List<ArchivedVolume> volumes,
        List<ArchivedPort> ports,
        List<EnvVar> env,
        List<RouteSpec> routes,
        List<String> previewUrls
) {
    public ArchivedService {
        Objects.requireNonNull(originalId, "originalId");
        Objects.requireNonNull(projectOriginalId, "projectOriginalId");
        volumes = volumes == null ? List.of() : List.copyOf(volumes);
        ports = ports == null ? List.of() : List.copyOf(ports);
        env = env == null ? List.of() : List.copyOf(env);
        routes = routes == null ? List.of() : List.copyOf(routes);
        previewUrls = previewUrls == null ? List.of() : List.copyOf(previewUrls);
    }

    /**
     * Snapshots {@code service} together with its deployments. The archived image tag is the
     * one of the latest production deployment, {@code latest} when there is none.
     */
    public static ArchivedService snapshotOf(ServiceDefinition service, List<Deployment> deployments) {
        List<Deployment> all = deployments == null ? List.of() : deployments;
        String tag = all.stream()
                .filter(Deployment::currentProduction)
                .reduce((first, second) -> second)
                .map(d -> d.service().image().tag())
                .orElse("latest");
        List<String> previewUrls = all.stream()
                .map(Deployment::previewUrl)
                .filter(Objects::nonNull)
                .distinct()
                .toList();
        return new ArchivedService(
                service.serviceId(),
                service.projectId(),
                service.slug(),
                service.image().withTag(tag),
                service.command(),
                service.credentials(),
                service.volumes().stream().map(ArchivedVolume::of).toList(),
                service.ports().stream().map(ArchivedPort::of).toList(),
                service.env(),
                service.routes(),
                previewUrls
        );
    }
}
