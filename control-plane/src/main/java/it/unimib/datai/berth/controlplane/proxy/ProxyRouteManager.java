package it.unimib.datai.berth.controlplane.proxy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import it.unimib.datai.berth.common.model.ArchivedService;
import it.unimib.datai.berth.common.model.Deployment;
import it.unimib.datai.berth.common.model.PortBinding;
import it.unimib.datai.berth.common.model.RouteSpec;
import it.unimib.datai.berth.common.model.ServiceDefinition;
import it.unimib.datai.berth.controlplane.cluster.ResourceNames;
import it.unimib.datai.berth.controlplane.config.ProxyProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Keeps the proxy's routing tree in line with the live services.
 *
 * <p>Every operation is idempotent per route id. Nothing is cached: the admin API is read
 * right before each mutation, and each write to a domain's route list is verified by
 * reading the route id back. A write that did not stick (a concurrent writer replaced the
 * list) is redone from a fresh read.</p>
 */
@Component
public class ProxyRouteManager {
    private static final Logger log = LoggerFactory.getLogger(ProxyRouteManager.class);

    private final ProxyAdminClient admin;
    private final ProxyRoutes routes;
    private final int maxWriteAttempts;

    @Autowired
    public ProxyRouteManager(ProxyAdminClient admin, ProxyRoutes routes, ProxyProperties properties) {
        this(admin, routes, properties.maxWriteAttemptsOrDefault());
    }

    ProxyRouteManager(ProxyAdminClient admin, ProxyRoutes routes, int maxWriteAttempts) {
        this.admin = admin;
        this.routes = routes;
        this.maxWriteAttempts = maxWriteAttempts;
    }

    public void ensureDomain(String domain) {
        if (admin.getNode(domain).isEmpty()) {
            admin.appendServerRoute(routes.domain(domain));
            log.info("Created proxy domain {}", domain);
        }
        ensureLogger(domain);
    }

    public void ensureUrlRoute(RouteSpec route, String workloadName, int port) {
        String routeId = RouteIds.routeId(route.domain(), route.basePath());
        for (int attempt = 1; attempt <= maxWriteAttempts; attempt++) {
            if (admin.getNode(routeId).isPresent()) {
                return;
            }
            ArrayNode current = admin.getRoutes(route.domain())
                    .orElseThrow(() -> new ProxyAdminException(404, "Proxy domain " + route.domain() + " does not exist"));
            List<JsonNode> updated = new ArrayList<>();
            current.forEach(updated::add);
            updated.add(routes.urlRoute(route, workloadName, port));
            admin.replaceRoutes(route.domain(), toArray(RouteOrdering.sort(updated)));

            if (admin.getNode(routeId).isPresent()) {
                log.info("Added proxy route {} -> {}:{}", routeId, workloadName, port);
                return;
            }
            log.warn("Proxy route {} missing after write (attempt {}/{}), retrying", routeId, attempt, maxWriteAttempts);
        }
        throw new ProxyAdminException(409, "Proxy route " + routeId + " was not persisted after "
                + maxWriteAttempts + " attempts");
    }

    public void ensurePreviewRoute(String previewUrl, String workloadName, int port) {
        if (admin.getNode(previewUrl).isEmpty()) {
            admin.appendServerRoute(routes.previewRoute(previewUrl, workloadName, port));
            log.info("Added preview route {} -> {}:{}", previewUrl, workloadName, port);
        }
        ensureLogger(previewUrl);
    }

    public void removeUrlRoute(RouteSpec route) {
        String routeId = RouteIds.routeId(route.domain(), route.basePath());
        for (int attempt = 1; attempt <= maxWriteAttempts; attempt++) {
            Optional<ArrayNode> current = admin.getRoutes(route.domain());
            if (current.isEmpty()) {
                return;
            }
            List<JsonNode> remaining = new ArrayList<>();
            for (JsonNode node : current.get()) {
                if (!routeId.equals(node.path("@id").asText(null))) {
                    remaining.add(node);
                }
            }
            if (remaining.isEmpty()) {
                removeDomain(route.domain());
                return;
            }
            if (remaining.size() == current.get().size()) {
                return;
            }
            admin.deleteNode(routeId);
            if (admin.getNode(routeId).isEmpty()) {
                log.info("Removed proxy route {}", routeId);
                return;
            }
            log.warn("Proxy route {} still present after delete (attempt {}/{}), retrying",
                    routeId, attempt, maxWriteAttempts);
        }
        throw new ProxyAdminException(409, "Proxy route " + routeId + " could not be removed after "
                + maxWriteAttempts + " attempts");
    }

    public void removeDomain(String domain) {
        boolean removed = admin.deleteNode(domain);
        admin.unregisterLogger(domain);
        if (removed) {
            log.info("Removed proxy domain {}", domain);
        }
    }

    public void removePreviewRoute(String previewUrl) {
        removeDomain(previewUrl);
    }

    /**
     * Routes every URL of the service to its HTTP port.
     *
     * @throws IllegalStateException if the service has no proxy-routed port
     */
    public void exposeService(ServiceDefinition service) {
        PortBinding httpPort = service.httpPort().orElseThrow(() -> new IllegalStateException(
                "Cannot expose service " + service.slug() + " without a HTTP port"));
        String workloadName = ResourceNames.workload(service.projectId(), service.serviceId());
        for (RouteSpec route : service.routes()) {
            ensureDomain(route.domain());
            ensureUrlRoute(route, workloadName, httpPort.containerPort());
        }
    }

    /**
     * Adds the preview route of a deployment, when it has a URL and the service an HTTP port.
     */
    public void exposeDeployment(Deployment deployment) {
        ServiceDefinition service = deployment.service();
        if (deployment.previewUrl() == null || service.httpPort().isEmpty()) {
            return;
        }
        ensurePreviewRoute(deployment.previewUrl(),
                ResourceNames.workload(service.projectId(), service.serviceId()),
                service.httpPort().get().containerPort());
    }

    public void unexposeService(ArchivedService service) {
        for (RouteSpec route : service.routes()) {
            removeUrlRoute(route);
        }
        for (String previewUrl : service.previewUrls()) {
            removePreviewRoute(previewUrl);
        }
    }

    private void ensureLogger(String domain) {
        if (!admin.loggerRegistered(domain)) {
            admin.registerLogger(domain);
        }
    }

    private static ArrayNode toArray(List<JsonNode> nodes) {
        ArrayNode array = JsonNodeFactory.instance.arrayNode();
        array.addAll(nodes);
        return array;
    }
}
