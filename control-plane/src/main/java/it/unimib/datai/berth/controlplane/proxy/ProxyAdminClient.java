package it.unimib.datai.berth.controlplane.proxy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import it.unimib.datai.berth.controlplane.config.ProxyProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Thin client over the Caddy admin API. Nodes are addressed by their {@code @id}.
 */
@Component
public class ProxyAdminClient {
    private static final Logger log = LoggerFactory.getLogger(ProxyAdminClient.class);

    private final RestClient restClient;
    private final String serverName;
    private final String serverId;

    @Autowired
    public ProxyAdminClient(@Qualifier("proxyAdminRestClient") RestClient restClient, ProxyProperties properties) {
        this(restClient, properties.serverNameOrDefault(), properties.serverIdOrDefault());
    }

    ProxyAdminClient(RestClient restClient, String serverName, String serverId) {
        this.restClient = restClient;
        this.serverName = serverName;
        this.serverId = serverId;
    }

    public Optional<JsonNode> getNode(String id) {
        return read("get node " + id, "/id/{id}", id);
    }

    public Optional<ArrayNode> getRoutes(String domain) {
        return read("get routes of " + domain, "/id/{domain}/handle/0/routes", domain)
                .map(node -> node instanceof ArrayNode routes ? routes : null);
    }

    public void appendServerRoute(JsonNode route) {
        write(HttpMethod.POST, route, false, "add route " + route.path("@id").asText(),
                "/config/apps/http/servers/{server}/routes", serverName);
    }

    public void replaceRoutes(String domain, ArrayNode routes) {
        write(HttpMethod.PATCH, routes, false, "replace routes of " + domain,
                "/id/{domain}/handle/0/routes", domain);
    }

    /**
     * @return false when there was no node with this id
     */
    public boolean deleteNode(String id) {
        return write(HttpMethod.DELETE, null, true, "delete node " + id, "/id/{id}", id);
    }

    public boolean loggerRegistered(String domain) {
        return read("get logger of " + domain, "/id/{server}/logs/logger_names/{domain}", serverId, domain)
                .isPresent();
    }

    public void registerLogger(String domain) {
        write(HttpMethod.POST, "\"\"", false, "register logger of " + domain,
                "/id/{server}/logs/logger_names/{domain}", serverId, domain);
    }

    public boolean unregisterLogger(String domain) {
        return write(HttpMethod.DELETE, null, true, "unregister logger of " + domain,
                "/id/{server}/logs/logger_names/{domain}", serverId, domain);
    }

    private Optional<JsonNode> read(String action, String uri, Object... uriVariables) {
        try {
            return restClient.get()
                    .uri(uri, uriVariables)
                    .accept(MediaType.APPLICATION_JSON)
                    .exchange((request, response) -> {
                        if (response.getStatusCode().value() == 404) {
                            return Optional.<JsonNode>empty();
                        }
                        if (!response.getStatusCode().is2xxSuccessful()) {
                            throw error(action, response);
                        }
                        JsonNode body = response.bodyTo(JsonNode.class);
                        return body == null || body.isNull() ? Optional.<JsonNode>empty() : Optional.of(body);
                    });
        } catch (RestClientException e) {
            throw new ProxyAdminException("Proxy admin API unreachable during " + action + ": " + e.getMessage(), e);
        }
    }

    private boolean write(HttpMethod method, Object body, boolean tolerateMissing, String action,
                          String uri, Object... uriVariables) {
        log.debug("Proxy admin: {}", action);
        try {
            RestClient.RequestBodySpec spec = restClient.method(method).uri(uri, uriVariables);
            if (body != null) {
                spec.contentType(MediaType.APPLICATION_JSON).body(body);
            }
            return spec.exchange((request, response) -> {
                if (tolerateMissing && response.getStatusCode().value() == 404) {
                    return false;
                }
                if (!response.getStatusCode().is2xxSuccessful()) {
                    throw error(action, response);
                }
                return true;
            });
        } catch (RestClientException e) {
            throw new ProxyAdminException("Proxy admin API unreachable during " + action + ": " + e.getMessage(), e);
        }
    }

    private static ProxyAdminException error(String action, ClientHttpResponse response) throws IOException {
        int status = response.getStatusCode().value();
        String body = new String(response.getBody().readAllBytes(), StandardCharsets.UTF_8).trim();
        return new ProxyAdminException(status, "Proxy admin HTTP " + status + " during " + action
                + (body.isEmpty() ? "" : ": " + body));
    }
}
