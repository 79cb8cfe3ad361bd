package it.unimib.datai.berth.controlplane.proxy;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import it.unimib.datai.berth.common.model.RouteSpec;
import it.unimib.datai.berth.controlplane.config.ProxyProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Builds the Caddy JSON nodes written through the admin API.
 */
@Component
public class ProxyRoutes {
    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    private final String authUpstream;
    private final String authIntrospectionPath;

    @Autowired
    public ProxyRoutes(ProxyProperties properties) {
        this(properties.authUpstreamOrDefault(), properties.authIntrospectionPathOrDefault());
    }

    ProxyRoutes(String authUpstream, String authIntrospectionPath) {
        this.authUpstream = authUpstream;
        this.authIntrospectionPath = authIntrospectionPath;
    }

    /**
     * Host-matched node holding every path route of {@code domain} in its subroute.
     */
    public ObjectNode domain(String domain) {
        ObjectNode node = JSON.objectNode();
        node.put("@id", domain);
        node.putArray("match").addObject().putArray("host").add(domain);
        ObjectNode subroute = node.putArray("handle").addObject();
        subroute.put("handler", "subroute");
        subroute.putArray("routes");
        node.put("terminal", true);
        return node;
    }

    public ObjectNode urlRoute(RouteSpec route, String workloadName, int port) {
        String prefix = RouteIds.pathPrefix(route.basePath());

        ArrayNode handlers = JSON.arrayNode();
        if (route.stripPrefix()) {
            ObjectNode rewrite = handlers.addObject();
            rewrite.put("handler", "rewrite");
            rewrite.put("strip_path_prefix", prefix);
        }
        handlers.add(streamingProxy(workloadName, port));

        ObjectNode node = JSON.objectNode();
        node.put("@id", RouteIds.routeId(route.domain(), route.basePath()));
        ObjectNode subroute = node.putArray("handle").addObject();
        subroute.put("handler", "subroute");
        subroute.putArray("routes").addObject().set("handle", handlers);
        node.putArray("match").addObject().putArray("path").add(prefix + "/*");
        return node;
    }

    /**
     * Host-matched node for a preview deployment. Every request is first replayed as a GET
     * against the platform's auth introspection endpoint and only reaches the workload when
     * that answers 2xx.
     */
    public ObjectNode previewRoute(String previewUrl, String workloadName, int port) {
        ObjectNode auth = JSON.objectNode();
        ObjectNode allowed = auth.putArray("handle_response").addObject();
        allowed.putObject("match").putArray("status_code").add(2);
        ObjectNode passThrough = allowed.putArray("routes").addObject().putArray("handle").addObject();
        passThrough.put("handler", "headers");
        passThrough.putObject("request");
        auth.put("handler", "reverse_proxy");
        ObjectNode forwarded = auth.putObject("headers").putObject("request").putObject("set");
        forwarded.putArray("X-Forwarded-Method").add("{http.request.method}");
        forwarded.putArray("X-Forwarded-Uri").add("{http.request.uri}");
        ObjectNode rewrite = auth.putObject("rewrite");
        rewrite.put("method", "GET");
        rewrite.put("uri", authIntrospectionPath);
        auth.putArray("upstreams").addObject().put("dial", authUpstream);

        ObjectNode node = JSON.objectNode();
        node.put("@id", previewUrl);
        node.putArray("match").addObject().putArray("host").add(previewUrl);
        ObjectNode subroute = node.putArray("handle").addObject();
        subroute.put("handler", "subroute");
        ArrayNode chain = subroute.putArray("routes").addObject().putArray("handle");
        chain.add(auth);
        chain.add(streamingProxy(workloadName, port));
        node.put("terminal", true);
        return node;
    }

    private static ObjectNode streamingProxy(String workloadName, int port) {
        ObjectNode proxy = JSON.objectNode();
        proxy.put("flush_interval", -1);
        proxy.put("handler", "reverse_proxy");
        proxy.putArray("upstreams").addObject().put("dial", workloadName + ":" + port);
        return proxy;
    }
}
