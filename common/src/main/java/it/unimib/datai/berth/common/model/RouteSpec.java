package it.unimib.datai.berth.common.model;

/**
 * A public URL of a service: every request to {@code domain} whose path starts with
 * {@code basePath} is proxied to the service's HTTP port.
 */
public record RouteSpec(String domain, String basePath, boolean stripPrefix) {
    public RouteSpec {
        if (domain == null || domain.isBlank()) {
            throw new IllegalArgumentException("Route domain is required");
        }
        if (basePath == null || basePath.isBlank()) {
            basePath = "/";
        }
    }

    public static RouteSpec root(String domain) {
        return new RouteSpec(domain, "/", true);
    }
}
