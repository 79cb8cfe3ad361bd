package it.unimib.datai.berth.common.model;

import java.util.Set;

/**
 * A container port, optionally published on the cluster hosts.
 * A binding without host port is served through the reverse proxy.
 */
public record PortBinding(Integer hostPort, int containerPort) {
    private static final Set<Integer> HTTP_PORTS = Set.of(80, 443);

    public PortBinding {
        if (containerPort < 1 || containerPort > 65535) {
            throw new IllegalArgumentException("Invalid container port: " + containerPort);
        }
        if (hostPort != null && (hostPort < 1 || hostPort > 65535)) {
            throw new IllegalArgumentException("Invalid host port: " + hostPort);
        }
    }

    public static PortBinding http(int containerPort) {
        return new PortBinding(null, containerPort);
    }

    public boolean proxyRouted() {
        return hostPort == null;
    }

    public boolean publishedOnHost() {
        return hostPort != null && !HTTP_PORTS.contains(hostPort);
    }
}
