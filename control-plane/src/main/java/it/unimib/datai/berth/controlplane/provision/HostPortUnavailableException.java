package it.unimib.datai.berth.controlplane.provision;

/**
 * A host port the service publishes is already published by another workload.
 */
public class HostPortUnavailableException extends RuntimeException {
    private final int port;
    private final String owner;

    public HostPortUnavailableException(int port, String owner) {
        super("Host port " + port + " is already used by workload " + owner);
        this.port = port;
        this.owner = owner;
    }

    public int port() {
        return port;
    }

    public String owner() {
        return owner;
    }
}
