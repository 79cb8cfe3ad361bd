package it.unimib.datai.berth.controlplane.proxy;

/**
 * The proxy admin API rejected a request, could not be reached, or silently dropped a write.
 */
public class ProxyAdminException extends RuntimeException {
    private final int status;

    public ProxyAdminException(int status, String message) {
        super(message);
        this.status = status;
    }

    public ProxyAdminException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
    }

    public int status() {
        return status;
    }
}
