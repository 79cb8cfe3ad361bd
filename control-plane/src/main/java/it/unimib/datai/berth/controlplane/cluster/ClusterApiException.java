package it.unimib.datai.berth.controlplane.cluster;

/**
 * The cluster API answered with an unexpected status, or could not be reached (status 0).
 */
public class ClusterApiException extends RuntimeException {
    private final int status;
    private final String body;

    public ClusterApiException(int status, String message, String body) {
        super(message);
        this.status = status;
        this.body = body;
    }

    public ClusterApiException(int status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.body = null;
    }

    public int status() {
        return status;
    }

    public String body() {
        return body;
    }
}
