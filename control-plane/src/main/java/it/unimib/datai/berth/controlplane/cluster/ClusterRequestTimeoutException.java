package it.unimib.datai.berth.controlplane.cluster;

public class ClusterRequestTimeoutException extends ClusterApiException {
    public ClusterRequestTimeoutException(String message, Throwable cause) {
        super(0, message, cause);
    }
}
