package it.unimib.datai.berth.controlplane.cluster;

public class ClusterResourceNotFoundException extends ClusterApiException {
    public ClusterResourceNotFoundException(String message, String body) {
        super(404, message, body);
    }
}
