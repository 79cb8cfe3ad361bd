package it.unimib.datai.berth.controlplane.health;

public class HealthCheckTimeoutException extends RuntimeException {
    public HealthCheckTimeoutException(String message) {
        super(message);
    }
}
