package it.unimib.datai.berth.controlplane.health;

/**
 * The probe used up the remaining health check budget.
 */
public class ProbeTimeoutException extends RuntimeException {
    public ProbeTimeoutException(String message) {
        super(message);
    }

    public ProbeTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
