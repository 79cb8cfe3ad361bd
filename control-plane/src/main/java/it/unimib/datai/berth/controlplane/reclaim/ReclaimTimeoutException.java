package it.unimib.datai.berth.controlplane.reclaim;

public class ReclaimTimeoutException extends RuntimeException {
    public ReclaimTimeoutException(String message) {
        super(message);
    }
}
