package it.unimib.datai.berth.controlplane.wait;

public class OperationCancelledException extends RuntimeException {
    public OperationCancelledException(String message) {
        super(message);
    }
}
