package it.unimib.datai.berth.controlplane.deploy;

public class DeploymentFailedException extends RuntimeException {
    private final String deploymentHash;

    public DeploymentFailedException(String deploymentHash, String message, Throwable cause) {
        super(message, cause);
        this.deploymentHash = deploymentHash;
    }

    public String deploymentHash() {
        return deploymentHash;
    }
}
