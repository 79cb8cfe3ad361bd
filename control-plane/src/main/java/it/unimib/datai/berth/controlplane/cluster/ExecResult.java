package it.unimib.datai.berth.controlplane.cluster;

public record ExecResult(int exitCode, String output) {
    public boolean succeeded() {
        return exitCode == 0;
    }
}
