package it.unimib.datai.berth.controlplane.health;

public record ProbeResult(boolean healthy, String output) {
    public static ProbeResult healthy(String output) {
        return new ProbeResult(true, output);
    }

    public static ProbeResult unhealthy(String output) {
        return new ProbeResult(false, output);
    }
}
