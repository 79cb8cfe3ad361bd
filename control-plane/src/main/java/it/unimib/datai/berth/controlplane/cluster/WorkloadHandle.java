package it.unimib.datai.berth.controlplane.cluster;

public record WorkloadHandle(String id, String name) {
}
