package it.unimib.datai.berth.controlplane.cluster;

import java.util.Map;

public record ClusterNetwork(String id, String name, Map<String, String> labels) {
    public ClusterNetwork {
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }
}
