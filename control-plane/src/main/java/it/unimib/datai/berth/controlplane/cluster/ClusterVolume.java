package it.unimib.datai.berth.controlplane.cluster;

import java.util.Map;

public record ClusterVolume(String name, Map<String, String> labels) {
    public ClusterVolume {
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }

    public String label(String key) {
        return labels.get(key);
    }
}
