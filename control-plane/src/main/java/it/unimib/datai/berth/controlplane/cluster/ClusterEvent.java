package it.unimib.datai.berth.controlplane.cluster;

import java.util.Map;

public record ClusterEvent(String type, String action, String actorId, Map<String, String> attributes) {
    public ClusterEvent {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public String attribute(String key) {
        return attributes.get(key);
    }
}
