package it.unimib.datai.berth.controlplane.cluster;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conjunction of {@code key=value} label matches, the only query shape used against
 * cluster resources.
 */
public record LabelSelector(Map<String, String> labels) {
    public LabelSelector {
        labels = labels == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(labels));
    }

    public static LabelSelector of(Map<String, String> labels) {
        return new LabelSelector(labels);
    }

    public static LabelSelector of(String key, String value) {
        return new LabelSelector(Map.of(key, value));
    }

    public List<String> filterValues() {
        return labels.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .toList();
    }
}
