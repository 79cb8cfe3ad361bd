package it.unimib.datai.berth.controlplane.cluster;

import java.util.LinkedHashMap;
import java.util.Map;

public final class ResourceLabels {
    public static final String MANAGED = "berth-managed";
    public static final String PROJECT = "berth-project";
    public static final String PARENT = "parent";
    public static final String VOLUME_ID = "volume-id";
    public static final String DEPLOYMENT_HASH = "deployment_hash";

    private ResourceLabels() {
    }

    public static Map<String, String> project(String projectId) {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(MANAGED, "true");
        labels.put(PROJECT, projectId);
        return labels;
    }

    public static Map<String, String> volume(String projectId, String serviceId, String volumeId) {
        Map<String, String> labels = project(projectId);
        labels.put(PARENT, serviceId);
        labels.put(VOLUME_ID, volumeId);
        return labels;
    }

    public static Map<String, String> workload(String projectId, String deploymentHash) {
        Map<String, String> labels = project(projectId);
        labels.put(DEPLOYMENT_HASH, deploymentHash);
        return labels;
    }

    public static LabelSelector serviceVolumes(String projectId, String serviceId) {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(PROJECT, projectId);
        labels.put(PARENT, serviceId);
        return LabelSelector.of(labels);
    }
}
