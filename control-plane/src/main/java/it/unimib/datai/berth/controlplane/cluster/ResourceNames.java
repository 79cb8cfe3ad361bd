package it.unimib.datai.berth.controlplane.cluster;

import it.unimib.datai.berth.common.model.VolumeMount;

import java.time.Instant;

/**
 * Cluster resource names. All of them are pure functions of metadata ids so that repeated
 * operations address the same resources.
 */
public final class ResourceNames {
    private ResourceNames() {
    }

    public static String workload(String projectId, String serviceId) {
        return "srv-" + projectId + "-" + serviceId;
    }

    public static String network(String projectId) {
        return "net-" + projectId;
    }

    public static String volume(VolumeMount mount) {
        return volume(mount.id(), mount.createdAt());
    }

    public static String volume(String volumeId, Instant createdAt) {
        long micros = createdAt.getNano() / 1_000L;
        return "vol-" + volumeId + "-" + createdAt.getEpochSecond() + String.format("%06d", micros);
    }
}
