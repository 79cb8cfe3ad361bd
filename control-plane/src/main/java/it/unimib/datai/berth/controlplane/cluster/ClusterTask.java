package it.unimib.datai.berth.controlplane.cluster;

/**
 * One scheduled attempt of a workload. {@code versionIndex} is the cluster's write version,
 * higher means more recently updated.
 */
public record ClusterTask(
        String id,
        long versionIndex,
        TaskState state,
        String containerId,
        Integer exitCode,
        String error,
        String message
) {
    public String statusReason() {
        return error != null ? error : message;
    }
}
