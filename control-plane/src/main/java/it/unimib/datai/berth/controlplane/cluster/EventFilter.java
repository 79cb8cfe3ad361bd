package it.unimib.datai.berth.controlplane.cluster;

/**
 * Restricts the cluster event stream to one object type and, optionally, one workload
 * (matched by id or by name).
 */
public record EventFilter(String type, String workloadId) {

    public static EventFilter workload(String workloadId) {
        return new EventFilter("service", workloadId);
    }

    public boolean matches(ClusterEvent event) {
        if (type != null && !type.equals(event.type())) {
            return false;
        }
        return workloadId == null
                || workloadId.equals(event.actorId())
                || workloadId.equals(event.attribute("name"));
    }
}
