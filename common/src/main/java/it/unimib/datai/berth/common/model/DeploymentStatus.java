package it.unimib.datai.berth.common.model;

import java.util.EnumSet;
import java.util.Set;

public enum DeploymentStatus {
    QUEUED,
    CANCELLED,
    FAILED,
    PREPARING,
    STARTING,
    RESTARTING,
    HEALTHY,
    UNHEALTHY,
    OFFLINE;

    private static final Set<DeploymentStatus> TERMINAL = EnumSet.of(HEALTHY, UNHEALTHY, OFFLINE, CANCELLED, FAILED);
    private static final Set<DeploymentStatus> ACTIVE = EnumSet.of(HEALTHY, STARTING, RESTARTING);

    public boolean terminal() {
        return TERMINAL.contains(this);
    }

    /**
     * Statuses for which the workload is expected to have at least one task.
     */
    public boolean expectsTasks() {
        return ACTIVE.contains(this);
    }
}
